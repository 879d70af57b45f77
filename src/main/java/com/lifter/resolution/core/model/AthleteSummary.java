package com.lifter.resolution.core.model;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.Map;

/**
 * One athlete row of a division ranking query.
 *
 * @param name           athlete name as shown in the rankings
 * @param stableId       the ranking site's member id, if the row links to one
 * @param club           club name
 * @param competitionAge age at the time of the lift
 * @param nationalRank   rank within the division
 * @param gender         gender as listed
 * @param wso            weightlifting state organization
 * @param level          competition level
 * @param total          total in kg
 * @param liftDate       date of the ranked lift
 */
public record AthleteSummary(
        String name,
        Long stableId,
        String club,
        Integer competitionAge,
        Integer nationalRank,
        String gender,
        String wso,
        String level,
        Double total,
        LocalDate liftDate
) {

    /**
     * Values this row can contribute to a stored result. Null values are omitted.
     */
    public Map<ResultField, Object> resultAttributes() {
        Map<ResultField, Object> values = new EnumMap<>(ResultField.class);
        putIfPresent(values, ResultField.CLUB, club);
        putIfPresent(values, ResultField.WSO, wso);
        putIfPresent(values, ResultField.COMPETITION_AGE, competitionAge);
        putIfPresent(values, ResultField.NATIONAL_RANK, nationalRank);
        putIfPresent(values, ResultField.GENDER, gender);
        return values;
    }

    /**
     * Values this row can contribute to a lifter record. Null values are omitted.
     */
    public Map<LifterField, Object> lifterAttributes() {
        Map<LifterField, Object> values = new EnumMap<>(LifterField.class);
        putIfPresent(values, LifterField.STABLE_ID, stableId);
        putIfPresent(values, LifterField.GENDER, gender);
        return values;
    }

    private static <K> void putIfPresent(Map<K, Object> values, K key, Object value) {
        if (value != null) {
            values.put(key, value);
        }
    }
}
