package com.lifter.resolution.api;

import com.lifter.resolution.core.model.MeetReference;
import com.lifter.resolution.core.model.ResultRow;
import com.lifter.resolution.logging.LogContext;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Everything the resolver knows about a row: the candidate name plus its meet context.
 *
 * @param correlationId    id tying logs and audit entries to this row
 * @param name             the raw athlete name
 * @param meetId           meet id
 * @param meetName         meet name as published
 * @param date             meet date
 * @param ageCategory      e.g. "Open Women's"
 * @param weightClass      e.g. "63kg"
 * @param bodyweightKg     declared bodyweight, may be null
 * @param totalKg          declared total, may be null
 * @param stableId         stable id supplied with the row, may be null
 * @param membershipNumber federation membership number, may be null
 * @param countryCode      3-letter federation code, may be null
 * @param gender           gender, may be null
 * @param birthYear        birth year, may be null
 */
public record ResolutionContext(
        String correlationId,
        String name,
        Long meetId,
        String meetName,
        LocalDate date,
        String ageCategory,
        String weightClass,
        Double bodyweightKg,
        Double totalKg,
        Long stableId,
        String membershipNumber,
        String countryCode,
        String gender,
        Integer birthYear
) {
    public ResolutionContext {
        Objects.requireNonNull(name, "name is required");
        if (correlationId == null) {
            correlationId = LogContext.generateCorrelationId();
        }
    }

    /**
     * Builds the context for a feed row.
     */
    public static ResolutionContext fromRow(ResultRow row) {
        return builder()
                .name(row.getLifterName())
                .meetId(row.getMeetId())
                .meetName(row.getMeetName())
                .date(row.getDate())
                .ageCategory(row.getAgeCategory())
                .weightClass(row.getWeightClass())
                .bodyweightKg(row.getBodyweightKg())
                .totalKg(row.getTotal())
                .stableId(row.getStableId())
                .membershipNumber(row.getMembershipNumber())
                .countryCode(row.getCountryCode())
                .gender(row.getGender())
                .birthYear(row.getBirthYear())
                .build();
    }

    public MeetReference meet() {
        return new MeetReference(meetId, meetName, date);
    }

    public boolean hasDivision() {
        return date != null && ageCategory != null && !ageCategory.isBlank()
                && weightClass != null && !weightClass.isBlank();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String correlationId;
        private String name;
        private Long meetId;
        private String meetName;
        private LocalDate date;
        private String ageCategory;
        private String weightClass;
        private Double bodyweightKg;
        private Double totalKg;
        private Long stableId;
        private String membershipNumber;
        private String countryCode;
        private String gender;
        private Integer birthYear;

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder meetId(Long meetId) {
            this.meetId = meetId;
            return this;
        }

        public Builder meetName(String meetName) {
            this.meetName = meetName;
            return this;
        }

        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder ageCategory(String ageCategory) {
            this.ageCategory = ageCategory;
            return this;
        }

        public Builder weightClass(String weightClass) {
            this.weightClass = weightClass;
            return this;
        }

        public Builder bodyweightKg(Double bodyweightKg) {
            this.bodyweightKg = bodyweightKg;
            return this;
        }

        public Builder totalKg(Double totalKg) {
            this.totalKg = totalKg;
            return this;
        }

        public Builder stableId(Long stableId) {
            this.stableId = stableId;
            return this;
        }

        public Builder membershipNumber(String membershipNumber) {
            this.membershipNumber = membershipNumber;
            return this;
        }

        public Builder countryCode(String countryCode) {
            this.countryCode = countryCode;
            return this;
        }

        public Builder gender(String gender) {
            this.gender = gender;
            return this;
        }

        public Builder birthYear(Integer birthYear) {
            this.birthYear = birthYear;
            return this;
        }

        public ResolutionContext build() {
            return new ResolutionContext(correlationId, name, meetId, meetName, date, ageCategory, weightClass,
                    bodyweightKg, totalKg, stableId, membershipNumber, countryCode, gender, birthYear);
        }
    }
}
