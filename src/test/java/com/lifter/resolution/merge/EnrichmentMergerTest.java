package com.lifter.resolution.merge;

import com.lifter.resolution.core.model.Lifter;
import com.lifter.resolution.core.model.LifterField;
import com.lifter.resolution.core.model.MeetResult;
import com.lifter.resolution.core.model.ResultField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EnrichmentMergerTest {

    @Nested
    @DisplayName("Lifter merge")
    class LifterMerge {

        @Test
        @DisplayName("Should fill only null fields")
        void testFillsNullFields() {
            Lifter lifter = Lifter.builder()
                    .lifterId(1L)
                    .normalizedName("Jane Smith")
                    .gender("F")
                    .build();

            Map<LifterField, Object> values = new EnumMap<>(LifterField.class);
            values.put(LifterField.GENDER, "M");
            values.put(LifterField.BIRTH_YEAR, 1998);
            values.put(LifterField.STABLE_ID, 1234L);

            Lifter merged = EnrichmentMerger.merge(lifter, values);

            assertEquals("F", merged.getGender());
            assertEquals(1998, merged.getBirthYear());
            assertEquals(1234L, merged.getStableId());
        }

        @Test
        @DisplayName("Should leave the lifter unchanged when applied twice")
        void testIdempotent() {
            Lifter lifter = Lifter.builder().lifterId(1L).normalizedName("Jane Smith").build();
            Map<LifterField, Object> values = Map.of(LifterField.COUNTRY_CODE, "USA",
                    LifterField.MEMBERSHIP_NUMBER, "12345");

            Lifter once = EnrichmentMerger.merge(lifter, values);
            Lifter twice = EnrichmentMerger.merge(once, values);

            assertSame(once, twice);
            assertEquals("USA", twice.getCountryCode());
            assertEquals("12345", twice.getMembershipNumber());
        }

        @Test
        @DisplayName("Should ignore blank incoming values")
        void testIgnoresBlank() {
            Lifter lifter = Lifter.builder().lifterId(1L).normalizedName("Jane Smith").build();

            Map<LifterField, Object> patch = EnrichmentMerger.missingFields(lifter,
                    Map.of(LifterField.COUNTRY_CODE, "  "));

            assertTrue(patch.isEmpty());
        }

        @Test
        @DisplayName("Should return an empty patch for null values")
        void testNullValues() {
            Lifter lifter = Lifter.builder().normalizedName("Jane Smith").build();
            assertTrue(EnrichmentMerger.missingFields(lifter, null).isEmpty());
        }
    }

    @Nested
    @DisplayName("Result merge")
    class ResultMerge {

        @Test
        @DisplayName("Should never overwrite an existing club")
        void testKeepsExistingClub() {
            MeetResult result = MeetResult.builder()
                    .resultId(7L)
                    .meetId(100L)
                    .club("Barbell Club")
                    .build();

            Map<ResultField, Object> values = new EnumMap<>(ResultField.class);
            values.put(ResultField.CLUB, "Other Club");
            values.put(ResultField.WSO, "Carolina");
            values.put(ResultField.NATIONAL_RANK, 4);

            MeetResult merged = EnrichmentMerger.merge(result, values);

            assertEquals("Barbell Club", merged.getClub());
            assertEquals("Carolina", merged.getWso());
            assertEquals(4, merged.getNationalRank());
            assertEquals(7L, merged.getResultId());
        }

        @Test
        @DisplayName("Should report only the fields that would change")
        void testMissingFields() {
            MeetResult result = MeetResult.builder().resultId(7L).wso("Carolina").build();

            Map<ResultField, Object> patch = EnrichmentMerger.missingFields(result,
                    Map.of(ResultField.WSO, "Florida", ResultField.COMPETITION_AGE, 24));

            assertEquals(Map.of(ResultField.COMPETITION_AGE, 24), patch);
        }
    }
}
