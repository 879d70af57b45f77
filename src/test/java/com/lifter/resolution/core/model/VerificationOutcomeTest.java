package com.lifter.resolution.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VerificationOutcomeTest {

    private static final AthleteSummary ATHLETE = new AthleteSummary("Jane Smith", 1234L, "Barbell Club",
            25, 3, "F", "Carolina", "National", 187.0, LocalDate.of(2024, 3, 1));

    @Test
    @DisplayName("Should name the matched lifter only when VERIFIED")
    void testMatchedLifterRequiresVerified() {
        assertThrows(IllegalArgumentException.class, () -> new VerificationOutcome(Tier.MEMBER_HISTORY,
                VerificationStatus.NOT_FOUND, 10L, null, null, List.of(), "x"));
    }

    @Test
    @DisplayName("Should distinguish a confirmed stable id from a matched candidate")
    void testConfirmedHasNoMatch() {
        VerificationOutcome confirmed = VerificationOutcome.confirmed(Tier.MEMBER_HISTORY, "found");
        VerificationOutcome verified = VerificationOutcome.verified(Tier.MEMBER_HISTORY, 10L, null, null, "found");

        assertTrue(confirmed.isVerified());
        assertFalse(confirmed.hasMatch());
        assertTrue(verified.hasMatch());
        assertEquals(10L, verified.matchedLifterId());
    }

    @Test
    @DisplayName("Should expose harvested lifter attributes")
    void testHarvestedAttributes() {
        VerificationOutcome outcome = VerificationOutcome.harvested(Tier.DIVISION_RANKINGS, ATHLETE);

        assertEquals(VerificationStatus.HARVESTED, outcome.status());
        assertEquals(1234L, outcome.extractedAttributes().get(LifterField.STABLE_ID));
        assertEquals("F", outcome.extractedAttributes().get(LifterField.GENDER));
        assertTrue(outcome.harvestedAthlete().isPresent());
        assertTrue(VerificationOutcome.notFound(Tier.DIVISION_RANKINGS, "x").extractedAttributes().isEmpty());
    }

    @Test
    @DisplayName("Should append conflicts without touching the original")
    void testWithConflicts() {
        VerificationOutcome outcome = VerificationOutcome.notFound(Tier.MEMBER_HISTORY, "none");
        IntegrityConflict conflict = new IntegrityConflict(ConflictType.STABLE_ID_OWNED_BY_OTHER, 555L,
                List.of(11L, 10L), "held");

        VerificationOutcome withConflict = outcome.withConflicts(List.of(conflict));

        assertTrue(outcome.conflicts().isEmpty());
        assertEquals(List.of(conflict), withConflict.conflicts());
        assertSame(outcome, outcome.withConflicts(List.of()));
    }

    @Test
    @DisplayName("Should omit null athlete attributes")
    void testResultAttributesSkipNulls() {
        AthleteSummary sparse = new AthleteSummary("Jane Smith", null, null, null, 2, null, null, null, null, null);

        assertEquals(1, sparse.resultAttributes().size());
        assertTrue(sparse.lifterAttributes().isEmpty());
    }
}
