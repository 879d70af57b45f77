package com.lifter.resolution.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of one verification tier.
 *
 * @param tier               the tier that produced this outcome
 * @param status             the verification status
 * @param matchedLifterId    the confirmed candidate; null for a VERIFIED check of a bare stable id
 * @param harvested          the athlete row the tier found, if any
 * @param discoveredStableId a stable id found for the matched candidate that it does not hold yet
 * @param conflicts          integrity conflicts observed while verifying
 * @param reason             short explanation for logs and audit
 */
public record VerificationOutcome(
        Tier tier,
        VerificationStatus status,
        Long matchedLifterId,
        AthleteSummary harvested,
        Long discoveredStableId,
        List<IntegrityConflict> conflicts,
        String reason
) {
    public VerificationOutcome {
        Objects.requireNonNull(tier, "tier is required");
        Objects.requireNonNull(status, "status is required");
        conflicts = conflicts != null ? List.copyOf(conflicts) : List.of();
        if (matchedLifterId != null && status != VerificationStatus.VERIFIED) {
            throw new IllegalArgumentException("only a VERIFIED outcome names a matched lifter");
        }
    }

    public static VerificationOutcome verified(Tier tier, long lifterId, AthleteSummary harvested,
                                               Long discoveredStableId, String reason) {
        return new VerificationOutcome(tier, VerificationStatus.VERIFIED, lifterId, harvested,
                discoveredStableId, List.of(), reason);
    }

    /**
     * VERIFIED for a stable id checked on its own, with no candidate to attach it to.
     */
    public static VerificationOutcome confirmed(Tier tier, String reason) {
        return new VerificationOutcome(tier, VerificationStatus.VERIFIED, null, null, null, List.of(), reason);
    }

    public static VerificationOutcome harvested(Tier tier, AthleteSummary harvested) {
        return new VerificationOutcome(tier, VerificationStatus.HARVESTED, null, harvested,
                null, List.of(), "no candidates to verify");
    }

    public static VerificationOutcome notFound(Tier tier, String reason) {
        return new VerificationOutcome(tier, VerificationStatus.NOT_FOUND, null, null, null, List.of(), reason);
    }

    public static VerificationOutcome notFound(Tier tier, AthleteSummary harvested, String reason) {
        return new VerificationOutcome(tier, VerificationStatus.NOT_FOUND, null, harvested, null, List.of(), reason);
    }

    public static VerificationOutcome performanceMismatch(Tier tier, String reason) {
        return new VerificationOutcome(tier, VerificationStatus.PERFORMANCE_MISMATCH, null, null, null,
                List.of(), reason);
    }

    public static VerificationOutcome inconclusive(Tier tier, String reason) {
        return new VerificationOutcome(tier, VerificationStatus.INCONCLUSIVE, null, null, null, List.of(), reason);
    }

    public static VerificationOutcome skipped(Tier tier, String reason) {
        return new VerificationOutcome(tier, VerificationStatus.SKIPPED, null, null, null, List.of(), reason);
    }

    /**
     * Returns a copy carrying the given conflicts in addition to this outcome's own.
     */
    public VerificationOutcome withConflicts(List<IntegrityConflict> extra) {
        if (extra == null || extra.isEmpty()) {
            return this;
        }
        List<IntegrityConflict> all = new ArrayList<>(conflicts);
        all.addAll(extra);
        return new VerificationOutcome(tier, status, matchedLifterId, harvested, discoveredStableId, all, reason);
    }

    public boolean isVerified() {
        return status == VerificationStatus.VERIFIED;
    }

    /**
     * True when a specific candidate was confirmed.
     */
    public boolean hasMatch() {
        return isVerified() && matchedLifterId != null;
    }

    public boolean isInconclusive() {
        return status == VerificationStatus.INCONCLUSIVE;
    }

    public Optional<AthleteSummary> harvestedAthlete() {
        return Optional.ofNullable(harvested);
    }

    /**
     * Lifter attributes extracted by this tier, empty when nothing was harvested.
     */
    public Map<LifterField, Object> extractedAttributes() {
        return harvested != null ? harvested.lifterAttributes() : Map.of();
    }
}
