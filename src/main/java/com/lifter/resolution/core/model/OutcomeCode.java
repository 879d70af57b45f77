package com.lifter.resolution.core.model;

/**
 * Per-row outcome codes reported by the resolver and the batch importer.
 */
public enum OutcomeCode {
    RESOLVED_BY_STABLE_ID,
    RESOLVED_BY_NAME,
    RESOLVED_BY_PENDING_CANDIDATE,
    RESOLVED_BY_TIER1,
    RESOLVED_BY_TIER2,
    CREATED_NEW,
    CREATED_NEW_EXTREME_SPLIT,
    INTEGRITY_CONFLICT,
    STORE_FAILED;

    public boolean isCreation() {
        return this == CREATED_NEW || this == CREATED_NEW_EXTREME_SPLIT;
    }
}
