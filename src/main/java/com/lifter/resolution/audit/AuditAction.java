package com.lifter.resolution.audit;

/**
 * Types of auditable actions taken while resolving and importing results.
 */
public enum AuditAction {
    LIFTER_CREATED,
    LIFTER_ENRICHED,
    RESULT_RECORDED,
    RESULT_ENRICHED,
    STABLE_ID_DISCOVERED,
    TIER_VERIFIED,
    PERFORMANCE_MISMATCH,
    INTEGRITY_CONFLICT,
    EXTREME_DIFFERENCE_SPLIT,
    ROW_QUEUED
}
