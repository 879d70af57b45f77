package com.lifter.resolution.core.model;

/**
 * Status of a single tier's verification attempt.
 */
public enum VerificationStatus {
    /** A single candidate was confirmed. */
    VERIFIED,
    /** The athlete was found but there were no candidates to confirm; attributes only. */
    HARVESTED,
    NOT_FOUND,
    /** The meet was found but bodyweight or total fell outside tolerance. */
    PERFORMANCE_MISMATCH,
    /** The source timed out or was unavailable. */
    INCONCLUSIVE,
    /** Required context was missing. */
    SKIPPED
}
