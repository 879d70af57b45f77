package com.lifter.resolution.core.model;

/**
 * Data-integrity problems detected during resolution. None of them is auto-resolved.
 */
public enum ConflictType {
    DUPLICATE_STABLE_ID,
    STABLE_ID_NAME_MISMATCH,
    STABLE_ID_OWNED_BY_OTHER,
    STABLE_ID_MISMATCH,
    /** A tier confirmed a candidate whose own results differ from the row by an extreme bodyweight. */
    EXTREME_DIFFERENCE_VETO
}
