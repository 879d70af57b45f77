package com.lifter.resolution.store;

/**
 * Outcome of a compare-and-set stable id assignment.
 */
public enum StableIdAssignment {
    /** The lifter had no stable id and now holds the requested one. */
    ASSIGNED,
    /** The lifter already held the requested id. */
    ALREADY_SET,
    /** The lifter holds a different stable id; nothing was written. */
    HOLDS_DIFFERENT,
    /** Another lifter holds the requested id; nothing was written. */
    OWNED_BY_OTHER;

    public boolean holdsRequestedId() {
        return this == ASSIGNED || this == ALREADY_SET;
    }
}
