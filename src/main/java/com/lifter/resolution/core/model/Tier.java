package com.lifter.resolution.core.model;

/**
 * Verification tiers, in the order the resolver consults them.
 */
public enum Tier {
    DIVISION_RANKINGS(1),
    MEMBER_HISTORY(2);

    private final int level;

    Tier(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }
}
