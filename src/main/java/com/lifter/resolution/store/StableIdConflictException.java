package com.lifter.resolution.store;

/**
 * Thrown when a write would give two lifters the same stable id.
 */
public class StableIdConflictException extends StoreException {

    private final long stableId;
    private final Long ownerLifterId;

    public StableIdConflictException(long stableId, Long ownerLifterId) {
        super("Stable id " + stableId + " is already held by lifter " + ownerLifterId);
        this.stableId = stableId;
        this.ownerLifterId = ownerLifterId;
    }

    public long getStableId() {
        return stableId;
    }

    public Long getOwnerLifterId() {
        return ownerLifterId;
    }
}
