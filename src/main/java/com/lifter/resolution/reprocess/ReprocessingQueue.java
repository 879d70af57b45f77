package com.lifter.resolution.reprocess;

import com.lifter.resolution.core.model.ResultRow;

import java.util.List;

/**
 * Holds rows whose ingestion failed on a store write, so they can be retried later without
 * re-reading the meet file.
 */
public interface ReprocessingQueue {

    /**
     * Queues a failed row.
     *
     * @param row    the row that failed
     * @param reason the failure message
     * @return the queued item
     */
    ReprocessingItem submit(ResultRow row, String reason);

    /**
     * Pending items, oldest first.
     */
    List<ReprocessingItem> getPending();

    /**
     * Gets an item by id, or null if not found.
     */
    ReprocessingItem get(String itemId);

    /**
     * Records a retry that failed again; the item stays pending.
     */
    void recordFailedAttempt(String itemId, String reason);

    /**
     * Marks an item resolved after a successful retry.
     */
    void markResolved(String itemId, long lifterId);

    /**
     * Marks an item permanently failed; it is not retried again.
     */
    void markFailed(String itemId, String reason);

    long countPending();
}
