package com.lifter.resolution.reprocess;

/**
 * Status of a row in the reprocessing queue.
 */
public enum ReprocessingStatus {
    PENDING,
    RESOLVED,
    FAILED
}
