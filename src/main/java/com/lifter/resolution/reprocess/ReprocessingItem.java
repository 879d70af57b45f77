package com.lifter.resolution.reprocess;

import com.lifter.resolution.core.model.ResultRow;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A result row that could not be stored, waiting to be ingested again.
 * Rows whose store write failed stay PENDING until a retry succeeds (RESOLVED) or the row turns
 * out to be invalid (FAILED).
 */
public class ReprocessingItem {

    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final String id;
    private final long sequence;
    private final ResultRow row;
    private final Instant submittedAt;
    private ReprocessingStatus status;
    private String reason;
    private int attempts;
    private Instant lastAttemptAt;
    private Long resolvedLifterId;

    public ReprocessingItem(ResultRow row, String reason) {
        this.id = UUID.randomUUID().toString();
        this.sequence = SEQUENCE.incrementAndGet();
        this.row = Objects.requireNonNull(row, "row is required");
        this.reason = reason;
        this.status = ReprocessingStatus.PENDING;
        this.submittedAt = Instant.now();
        this.attempts = 1;
    }

    public String getId() {
        return id;
    }

    /**
     * Submission order across all items.
     */
    public long getSequence() {
        return sequence;
    }

    public ResultRow getRow() {
        return row;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public ReprocessingStatus getStatus() {
        return status;
    }

    /**
     * Reason of the most recent failure.
     */
    public String getReason() {
        return reason;
    }

    /**
     * Number of ingestion attempts so far, including the one that queued the row.
     */
    public int getAttempts() {
        return attempts;
    }

    public Instant getLastAttemptAt() {
        return lastAttemptAt;
    }

    public Long getResolvedLifterId() {
        return resolvedLifterId;
    }

    public boolean isPending() {
        return status == ReprocessingStatus.PENDING;
    }

    synchronized void markAttemptFailed(String reason) {
        this.attempts++;
        this.reason = reason;
        this.lastAttemptAt = Instant.now();
    }

    synchronized void markResolved(long lifterId) {
        this.attempts++;
        this.status = ReprocessingStatus.RESOLVED;
        this.resolvedLifterId = lifterId;
        this.lastAttemptAt = Instant.now();
    }

    synchronized void markFailed(String reason) {
        this.attempts++;
        this.status = ReprocessingStatus.FAILED;
        this.reason = reason;
        this.lastAttemptAt = Instant.now();
    }

    @Override
    public String toString() {
        return "ReprocessingItem{" +
                "id='" + id + '\'' +
                ", lifter='" + row.getLifterName() + '\'' +
                ", meetId=" + row.getMeetId() +
                ", status=" + status +
                ", attempts=" + attempts +
                ", reason='" + reason + '\'' +
                '}';
    }
}
