package com.lifter.resolution.reprocess;

import com.lifter.resolution.core.model.ResultRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory implementation of {@link ReprocessingQueue}.
 * Suitable for testing and single-JVM imports.
 */
public class InMemoryReprocessingQueue implements ReprocessingQueue {
    private static final Logger log = LoggerFactory.getLogger(InMemoryReprocessingQueue.class);

    private final ConcurrentMap<String, ReprocessingItem> items = new ConcurrentHashMap<>();

    @Override
    public ReprocessingItem submit(ResultRow row, String reason) {
        ReprocessingItem item = new ReprocessingItem(row, reason);
        items.put(item.getId(), item);
        log.info("reprocess.queued itemId={} lifter='{}' meetId={} reason='{}'",
                item.getId(), row.getLifterName(), row.getMeetId(), reason);
        return item;
    }

    @Override
    public List<ReprocessingItem> getPending() {
        return items.values().stream()
                .filter(ReprocessingItem::isPending)
                .sorted(Comparator.comparingLong(ReprocessingItem::getSequence))
                .toList();
    }

    @Override
    public ReprocessingItem get(String itemId) {
        return items.get(itemId);
    }

    @Override
    public void recordFailedAttempt(String itemId, String reason) {
        ReprocessingItem item = requirePending(itemId);
        item.markAttemptFailed(reason);
        log.info("reprocess.retryFailed itemId={} attempts={} reason='{}'", itemId, item.getAttempts(), reason);
    }

    @Override
    public void markResolved(String itemId, long lifterId) {
        ReprocessingItem item = requirePending(itemId);
        item.markResolved(lifterId);
        log.info("reprocess.resolved itemId={} lifterId={}", itemId, lifterId);
    }

    @Override
    public void markFailed(String itemId, String reason) {
        ReprocessingItem item = requirePending(itemId);
        item.markFailed(reason);
        log.warn("reprocess.failed itemId={} reason='{}'", itemId, reason);
    }

    @Override
    public long countPending() {
        return items.values().stream().filter(ReprocessingItem::isPending).count();
    }

    private ReprocessingItem requirePending(String itemId) {
        ReprocessingItem item = items.get(itemId);
        if (item == null) {
            throw new IllegalArgumentException("Reprocessing item not found: " + itemId);
        }
        if (!item.isPending()) {
            throw new IllegalStateException("Reprocessing item is not pending: " + itemId);
        }
        return item;
    }
}
