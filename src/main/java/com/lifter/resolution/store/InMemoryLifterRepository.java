package com.lifter.resolution.store;

import com.lifter.resolution.core.model.Lifter;
import com.lifter.resolution.core.model.LifterField;
import com.lifter.resolution.core.model.MeetResult;
import com.lifter.resolution.core.model.ResultField;
import com.lifter.resolution.merge.EnrichmentMerger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory implementation of {@link LifterRepository}.
 * Suitable for testing and single-JVM imports. All writes take one lock, which makes
 * {@link #assignStableIdIfAbsent} and {@link #recordResult} atomic.
 */
public class InMemoryLifterRepository implements LifterRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemoryLifterRepository.class);

    private final Map<Long, Lifter> lifters = new LinkedHashMap<>();
    private final Map<Long, Long> stableIdIndex = new HashMap<>();
    private final Map<Long, MeetResult> results = new LinkedHashMap<>();
    private final Map<ResultKey, Long> resultKeyIndex = new HashMap<>();
    private final AtomicLong lifterSequence = new AtomicLong(1);
    private final AtomicLong resultSequence = new AtomicLong(1);
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Optional<Lifter> findById(long lifterId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(lifters.get(lifterId));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Lifter> findByStableId(long stableId) {
        lock.readLock().lock();
        try {
            Long owner = stableIdIndex.get(stableId);
            return owner != null ? List.of(lifters.get(owner)) : List.of();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Lifter> findByName(String normalizedName) {
        String key = nameKey(normalizedName);
        lock.readLock().lock();
        try {
            return lifters.values().stream()
                    .filter(l -> nameKey(l.getNormalizedName()).equals(key))
                    .sorted(Comparator.comparing(Lifter::getLifterId))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Lifter createLifter(Lifter draft) {
        lock.writeLock().lock();
        try {
            return insertLifter(draft);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Lifter updateLifterFields(long lifterId, Map<LifterField, Object> values) {
        lock.writeLock().lock();
        try {
            Lifter current = requireLifter(lifterId);
            Map<LifterField, Object> patch = EnrichmentMerger.missingFields(current, values);
            if (patch.isEmpty()) {
                return current;
            }
            Long stableId = (Long) patch.get(LifterField.STABLE_ID);
            if (stableId != null) {
                Long owner = stableIdIndex.get(stableId);
                if (owner != null && owner != lifterId) {
                    throw new StableIdConflictException(stableId, owner);
                }
            }
            Lifter updated = EnrichmentMerger.merge(current, patch);
            lifters.put(lifterId, updated);
            if (stableId != null) {
                stableIdIndex.put(stableId, lifterId);
            }
            log.debug("lifter.enriched lifterId={} fields={}", lifterId, patch.keySet());
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public StableIdAssignment assignStableIdIfAbsent(long lifterId, long stableId) {
        lock.writeLock().lock();
        try {
            Lifter current = requireLifter(lifterId);
            if (current.getStableId() != null) {
                return current.getStableId() == stableId
                        ? StableIdAssignment.ALREADY_SET
                        : StableIdAssignment.HOLDS_DIFFERENT;
            }
            Long owner = stableIdIndex.get(stableId);
            if (owner != null) {
                return StableIdAssignment.OWNED_BY_OTHER;
            }
            lifters.put(lifterId, current.toBuilder().stableId(stableId).build());
            stableIdIndex.put(stableId, lifterId);
            log.debug("lifter.stableIdAssigned lifterId={} stableId={}", lifterId, stableId);
            return StableIdAssignment.ASSIGNED;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public RecordedResult recordResult(Lifter lifter, MeetResult result) {
        lock.writeLock().lock();
        try {
            // Validate before any insert so a failure leaves nothing behind
            validateResult(result);
            boolean lifterCreated = false;
            Lifter owner;
            if (lifter.isPersisted()) {
                owner = requireLifter(lifter.getLifterId());
            } else {
                owner = insertLifter(lifter);
                lifterCreated = true;
            }

            ResultKey key = new ResultKey(result.getMeetId(), owner.getLifterId(), result.getWeightClass());
            Long existingId = resultKeyIndex.get(key);
            if (existingId != null) {
                MeetResult existing = results.get(existingId);
                MeetResult merged = EnrichmentMerger.merge(existing, enrichmentOf(result));
                results.put(existingId, merged);
                return new RecordedResult(owner, merged, lifterCreated, false);
            }

            long resultId = resultSequence.getAndIncrement();
            MeetResult stored = result.toBuilder()
                    .resultId(resultId)
                    .lifterId(owner.getLifterId())
                    .lifterName(result.getLifterName() != null ? result.getLifterName() : owner.getNormalizedName())
                    .build();
            results.put(resultId, stored);
            resultKeyIndex.put(key, resultId);
            return new RecordedResult(owner, stored, lifterCreated, true);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public MeetResult updateResultFields(long resultId, Map<ResultField, Object> values) {
        lock.writeLock().lock();
        try {
            MeetResult current = results.get(resultId);
            if (current == null) {
                throw new StoreException("Result not found: " + resultId);
            }
            MeetResult updated = EnrichmentMerger.merge(current, values);
            results.put(resultId, updated);
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<MeetResult> findResultsByLifterIds(Collection<Long> lifterIds) {
        Set<Long> ids = new HashSet<>(lifterIds);
        lock.readLock().lock();
        try {
            return results.values().stream()
                    .filter(r -> ids.contains(r.getLifterId()))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<MeetResult> findResultsForNames(Collection<String> normalizedNames, LocalDate from, LocalDate to,
                                                String ageCategory, String weightClass) {
        Set<String> keys = new HashSet<>();
        normalizedNames.forEach(n -> keys.add(nameKey(n)));
        lock.readLock().lock();
        try {
            List<MeetResult> matches = new ArrayList<>();
            for (MeetResult r : results.values()) {
                if (r.getDate() == null || r.getDate().isBefore(from) || r.getDate().isAfter(to)) {
                    continue;
                }
                if (!ageCategory.equals(r.getAgeCategory()) || !weightClass.equals(r.getWeightClass())) {
                    continue;
                }
                if (keys.contains(nameKey(r.getLifterName()))) {
                    matches.add(r);
                }
            }
            return matches;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Number of stored lifters.
     */
    public int lifterCount() {
        lock.readLock().lock();
        try {
            return lifters.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Number of stored results.
     */
    public int resultCount() {
        lock.readLock().lock();
        try {
            return results.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Snapshot of all lifters, ordered by id.
     */
    public List<Lifter> findAllLifters() {
        lock.readLock().lock();
        try {
            return List.copyOf(lifters.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    private Lifter insertLifter(Lifter draft) {
        if (draft.getStableId() != null) {
            Long owner = stableIdIndex.get(draft.getStableId());
            if (owner != null) {
                throw new StableIdConflictException(draft.getStableId(), owner);
            }
        }
        long lifterId;
        if (draft.getLifterId() != null) {
            lifterId = draft.getLifterId();
            if (lifters.containsKey(lifterId)) {
                throw new StoreException("Lifter id already in use: " + lifterId);
            }
            lifterSequence.accumulateAndGet(lifterId + 1, Math::max);
        } else {
            lifterId = lifterSequence.getAndIncrement();
        }
        Lifter stored = draft.toBuilder().lifterId(lifterId).build();
        lifters.put(lifterId, stored);
        if (stored.getStableId() != null) {
            stableIdIndex.put(stored.getStableId(), lifterId);
        }
        log.debug("lifter.created lifterId={} name='{}' stableId={}",
                lifterId, stored.getNormalizedName(), stored.getStableId());
        return stored;
    }

    private Lifter requireLifter(long lifterId) {
        Lifter lifter = lifters.get(lifterId);
        if (lifter == null) {
            throw new StoreException("Lifter not found: " + lifterId);
        }
        return lifter;
    }

    private static void validateResult(MeetResult result) {
        if (result.getMeetId() == null) {
            throw new StoreException("Result requires a meet id");
        }
    }

    private static Map<ResultField, Object> enrichmentOf(MeetResult result) {
        Map<ResultField, Object> values = new HashMap<>();
        for (ResultField field : ResultField.values()) {
            Object value = result.get(field);
            if (value != null) {
                values.put(field, value);
            }
        }
        return values;
    }

    private static String nameKey(String name) {
        return name == null ? "" : name.trim().toUpperCase(Locale.ROOT);
    }

    private record ResultKey(Long meetId, Long lifterId, String weightClass) {}
}
