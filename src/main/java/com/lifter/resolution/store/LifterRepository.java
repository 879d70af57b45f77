package com.lifter.resolution.store;

import com.lifter.resolution.core.model.Lifter;
import com.lifter.resolution.core.model.LifterField;
import com.lifter.resolution.core.model.MeetResult;
import com.lifter.resolution.core.model.ResultField;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Persistent roster of lifters and their results.
 *
 * <p>Implementations must enforce stable-id uniqueness on every write and raise
 * {@link StableIdConflictException} on violation. Other write failures raise
 * {@link StoreException}. Field updates are null-only: an existing value is never
 * overwritten.</p>
 */
public interface LifterRepository {

    /**
     * Finds a lifter by its store id.
     */
    Optional<Lifter> findById(long lifterId);

    /**
     * Finds lifters holding a stable id. More than one hit means the store is inconsistent
     * and is reported as an integrity conflict by the caller.
     */
    List<Lifter> findByStableId(long stableId);

    /**
     * Finds lifters whose normalized name equals the given one, ignoring case.
     * Results are ordered by lifter id.
     */
    List<Lifter> findByName(String normalizedName);

    /**
     * Persists a new lifter.
     *
     * @param draft an unsaved lifter; a preset lifter id is honored when free
     * @return the persisted lifter
     * @throws StableIdConflictException if the draft's stable id is already held
     */
    Lifter createLifter(Lifter draft);

    /**
     * Fills currently null fields of a lifter.
     *
     * @return the lifter after the update
     * @throws StableIdConflictException if a stable id in {@code values} is held by another lifter
     */
    Lifter updateLifterFields(long lifterId, Map<LifterField, Object> values);

    /**
     * Atomically sets a lifter's stable id when it has none and no other lifter holds it.
     */
    StableIdAssignment assignStableIdIfAbsent(long lifterId, long stableId);

    /**
     * Writes a result, creating its lifter first when {@code lifter} is unsaved. Both writes
     * succeed or neither does. A result already stored for the same (meet, lifter, weight class)
     * is reused and its missing fields filled.
     */
    RecordedResult recordResult(Lifter lifter, MeetResult result);

    /**
     * Fills currently null enrichment fields of a result.
     *
     * @return the result after the update
     */
    MeetResult updateResultFields(long resultId, Map<ResultField, Object> values);

    /**
     * Returns all results recorded for the given lifters.
     */
    List<MeetResult> findResultsByLifterIds(Collection<Long> lifterIds);

    /**
     * Returns results in one division and date window (inclusive) whose lifter name is one of
     * the given normalized names, ignoring case.
     */
    List<MeetResult> findResultsForNames(Collection<String> normalizedNames, LocalDate from, LocalDate to,
                                         String ageCategory, String weightClass);
}
