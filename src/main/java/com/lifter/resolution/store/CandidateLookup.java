package com.lifter.resolution.store;

import com.lifter.resolution.core.model.Lifter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Store queries used to build the candidate set for a row.
 * Depends only on the repository.
 */
public class CandidateLookup {
    private static final Logger log = LoggerFactory.getLogger(CandidateLookup.class);

    private final LifterRepository repository;

    public CandidateLookup(LifterRepository repository) {
        this.repository = repository;
    }

    /**
     * Lifters holding the stable id. More than one entry is an integrity conflict.
     */
    public List<Lifter> findByStableId(long stableId) {
        List<Lifter> hits = repository.findByStableId(stableId);
        if (hits.size() > 1) {
            log.warn("lookup.duplicateStableId stableId={} lifterIds={}", stableId,
                    hits.stream().map(Lifter::getLifterId).toList());
        }
        return hits;
    }

    /**
     * Lifters whose normalized name matches, ignoring case, in lifter id order.
     */
    public List<Lifter> findByName(String normalizedName) {
        List<Lifter> candidates = repository.findByName(normalizedName);
        log.debug("lookup.byName name='{}' candidates={}", normalizedName, candidates.size());
        return candidates;
    }

    public boolean isStableIdTaken(long stableId) {
        return !repository.findByStableId(stableId).isEmpty();
    }
}
