package com.lifter.resolution.source;

import java.util.Optional;

/**
 * Per-athlete member pages of the ranking site.
 */
public interface MemberHistorySource {

    /**
     * Fetches one page of an athlete's history.
     *
     * @param stableId the athlete's stable id
     * @param page     1-based page number
     * @throws SourceUnavailableException on timeout or transport failure
     */
    HistoryPage getHistory(long stableId, int page);

    /**
     * Looks up the stable id of an athlete by name. Empty when the name is unknown
     * or matches more than one athlete.
     *
     * @throws SourceUnavailableException on timeout or transport failure
     */
    Optional<Long> searchByName(String name);
}
