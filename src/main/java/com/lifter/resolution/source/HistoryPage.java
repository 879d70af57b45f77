package com.lifter.resolution.source;

import com.lifter.resolution.core.model.HistoryEntry;

import java.util.List;

/**
 * One page of an athlete's competition history.
 *
 * @param page    1-based page number
 * @param entries meets on this page
 * @param hasNext whether a further page exists
 */
public record HistoryPage(int page, List<HistoryEntry> entries, boolean hasNext) {

    public HistoryPage {
        entries = entries != null ? List.copyOf(entries) : List.of();
    }

    public static HistoryPage last(int page, List<HistoryEntry> entries) {
        return new HistoryPage(page, entries, false);
    }
}
