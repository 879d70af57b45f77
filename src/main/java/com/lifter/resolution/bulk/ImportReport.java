package com.lifter.resolution.bulk;

import com.lifter.resolution.core.model.OutcomeCode;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of a batch import.
 *
 * @param totalRows     number of rows processed
 * @param outcomeCounts rows per outcome code; INTEGRITY_CONFLICT counts rows that raised a
 *                      conflict in addition to their resolution outcome
 * @param rows          one report per successfully ingested row, in processing order
 * @param errors        rows that could not be ingested
 */
public record ImportReport(
        long totalRows,
        Map<OutcomeCode, Long> outcomeCounts,
        List<RowReport> rows,
        List<ImportError> errors
) {
    public ImportReport {
        outcomeCounts = outcomeCounts == null || outcomeCounts.isEmpty()
                ? Map.of() : new EnumMap<>(outcomeCounts);
        rows = rows != null ? List.copyOf(rows) : List.of();
        errors = errors != null ? List.copyOf(errors) : List.of();
    }

    public static ImportReport empty() {
        return new ImportReport(0, Map.of(), List.of(), List.of());
    }

    public long count(OutcomeCode outcome) {
        return outcomeCounts.getOrDefault(outcome, 0L);
    }

    public long successCount() {
        return rows.size();
    }

    public long lifterCreatedCount() {
        return count(OutcomeCode.CREATED_NEW) + count(OutcomeCode.CREATED_NEW_EXTREME_SPLIT);
    }

    public long errorCount() {
        return errors.size();
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /**
     * How one row was ingested.
     *
     * @param lineNumber line in the meet file (1-based), 0 when not read from a file
     * @param lifterName the row's athlete name
     * @param lifterId   the lifter the row was stored under
     * @param resultId   the stored result
     * @param outcome    how the lifter was decided
     * @param conflicts  number of integrity conflicts the row raised
     */
    public record RowReport(long lineNumber, String lifterName, long lifterId, long resultId,
                            OutcomeCode outcome, int conflicts) {}

    /**
     * A row that could not be ingested.
     *
     * @param lineNumber line in the meet file (1-based), 0 when not read from a file
     * @param lifterName the row's athlete name
     * @param outcome    STORE_FAILED for store errors, null for invalid rows
     * @param message    the error message
     */
    public record ImportError(long lineNumber, String lifterName, OutcomeCode outcome, String message) {}

    @Override
    public String toString() {
        return "ImportReport{total=" + totalRows +
                ", outcomes=" + outcomeCounts +
                ", errors=" + errors.size() + '}';
    }
}
