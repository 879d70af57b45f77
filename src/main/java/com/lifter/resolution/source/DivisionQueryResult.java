package com.lifter.resolution.source;

import com.lifter.resolution.core.model.AthleteSummary;

import java.util.List;
import java.util.Objects;

/**
 * Answer of a division ranking query.
 *
 * @param status   OK when the athlete list is complete, DEGRADED when the source truncated
 *                 or failed to render an oversized result set
 * @param athletes the rows returned, possibly partial when DEGRADED
 */
public record DivisionQueryResult(Status status, List<AthleteSummary> athletes) {

    public enum Status {
        OK,
        DEGRADED
    }

    public DivisionQueryResult {
        Objects.requireNonNull(status, "status is required");
        athletes = athletes != null ? List.copyOf(athletes) : List.of();
    }

    public static DivisionQueryResult ok(List<AthleteSummary> athletes) {
        return new DivisionQueryResult(Status.OK, athletes);
    }

    public static DivisionQueryResult degraded(List<AthleteSummary> partial) {
        return new DivisionQueryResult(Status.DEGRADED, partial);
    }

    public static DivisionQueryResult degraded() {
        return new DivisionQueryResult(Status.DEGRADED, List.of());
    }

    public boolean isDegraded() {
        return status == Status.DEGRADED;
    }
}
