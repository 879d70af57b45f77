package com.lifter.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A data-integrity conflict observed while resolving a row.
 *
 * @param type      the kind of conflict
 * @param stableId  the stable id involved
 * @param lifterIds the lifters involved
 * @param detail    human-readable description
 */
public record IntegrityConflict(ConflictType type, Long stableId, List<Long> lifterIds, String detail) {

    public IntegrityConflict {
        Objects.requireNonNull(type, "type is required");
        lifterIds = lifterIds != null ? List.copyOf(lifterIds) : List.of();
    }
}
