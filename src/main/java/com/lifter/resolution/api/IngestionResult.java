package com.lifter.resolution.api;

import com.lifter.resolution.core.model.MeetResult;

/**
 * Outcome of ingesting one result row.
 *
 * @param resolution    how the row's lifter was decided, pointing at the persisted lifter
 * @param result        the stored result
 * @param resultCreated false when the row matched an already stored result
 */
public record IngestionResult(ResolutionResult resolution, MeetResult result, boolean resultCreated) {
}
