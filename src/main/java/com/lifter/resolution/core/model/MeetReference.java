package com.lifter.resolution.core.model;

import java.time.LocalDate;

/**
 * Identifies the meet a result row belongs to.
 */
public record MeetReference(Long meetId, String meetName, LocalDate date) {

    public boolean isComplete() {
        return meetName != null && !meetName.isBlank() && date != null;
    }
}
