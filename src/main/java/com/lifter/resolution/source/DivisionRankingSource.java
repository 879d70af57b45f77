package com.lifter.resolution.source;

import java.time.LocalDate;

/**
 * Division ranking listing of the ranking site: every athlete ranked in one division
 * within a date range.
 */
public interface DivisionRankingSource {

    /**
     * Queries one division for an inclusive date range.
     *
     * @param divisionCode the site's numeric division code
     * @param from         first day of the range
     * @param to           last day of the range
     * @return the athletes, or a DEGRADED marker when the range is too large to answer
     * @throws SourceUnavailableException on timeout or transport failure
     */
    DivisionQueryResult query(int divisionCode, LocalDate from, LocalDate to);
}
