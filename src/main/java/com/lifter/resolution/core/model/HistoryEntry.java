package com.lifter.resolution.core.model;

import java.time.LocalDate;

/**
 * One meet in an athlete's competition history.
 */
public record HistoryEntry(String meetName, LocalDate date, Double bodyweightKg, Double totalKg) {
}
