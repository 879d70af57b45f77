package com.lifter.resolution.division;

import com.lifter.resolution.core.model.AthleteSummary;
import com.lifter.resolution.metrics.MetricsService;
import com.lifter.resolution.source.DivisionQueryResult;
import com.lifter.resolution.source.DivisionRankingSource;
import com.lifter.resolution.source.SourceUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Queries one division over a date window, halving the window while the source reports
 * DEGRADED.
 *
 * <p>Halves run sequentially, earlier half first. When the earlier half already contains the
 * athlete being looked for, the later half is not queried. Splitting stops at the maximum depth
 * or when a window spans no more than the minimum number of days; a window still degraded at
 * that point contributes its partial rows and marks the sweep incomplete.</p>
 */
public class DivisionSweep {
    private static final Logger log = LoggerFactory.getLogger(DivisionSweep.class);

    private final DivisionRankingSource source;
    private final int maxDepth;
    private final int minWindowDays;
    private final MetricsService metricsService;

    public DivisionSweep(DivisionRankingSource source, int maxDepth, int minWindowDays,
                         MetricsService metricsService) {
        this.source = source;
        this.maxDepth = maxDepth;
        this.minWindowDays = minWindowDays;
        this.metricsService = metricsService;
    }

    /**
     * Athletes found by a sweep.
     *
     * @param athletes rows collected from every window queried, without duplicates
     * @param complete false when a window stayed degraded or a query failed
     * @param queries  number of source queries issued
     */
    public record Result(List<AthleteSummary> athletes, boolean complete, int queries) {

        public Result {
            athletes = List.copyOf(athletes);
        }

        boolean contains(Predicate<AthleteSummary> target) {
            return athletes.stream().anyMatch(target);
        }
    }

    public Result sweep(int divisionCode, LocalDate from, LocalDate to, Predicate<AthleteSummary> target) {
        return sweep(divisionCode, from, to, target, 0);
    }

    private Result sweep(int code, LocalDate from, LocalDate to, Predicate<AthleteSummary> target, int depth) {
        DivisionQueryResult answer;
        try {
            answer = source.query(code, from, to);
        } catch (SourceUnavailableException e) {
            log.warn("division.queryFailed code={} range={}..{} error={}", code, from, to, e.getMessage());
            return new Result(List.of(), false, 1);
        }
        if (!answer.isDegraded()) {
            return new Result(answer.athletes(), true, 1);
        }

        long spanDays = ChronoUnit.DAYS.between(from, to);
        if (depth >= maxDepth || spanDays <= minWindowDays) {
            log.warn("division.degradedAtLimit code={} range={}..{} depth={} partialRows={}",
                    code, from, to, depth, answer.athletes().size());
            return new Result(answer.athletes(), false, 1);
        }

        LocalDate mid = from.plusDays(spanDays / 2);
        metricsService.incrementBisection();
        log.debug("division.bisect code={} range={}..{} depth={} mid={}", code, from, to, depth, mid);

        Result earlier = sweep(code, from, mid, target, depth + 1);
        if (earlier.contains(target)) {
            return new Result(earlier.athletes(), earlier.complete(), earlier.queries() + 1);
        }
        Result later = sweep(code, mid.plusDays(1), to, target, depth + 1);

        Set<AthleteSummary> combined = new LinkedHashSet<>(earlier.athletes());
        combined.addAll(later.athletes());
        return new Result(new ArrayList<>(combined), earlier.complete() && later.complete(),
                1 + earlier.queries() + later.queries());
    }
}
