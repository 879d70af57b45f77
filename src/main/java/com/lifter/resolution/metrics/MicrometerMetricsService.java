package com.lifter.resolution.metrics;

import com.lifter.resolution.core.model.ConflictType;
import com.lifter.resolution.core.model.OutcomeCode;
import com.lifter.resolution.core.model.Tier;
import com.lifter.resolution.core.model.VerificationStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code lifter.resolution.duration}: Timer (tag: outcome)</li>
 *   <li>{@code lifter.tier.outcome}: Counter (tags: tier, status)</li>
 *   <li>{@code lifter.integrity.conflict}: Counter (tag: type)</li>
 *   <li>{@code lifter.division.bisection}: Counter</li>
 *   <li>{@code lifter.peer.enriched}: DistributionSummary</li>
 *   <li>{@code lifter.batch.size}: DistributionSummary</li>
 *   <li>{@code lifter.history.cache.hit} / {@code lifter.history.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Counter bisectionCounter;
    private final DistributionSummary peerEnrichmentSummary;
    private final DistributionSummary batchSizeSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.bisectionCounter = Counter.builder("lifter.division.bisection")
                .description("Number of division query windows split in half")
                .register(registry);
        this.peerEnrichmentSummary = DistributionSummary.builder("lifter.peer.enriched")
                .description("Results enriched per division sweep")
                .register(registry);
        this.batchSizeSummary = DistributionSummary.builder("lifter.batch.size")
                .description("Rows per imported batch")
                .register(registry);
        this.cacheHitCounter = Counter.builder("lifter.history.cache.hit")
                .description("Member history cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("lifter.history.cache.miss")
                .description("Member history cache misses")
                .register(registry);
    }

    @Override
    public void recordResolutionDuration(OutcomeCode outcome, Duration duration) {
        Timer timer = timerCache.computeIfAbsent(outcome.name(), k ->
                Timer.builder("lifter.resolution.duration")
                        .description("Duration of lifter resolution per row")
                        .tag("outcome", outcome.name())
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordTierOutcome(Tier tier, VerificationStatus status) {
        String key = "tier:" + tier.name() + ":" + status.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("lifter.tier.outcome")
                        .description("Verification outcomes per tier")
                        .tag("tier", tier.name())
                        .tag("status", status.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementConflict(ConflictType type) {
        String key = "conflict:" + type.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("lifter.integrity.conflict")
                        .description("Integrity conflicts detected during resolution")
                        .tag("type", type.name())
                        .register(registry));
        counter.increment();
    }

    @Override
    public void incrementBisection() {
        bisectionCounter.increment();
    }

    @Override
    public void recordPeerEnrichment(int resultsEnriched) {
        peerEnrichmentSummary.record(resultsEnriched);
    }

    @Override
    public void recordBatchSize(int size) {
        batchSizeSummary.record(size);
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }
}
