package com.lifter.resolution.metrics;

import com.lifter.resolution.core.model.ConflictType;
import com.lifter.resolution.core.model.OutcomeCode;
import com.lifter.resolution.core.model.Tier;
import com.lifter.resolution.core.model.VerificationStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordResolutionDuration(OutcomeCode.CREATED_NEW, Duration.ofMillis(100));
                noOp.recordTierOutcome(Tier.DIVISION_RANKINGS, VerificationStatus.HARVESTED);
                noOp.incrementConflict(ConflictType.DUPLICATE_STABLE_ID);
                noOp.incrementBisection();
                noOp.recordPeerEnrichment(3);
                noOp.recordBatchSize(50);
                noOp.recordCacheHit();
                noOp.recordCacheMiss();
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should record resolution duration per outcome")
        void recordResolutionDuration() {
            metrics.recordResolutionDuration(OutcomeCode.RESOLVED_BY_NAME, Duration.ofMillis(150));
            metrics.recordResolutionDuration(OutcomeCode.RESOLVED_BY_NAME, Duration.ofMillis(250));
            metrics.recordResolutionDuration(OutcomeCode.CREATED_NEW, Duration.ofMillis(10));

            Timer timer = registry.find("lifter.resolution.duration")
                    .tag("outcome", "RESOLVED_BY_NAME")
                    .timer();

            assertNotNull(timer);
            assertEquals(2, timer.count());
            assertEquals(400, timer.totalTime(TimeUnit.MILLISECONDS), 1.0);
        }

        @Test
        @DisplayName("Should count tier outcomes by tier and status")
        void recordTierOutcome() {
            metrics.recordTierOutcome(Tier.MEMBER_HISTORY, VerificationStatus.VERIFIED);
            metrics.recordTierOutcome(Tier.MEMBER_HISTORY, VerificationStatus.VERIFIED);
            metrics.recordTierOutcome(Tier.MEMBER_HISTORY, VerificationStatus.INCONCLUSIVE);

            Counter verified = registry.find("lifter.tier.outcome")
                    .tag("tier", "MEMBER_HISTORY")
                    .tag("status", "VERIFIED")
                    .counter();

            assertNotNull(verified);
            assertEquals(2.0, verified.count());
        }

        @Test
        @DisplayName("Should count conflicts by type")
        void incrementConflict() {
            metrics.incrementConflict(ConflictType.STABLE_ID_MISMATCH);

            Counter counter = registry.find("lifter.integrity.conflict").tag("type", "STABLE_ID_MISMATCH").counter();

            assertNotNull(counter);
            assertEquals(1.0, counter.count());
        }

        @Test
        @DisplayName("Should record bisections, peer enrichment and batch size")
        void recordSweepAndBatch() {
            metrics.incrementBisection();
            metrics.recordPeerEnrichment(4);
            metrics.recordBatchSize(250);

            assertEquals(1.0, registry.get("lifter.division.bisection").counter().count());
            DistributionSummary peers = registry.get("lifter.peer.enriched").summary();
            assertEquals(4.0, peers.totalAmount());
            assertEquals(250.0, registry.get("lifter.batch.size").summary().totalAmount());
        }

        @Test
        @DisplayName("Should count cache hits and misses")
        void recordCache() {
            metrics.recordCacheHit();
            metrics.recordCacheHit();
            metrics.recordCacheMiss();

            assertEquals(2.0, registry.get("lifter.history.cache.hit").counter().count());
            assertEquals(1.0, registry.get("lifter.history.cache.miss").counter().count());
        }
    }
}
