package com.lifter.resolution.metrics;

import com.lifter.resolution.core.model.ConflictType;
import com.lifter.resolution.core.model.OutcomeCode;
import com.lifter.resolution.core.model.Tier;
import com.lifter.resolution.core.model.VerificationStatus;

import java.time.Duration;

/**
 * Interface for recording lifter resolution metrics.
 * The default {@link NoOpMetricsService} does nothing, so the resolver works without
 * a meter registry.
 */
public interface MetricsService {

    void recordResolutionDuration(OutcomeCode outcome, Duration duration);

    void recordTierOutcome(Tier tier, VerificationStatus status);

    void incrementConflict(ConflictType type);

    void incrementBisection();

    void recordPeerEnrichment(int resultsEnriched);

    void recordBatchSize(int size);

    void recordCacheHit();

    void recordCacheMiss();
}
