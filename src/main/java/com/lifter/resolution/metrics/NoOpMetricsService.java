package com.lifter.resolution.metrics;

import com.lifter.resolution.core.model.ConflictType;
import com.lifter.resolution.core.model.OutcomeCode;
import com.lifter.resolution.core.model.Tier;
import com.lifter.resolution.core.model.VerificationStatus;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordResolutionDuration(OutcomeCode outcome, Duration duration) {
    }

    @Override
    public void recordTierOutcome(Tier tier, VerificationStatus status) {
    }

    @Override
    public void incrementConflict(ConflictType type) {
    }

    @Override
    public void incrementBisection() {
    }

    @Override
    public void recordPeerEnrichment(int resultsEnriched) {
    }

    @Override
    public void recordBatchSize(int size) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
