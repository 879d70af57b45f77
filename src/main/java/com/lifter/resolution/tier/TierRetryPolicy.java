package com.lifter.resolution.tier;

import com.lifter.resolution.core.model.VerificationOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Retries a tier whose outcome is INCONCLUSIVE, with exponential backoff.
 * Any other outcome is returned as is. After the last attempt the INCONCLUSIVE outcome is
 * returned and the resolver moves on to the next tier.
 */
public class TierRetryPolicy {
    private static final Logger log = LoggerFactory.getLogger(TierRetryPolicy.class);

    private final int maxRetries;
    private final Duration initialBackoff;

    public TierRetryPolicy(int maxRetries, Duration initialBackoff) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        this.maxRetries = maxRetries;
        this.initialBackoff = initialBackoff;
    }

    public static TierRetryPolicy noRetries() {
        return new TierRetryPolicy(0, Duration.ZERO);
    }

    public VerificationOutcome execute(Verifier verifier, VerificationRequest request) {
        VerificationOutcome outcome = verifier.verify(request);
        int attempt = 0;
        while (outcome.isInconclusive() && attempt < maxRetries) {
            long delayMs = initialBackoff.toMillis() * (1L << attempt);
            attempt++;
            log.info("tier.retry tier={} attempt={} delayMs={} reason='{}'",
                    verifier.tier(), attempt, delayMs, outcome.reason());
            if (!sleep(delayMs)) {
                break;
            }
            outcome = verifier.verify(request);
        }
        return outcome;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    private static boolean sleep(long delayMs) {
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("tier.retryInterrupted");
            return false;
        }
    }
}
