package com.lifecycle.core.model;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Configuration for retrying sequence conflicts on append.
 * Immutable and reusable.
 * 
 * Invariants:
 * - maxAttempts >= 1
 * - maxBackoff >= initialBackoff
 * - backoffMultiplier >= 1.0
 * - jitterFactor in [0.0, 1.0]
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialBackoff,
    Duration maxBackoff,
    double backoffMultiplier,
    double jitterFactor
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("backoffMultiplier must be >= 1.0");
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException("jitterFactor must be in [0.0, 1.0]");
        }
    }

    /**
     * Default append policy: 5 attempts, exponential backoff starting at 10ms.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(5, Duration.ofMillis(10), Duration.ofSeconds(1), 2.0, 0.2);
    }

    /**
     * No retry policy: single attempt only.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, Duration.ZERO, Duration.ZERO, 1.0, 0.0);
    }

    /**
     * Compute the backoff duration for a given attempt number.
     * 
     * @param attemptNumber 1-indexed attempt number
     * @return Duration to wait before next attempt
     */
    public Duration computeBackoff(int attemptNumber) {
        if (attemptNumber < 1) {
            throw new IllegalArgumentException("Attempt number must be >= 1");
        }
        
        // Base backoff: initialBackoff * (multiplier ^ (attempt - 1))
        double baseBackoffMs = initialBackoff.toMillis() * 
            Math.pow(backoffMultiplier, attemptNumber - 1);
        
        double cappedBackoffMs = Math.min(baseBackoffMs, maxBackoff.toMillis());
        
        // Apply jitter: backoff * (1 - jitter + random(0, 2*jitter))
        double jitterRange = cappedBackoffMs * jitterFactor;
        double jitteredBackoffMs = cappedBackoffMs - jitterRange + 
            ThreadLocalRandom.current().nextDouble() * 2 * jitterRange;
        
        return Duration.ofMillis((long) jitteredBackoffMs);
    }

    /**
     * Check if more attempts are available.
     * 
     * @param currentAttempt Current attempt number (1-indexed)
     * @return true if more attempts can be made
     */
    public boolean hasMoreAttempts(int currentAttempt) {
        return currentAttempt < maxAttempts;
    }
}
