package com.nayem.leasehold.broker;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter, bounded below and above.
 */
public class BackoffStrategy {

    private static final int MAX_SHIFT = 30;

    private final double jitterPercent;

    public BackoffStrategy(double jitterPercent) {
        this.jitterPercent = Math.max(0.0, Math.min(1.0, jitterPercent));
    }

    /**
     * Calculates the delay before a retry.
     *
     * @param attempt    The retry attempt number (0-indexed)
     * @param minDelayMs Delay of the first retry in milliseconds
     * @param maxDelayMs Maximum delay in milliseconds
     * @return Delay in milliseconds, never below {@code minDelayMs}
     */
    public long calculateBackoff(int attempt, long minDelayMs, long maxDelayMs) {
        long exponentialDelay = minDelayMs * (1L << Math.min(Math.max(attempt, 0), MAX_SHIFT));
        if (exponentialDelay < 0) {
            exponentialDelay = maxDelayMs;
        }
        long cappedDelay = Math.max(minDelayMs, Math.min(exponentialDelay, maxDelayMs));

        if (jitterPercent == 0.0) {
            return cappedDelay;
        }

        long jitterRange = (long) ((cappedDelay - minDelayMs) * jitterPercent);
        long fixedPortion = cappedDelay - jitterRange;
        long randomPortion = ThreadLocalRandom.current().nextLong(jitterRange + 1);

        return fixedPortion + randomPortion;
    }
}
