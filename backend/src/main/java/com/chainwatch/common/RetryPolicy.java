package com.chainwatch.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter for upstream provider calls.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final double jitterFactor;
    private final int maxAttempts;

    public RetryPolicy(long baseDelayMs, double jitterFactor, int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts must be positive");
        }
        this.baseDelayMs = Math.max(0L, baseDelayMs);
        this.jitterFactor = Math.max(0.0, Math.min(1.0, jitterFactor));
        this.maxAttempts = maxAttempts;
    }

    /**
     * Delay before the retry that follows the given zero-based failed attempt: baseDelay * 2^attempt, then jitter.
     */
    public long delayMs(int failedAttempt) {
        long exponential = baseDelayMs * (1L << Math.min(Math.max(failedAttempt, 0), 20));
        return jitter(exponential);
    }

    private long jitter(long value) {
        if (jitterFactor == 0.0) {
            return value;
        }
        double factor = 1.0 + (ThreadLocalRandom.current().nextDouble() * 2.0 - 1.0) * jitterFactor;
        return Math.max(0, (long) (value * factor));
    }

    /** Total attempts including the first call. */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Default: 500ms base, ±20% jitter, 3 attempts. A failed tick is retried on the next tick anyway.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(500L, 0.2, 3);
    }

    /** Single attempt, no backoff. */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0L, 0.0, 1);
    }
}
