package com.chainwatch.common;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Spacing rate limiter for HTTP providers billed per request (block explorer free tier: 5 req/s).
 * Permits are spread evenly over the minute rather than released in bursts.
 */
public class RateLimiter {

    private final long minIntervalNanos;
    private final AtomicLong nextFreeAtNanos = new AtomicLong(0);

    /**
     * @param permitsPerMinute e.g. 300 for 5 requests per second
     */
    public RateLimiter(int permitsPerMinute) {
        if (permitsPerMinute <= 0) {
            throw new IllegalArgumentException("permitsPerMinute must be positive");
        }
        this.minIntervalNanos = 60_000_000_000L / permitsPerMinute;
    }

    /**
     * Waits for a permit at most {@code timeout}. Returns false when the next free slot lies beyond the timeout.
     */
    public boolean acquire(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long now = System.nanoTime();
            long next = nextFreeAtNanos.get();
            if (now >= next) {
                if (nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos)) {
                    return true;
                }
                continue;
            }
            if (next > deadline) {
                return false;
            }
            long sleepNanos = next - now;
            try {
                Thread.sleep(sleepNanos / 1_000_000, (int) (sleepNanos % 1_000_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    /**
     * Non-blocking: returns true if a permit was taken, false if the caller would have to wait.
     */
    public boolean tryAcquire() {
        long now = System.nanoTime();
        long next = nextFreeAtNanos.get();
        return now >= next && nextFreeAtNanos.compareAndSet(next, now + minIntervalNanos);
    }
}
