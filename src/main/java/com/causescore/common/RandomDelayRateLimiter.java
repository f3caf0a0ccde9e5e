package com.causescore.common;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Spaces outbound requests by a random delay drawn from [minDelayMs, maxDelayMs].
 * Every caller waits one random delay, counted from now or from the previous caller's slot
 * when that is later, so two requests are never issued back to back, also across threads.
 */
public class RandomDelayRateLimiter {

    private final long minDelayMs;
    private final long maxDelayMs;
    private final AtomicLong lastSlotNanos = new AtomicLong(Long.MIN_VALUE);

    public RandomDelayRateLimiter(long minDelayMs, long maxDelayMs) {
        if (minDelayMs < 0 || maxDelayMs < minDelayMs) {
            throw new IllegalArgumentException("Invalid delay range [" + minDelayMs + ", " + maxDelayMs + "]");
        }
        this.minDelayMs = minDelayMs;
        this.maxDelayMs = maxDelayMs;
    }

    /**
     * Blocks until this caller's slot arrives. Returns the milliseconds waited.
     */
    public long acquire() {
        long delayNanos = nextDelayMs() * 1_000_000L;
        long now;
        long slot;
        long previous;
        do {
            now = System.nanoTime();
            previous = lastSlotNanos.get();
            slot = (previous == Long.MIN_VALUE ? now : Math.max(now, previous)) + delayNanos;
        } while (!lastSlotNanos.compareAndSet(previous, slot));

        long sleepNanos = slot - now;
        if (sleepNanos > 0) {
            try {
                Thread.sleep(sleepNanos / 1_000_000, (int) (sleepNanos % 1_000_000));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Rate limiter interrupted", e);
            }
        }
        return Math.max(0, sleepNanos / 1_000_000);
    }

    long nextDelayMs() {
        if (maxDelayMs == minDelayMs) {
            return minDelayMs;
        }
        return ThreadLocalRandom.current().nextLong(minDelayMs, maxDelayMs + 1);
    }

    public long getMinDelayMs() {
        return minDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }
}
