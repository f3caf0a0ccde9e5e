package com.causescore.common;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with additive random jitter for outbound platform calls.
 */
public final class RetryPolicy {

    private final long baseDelayMs;
    private final long maxJitterMs;
    private final int maxRetries;

    public RetryPolicy(long baseDelayMs, long maxJitterMs, int maxRetries) {
        if (baseDelayMs < 0 || maxJitterMs < 0 || maxRetries < 0) {
            throw new IllegalArgumentException("Retry settings must not be negative");
        }
        this.baseDelayMs = baseDelayMs;
        this.maxJitterMs = maxJitterMs;
        this.maxRetries = maxRetries;
    }

    /**
     * Delay in milliseconds before the given one-based retry.
     * Formula: baseDelay * 2^(retry-1) + random(0..maxJitter).
     */
    public long delayMs(int retry) {
        int exponent = Math.max(0, Math.min(retry - 1, 20));
        long exponential = baseDelayMs * (1L << exponent);
        long jitter = maxJitterMs == 0 ? 0 : ThreadLocalRandom.current().nextLong(maxJitterMs + 1);
        return exponential + jitter;
    }

    /** Retries after the initial call; total attempts is this plus one. */
    public int getMaxRetries() {
        return maxRetries;
    }

    public int totalAttempts() {
        return maxRetries + 1;
    }

    /**
     * Default: 5s base, up to 1s jitter, 3 retries.
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(5000L, 1000L, 3);
    }
}
