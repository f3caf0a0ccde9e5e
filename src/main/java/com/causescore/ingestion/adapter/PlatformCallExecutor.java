package com.causescore.ingestion.adapter;

import com.causescore.common.RandomDelayRateLimiter;
import com.causescore.common.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * Runs one outbound platform call behind the platform's random-delay limiter, retrying transient failures
 * with exponential backoff. Non-retryable {@link SocialApiException}s are rethrown immediately.
 * Without a limiter the call paces itself, one acquire per request it sends.
 */
@Slf4j
public class PlatformCallExecutor {

    private final String platformName;
    private final RandomDelayRateLimiter rateLimiter;
    private final RetryPolicy retryPolicy;

    public PlatformCallExecutor(String platformName, RandomDelayRateLimiter rateLimiter, RetryPolicy retryPolicy) {
        this.platformName = platformName;
        this.rateLimiter = rateLimiter;
        this.retryPolicy = retryPolicy != null ? retryPolicy : RetryPolicy.defaultPolicy();
    }

    public <T> T execute(String operation, Supplier<T> call) {
        RuntimeException lastException = null;
        for (int attempt = 0; attempt < retryPolicy.totalAttempts(); attempt++) {
            if (attempt > 0) {
                long delay = retryPolicy.delayMs(attempt);
                log.debug("{} {} retry {}/{} in {} ms", platformName, operation, attempt, retryPolicy.getMaxRetries(), delay);
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new SocialApiException("Interrupted during retry of " + operation, e, false, 0);
                }
            }
            if (rateLimiter != null) {
                rateLimiter.acquire();
            }
            try {
                return call.get();
            } catch (SocialApiException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                lastException = e;
            } catch (RuntimeException e) {
                lastException = e;
            }
            log.warn("{} {} attempt {} failed: {}", platformName, operation, attempt + 1,
                    lastException.getMessage());
        }
        throw new SocialApiException(platformName + " " + operation + " failed after "
                + retryPolicy.totalAttempts() + " attempts", lastException);
    }

    public String getPlatformName() {
        return platformName;
    }
}
