package com.causescore.common;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RandomDelayRateLimiterTest {

    @Test
    void nextDelayMs_staysWithinRange() {
        RandomDelayRateLimiter limiter = new RandomDelayRateLimiter(2000, 3000);
        for (int i = 0; i < 100; i++) {
            assertThat(limiter.nextDelayMs()).isBetween(2000L, 3000L);
        }
    }

    @Test
    void acquire_spacesSequentialCallers() {
        RandomDelayRateLimiter limiter = new RandomDelayRateLimiter(30, 40);
        long start = System.nanoTime();
        limiter.acquire();
        limiter.acquire();
        limiter.acquire();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(85L);
    }

    @Test
    void acquire_spacesConcurrentCallers() throws Exception {
        RandomDelayRateLimiter limiter = new RandomDelayRateLimiter(25, 25);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch done = new CountDownLatch(4);
        long start = System.nanoTime();
        for (int i = 0; i < 4; i++) {
            pool.submit(() -> {
                limiter.acquire();
                done.countDown();
            });
        }
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        pool.shutdownNow();
        // four slots of 25ms each, issued one after another
        assertThat(elapsedMs).isGreaterThanOrEqualTo(95L);
    }

    @Test
    void invalidRange_rejected() {
        assertThatThrownBy(() -> new RandomDelayRateLimiter(500, 100)).isInstanceOf(IllegalArgumentException.class);
    }
}
