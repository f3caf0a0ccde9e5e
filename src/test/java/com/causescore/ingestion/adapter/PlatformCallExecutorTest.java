package com.causescore.ingestion.adapter;

import com.causescore.common.RandomDelayRateLimiter;
import com.causescore.common.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PlatformCallExecutorTest {

    private final PlatformCallExecutor executor = new PlatformCallExecutor("test",
            new RandomDelayRateLimiter(0, 0), new RetryPolicy(0, 0, 3));

    @Test
    void transientFailure_retriedUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();
        String result = executor.execute("timeline", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new SocialApiException("503");
            }
            return "ok";
        });
        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    void exhaustedRetries_throwWithLastCause() {
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> executor.execute("timeline", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        }))
                .isInstanceOf(SocialApiException.class)
                .hasMessageContaining("failed after 4 attempts")
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(calls).hasValue(4);
    }

    @Test
    void nonRetryableFailure_notRetried() {
        AtomicInteger calls = new AtomicInteger();
        assertThatThrownBy(() -> executor.execute("lookup", () -> {
            calls.incrementAndGet();
            throw new SocialApiException("not found", null, false, 404);
        })).isInstanceOf(SocialApiException.class).hasMessage("not found");
        assertThat(calls).hasValue(1);
    }
}
