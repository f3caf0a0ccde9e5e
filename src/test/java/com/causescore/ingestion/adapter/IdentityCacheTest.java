package com.causescore.ingestion.adapter;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentityCacheTest {

    private final IdentityCache cache = new IdentityCache(Duration.ofHours(24), Duration.ofMinutes(60), 100);

    @Test
    void resolvedIdentity_loadedOnceCaseInsensitive() {
        AtomicInteger loads = new AtomicInteger();
        PlatformIdentity identity = PlatformIdentity.of("Giveth", "42");

        assertThat(cache.resolve("Giveth", h -> { loads.incrementAndGet(); return Optional.of(identity); })).contains(identity);
        assertThat(cache.resolve("giveth", h -> { loads.incrementAndGet(); return Optional.of(identity); })).contains(identity);

        assertThat(loads).hasValue(1);
    }

    @Test
    void missingHandle_cachedAsNegative() {
        AtomicInteger loads = new AtomicInteger();
        assertThat(cache.resolve("ghost", h -> { loads.incrementAndGet(); return Optional.empty(); })).isEmpty();
        assertThat(cache.resolve("ghost", h -> { loads.incrementAndGet(); return Optional.empty(); })).isEmpty();
        assertThat(loads).hasValue(1);
    }

    @Test
    void loaderFailure_notCached() {
        assertThatThrownBy(() -> cache.resolve("flaky", h -> { throw new SocialApiException("timeout"); }))
                .isInstanceOf(SocialApiException.class);
        assertThat(cache.resolve("flaky", h -> Optional.of(PlatformIdentity.of("flaky", "7")))).isPresent();
    }

    @Test
    void invalidate_forcesReload() {
        AtomicInteger loads = new AtomicInteger();
        cache.resolve("giveth", h -> { loads.incrementAndGet(); return Optional.of(PlatformIdentity.of(h, "1")); });
        cache.invalidate("GIVETH");
        cache.resolve("giveth", h -> { loads.incrementAndGet(); return Optional.of(PlatformIdentity.of(h, "1")); });
        assertThat(loads).hasValue(2);
    }
}
