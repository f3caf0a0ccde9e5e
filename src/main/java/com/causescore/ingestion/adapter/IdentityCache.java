package com.causescore.ingestion.adapter;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Function;

/**
 * Handle to identity cache with separate lifetimes: resolved identities live long, confirmed misses short.
 * Exceptions from the loader are not cached, so transient lookup failures are retried next time.
 */
public class IdentityCache {

    private final Cache<String, PlatformIdentity> resolved;
    private final Cache<String, Boolean> missing;

    public IdentityCache(Duration resolvedTtl, Duration missingTtl, long maximumSize) {
        this.resolved = Caffeine.newBuilder()
                .expireAfterWrite(resolvedTtl)
                .maximumSize(maximumSize)
                .build();
        this.missing = Caffeine.newBuilder()
                .expireAfterWrite(missingTtl)
                .maximumSize(maximumSize)
                .build();
    }

    public Optional<PlatformIdentity> resolve(String handle, Function<String, Optional<PlatformIdentity>> loader) {
        String key = handle.toLowerCase(Locale.ROOT);
        PlatformIdentity cached = resolved.getIfPresent(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        if (missing.getIfPresent(key) != null) {
            return Optional.empty();
        }
        Optional<PlatformIdentity> loaded = loader.apply(handle);
        if (loaded.isPresent()) {
            resolved.put(key, loaded.get());
        } else {
            missing.put(key, Boolean.TRUE);
        }
        return loaded;
    }

    void invalidate(String handle) {
        String key = handle.toLowerCase(Locale.ROOT);
        resolved.invalidate(key);
        missing.invalidate(key);
    }
}
