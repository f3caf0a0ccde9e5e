package com.causescore.ingestion.adapter;

import com.causescore.domain.Platform;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * One implementation per social platform; callers pick the adapter whose {@link #supports} matches.
 * Implementations own their rate limiter, retry policy and identity cache.
 */
public interface SocialPlatformAdapter {

    boolean supports(Platform platform);

    /**
     * Resolve a handle (or profile URL) to a stable identity. Empty when the handle does not exist or was released.
     */
    Optional<PlatformIdentity> resolveIdentity(String handle);

    /**
     * Recent posts for the identity, newest first. Scanning stops at the first item strictly older than
     * sinceWatermark (when given) and never goes beyond the configured lookback or scan limit.
     * Returns an empty list when retries are exhausted.
     */
    List<NormalizedPost> fetchRecent(PlatformIdentity identity, Instant sinceWatermark);

    /**
     * Resolve then fetch; empty when the handle cannot be resolved.
     */
    default List<NormalizedPost> fetchRecentForHandle(String handle, Instant sinceWatermark) {
        return resolveIdentity(handle)
                .map(identity -> fetchRecent(identity, sinceWatermark))
                .orElse(List.of());
    }
}
