package com.causescore.ingestion.adapter;

import com.causescore.domain.Platform;

import java.time.Instant;
import java.util.Map;

/**
 * Platform-agnostic post produced by an adapter. Only validated, typed values cross the adapter boundary.
 */
public record NormalizedPost(String postId,
                             Platform platform,
                             String content,
                             String url,
                             Instant timestamp,
                             Map<String, Object> metadata) {

    public NormalizedPost {
        if (postId == null || postId.isBlank()) {
            throw new IllegalArgumentException("postId is required");
        }
        if (platform == null || timestamp == null) {
            throw new IllegalArgumentException("platform and timestamp are required");
        }
        content = content == null ? "" : content;
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }
}
