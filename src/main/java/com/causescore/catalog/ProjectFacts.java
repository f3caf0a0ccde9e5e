package com.causescore.catalog;

import java.time.Instant;

/**
 * Project attributes the scoring needs, whether read from the catalog or from the local mirror.
 *
 * @param powerRank GIVpower rank, lower is better; null when the project has no rank
 */
public record ProjectFacts(String id,
                           String title,
                           String slug,
                           String description,
                           String status,
                           Double qualityScore,
                           Integer powerRank,
                           Instant lastUpdateDate,
                           String lastUpdateTitle,
                           String lastUpdateContent,
                           String twitterHandle,
                           String farcasterHandle) {
}
