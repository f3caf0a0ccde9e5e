package com.causescore.scoring;

import com.causescore.catalog.ProjectFacts;
import com.causescore.domain.StoredPost;

import java.util.List;

/**
 * Everything one (project, cause) score is computed from.
 *
 * @param recentPosts  stored posts across platforms, any order
 * @param topPowerRank largest rank in the population; null disables the rank component
 */
public record ScoringInput(ProjectFacts project, CauseFacts cause, List<StoredPost> recentPosts, Integer topPowerRank) {

    public ScoringInput {
        recentPosts = recentPosts == null ? List.of() : List.copyOf(recentPosts);
    }
}
