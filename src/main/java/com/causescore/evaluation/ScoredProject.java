package com.causescore.evaluation;

import com.causescore.scoring.ScoreBreakdown;

import java.time.Instant;

/**
 * One project's score within a cause.
 *
 * @param lastPostDate newest stored post used for scoring, null without posts
 */
public record ScoredProject(String projectId,
                            String projectTitle,
                            int causeScore,
                            ScoreBreakdown scoreBreakdown,
                            boolean hasStoredPosts,
                            int totalStoredPosts,
                            Instant lastPostDate,
                            Instant evaluationTimestamp) {

    /** Placeholder for a project that could not be scored. */
    public static ScoredProject zero(String projectId, String projectTitle) {
        return new ScoredProject(projectId, projectTitle, 0, ScoreBreakdown.zero(), false, 0, null, Instant.now());
    }
}
