package com.causescore.evaluation;

import java.time.Instant;
import java.util.List;

/**
 * Scores for one cause, sorted by score descending.
 *
 * @param evaluationDuration wall time in milliseconds
 */
public record EvaluationResult(String causeId,
                               List<ScoredProject> data,
                               String status,
                               int totalProjects,
                               int projectsWithStoredPosts,
                               long evaluationDuration,
                               Instant timestamp) {

    public static final String SUCCESS = "success";
}
