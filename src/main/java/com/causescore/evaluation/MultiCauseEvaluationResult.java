package com.causescore.evaluation;

import java.time.Instant;
import java.util.List;

public record MultiCauseEvaluationResult(List<CauseEvaluationOutcome> data,
                                         EvaluationStatus status,
                                         int totalCauses,
                                         int successfulCauses,
                                         int failedCauses,
                                         int totalProjects,
                                         int totalProjectsWithStoredPosts,
                                         long evaluationDuration,
                                         Instant timestamp) {
}
