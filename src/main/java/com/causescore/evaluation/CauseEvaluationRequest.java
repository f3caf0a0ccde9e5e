package com.causescore.evaluation;

import com.causescore.scoring.CauseFacts;

import java.util.List;

public record CauseEvaluationRequest(CauseFacts cause, List<String> projectIds) {

    public CauseEvaluationRequest {
        projectIds = projectIds == null ? List.of() : List.copyOf(projectIds);
    }
}
