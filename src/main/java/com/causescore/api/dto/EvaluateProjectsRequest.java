package com.causescore.api.dto;

import com.causescore.evaluation.CauseEvaluationRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * POST /api/v1/evaluate/cause request body. highestPowerRank is optional; without it the power-rank
 * component scores 0.
 */
public record EvaluateProjectsRequest(
        @NotNull(message = "INVALID_CAUSE")
        @Valid
        CauseRequest cause,

        @NotEmpty(message = "INVALID_PROJECT_IDS")
        List<@NotNull(message = "INVALID_PROJECT_IDS") @Positive(message = "INVALID_PROJECT_IDS") Long> projectIds,

        @Positive(message = "INVALID_POWER_RANK")
        Integer highestPowerRank
) {

    public CauseEvaluationRequest toEvaluationRequest() {
        return new CauseEvaluationRequest(cause.toCauseFacts(), projectIdStrings());
    }

    public List<String> projectIdStrings() {
        return projectIds.stream().map(String::valueOf).toList();
    }
}
