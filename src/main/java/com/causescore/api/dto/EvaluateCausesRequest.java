package com.causescore.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * POST /api/v1/evaluate/causes request body. The top-level highestPowerRank applies to every cause.
 */
public record EvaluateCausesRequest(
        @NotEmpty(message = "INVALID_CAUSES")
        List<@Valid EvaluateProjectsRequest> causes,

        @Positive(message = "INVALID_POWER_RANK")
        Integer highestPowerRank
) {
}
