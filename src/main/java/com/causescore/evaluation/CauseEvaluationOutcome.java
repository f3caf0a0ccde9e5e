package com.causescore.evaluation;

/**
 * Per-cause entry of a batch evaluation; exactly one of {@code result} and {@code error} is set.
 */
public record CauseEvaluationOutcome(String causeId,
                                     String causeName,
                                     boolean success,
                                     EvaluationResult result,
                                     String error) {

    static CauseEvaluationOutcome succeeded(String causeId, String causeName, EvaluationResult result) {
        return new CauseEvaluationOutcome(causeId, causeName, true, result, null);
    }

    static CauseEvaluationOutcome failed(String causeId, String causeName, String error) {
        return new CauseEvaluationOutcome(causeId, causeName, false, null, error);
    }
}
