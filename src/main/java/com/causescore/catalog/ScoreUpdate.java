package com.causescore.catalog;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * One row of the bulk score push. Scores are sent with two decimals.
 */
public record ScoreUpdate(long causeId, long projectId, double causeScore) {

    public ScoreUpdate {
        if (causeId <= 0 || projectId <= 0) {
            throw new IllegalArgumentException("Cause and project ids must be positive: " + causeId + "/" + projectId);
        }
        if (causeScore < 0 || causeScore > 100) {
            throw new IllegalArgumentException("Cause score out of range: " + causeScore);
        }
        causeScore = BigDecimal.valueOf(causeScore).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    /**
     * @throws IllegalArgumentException when either id is not a positive integer
     */
    public static ScoreUpdate of(String causeId, String projectId, double causeScore) {
        try {
            return new ScoreUpdate(Long.parseLong(causeId.strip()), Long.parseLong(projectId.strip()), causeScore);
        } catch (NumberFormatException | NullPointerException e) {
            throw new IllegalArgumentException("Non-numeric id: cause " + causeId + ", project " + projectId, e);
        }
    }
}
