package com.causescore.scoring;

public record ProjectScore(int total, ScoreBreakdown breakdown) {

    public static ProjectScore zero() {
        return new ProjectScore(0, ScoreBreakdown.zero());
    }
}
