package com.causescore.scoring;

import java.time.Duration;
import java.time.Instant;

/**
 * Deterministic component formulas.
 */
final class ScoreMath {

    private ScoreMath() {
    }

    static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0;
        }
        return Math.max(0, Math.min(100, score));
    }

    static int clampRound(double score) {
        return (int) Math.round(clamp(score));
    }

    /** Whole days elapsed; a future instant counts as 0. */
    static long daysSince(Instant then, Instant now) {
        if (then == null || !then.isBefore(now)) {
            return 0;
        }
        return Duration.between(then, now).toDays();
    }

    /** 100 * e^(-ln2/halfLife * days). */
    static int exponentialDecay(Instant then, Instant now, double halfLifeDays) {
        if (then == null) {
            return 0;
        }
        double k = Math.log(2) / halfLifeDays;
        return clampRound(100 * Math.exp(-k * daysSince(then, now)));
    }

    static int linearFrequency(long postsInWindow, int postsForFullScore) {
        return clampRound(100.0 * Math.min(1.0, (double) postsInWindow / postsForFullScore));
    }

    /** (top - rank) / top * 100; 0 when either input is missing or not positive. */
    static int rankScore(Integer rank, Integer topRank) {
        if (rank == null || topRank == null || rank <= 0 || topRank <= 0) {
            return 0;
        }
        return clampRound((topRank - rank) / (double) topRank * 100);
    }
}
