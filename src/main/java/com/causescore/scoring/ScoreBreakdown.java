package com.causescore.scoring;

/**
 * The eight component scores, each 0-100.
 */
public record ScoreBreakdown(int projectInfoQualityScore,
                             int updateRecencyScore,
                             int socialMediaQualityScore,
                             int socialMediaRecencyScore,
                             int socialMediaFrequencyScore,
                             int relevanceToCauseScore,
                             int evidenceOfImpactScore,
                             int givPowerRankScore) {

    public static ScoreBreakdown zero() {
        return new ScoreBreakdown(0, 0, 0, 0, 0, 0, 0, 0);
    }

    double weightedTotal(ScoringWeights w) {
        return projectInfoQualityScore * w.projectInfoQuality()
                + updateRecencyScore * w.updateRecency()
                + socialMediaQualityScore * w.socialMediaQuality()
                + socialMediaRecencyScore * w.socialMediaRecency()
                + socialMediaFrequencyScore * w.socialMediaFrequency()
                + relevanceToCauseScore * w.relevanceToCause()
                + evidenceOfImpactScore * w.evidenceOfImpact()
                + givPowerRankScore * w.givPowerRank();
    }
}
