package com.causescore.scoring;

/**
 * Sub-scores returned by the text-generation provider, each clamped to 0-100.
 * Platform quality scores and the two relevance scores are blended 50/50 into one component each.
 */
public record QualitativeAssessment(double projectInfoQualityScore,
                                    double twitterQualityScore,
                                    double farcasterQualityScore,
                                    double socialRelevanceScore,
                                    double projectRelevanceScore,
                                    double evidenceOfImpactScore,
                                    String projectInfoQualityReasoning,
                                    String socialMediaQualityReasoning,
                                    String relevanceReasoning,
                                    String evidenceOfImpactReasoning) {

    public QualitativeAssessment {
        projectInfoQualityScore = ScoreMath.clamp(projectInfoQualityScore);
        twitterQualityScore = ScoreMath.clamp(twitterQualityScore);
        farcasterQualityScore = ScoreMath.clamp(farcasterQualityScore);
        socialRelevanceScore = ScoreMath.clamp(socialRelevanceScore);
        projectRelevanceScore = ScoreMath.clamp(projectRelevanceScore);
        evidenceOfImpactScore = ScoreMath.clamp(evidenceOfImpactScore);
    }

    public double socialMediaQualityScore() {
        return (twitterQualityScore + farcasterQualityScore) / 2.0;
    }

    public double relevanceToCauseScore() {
        return (socialRelevanceScore + projectRelevanceScore) / 2.0;
    }

    public static QualitativeAssessment zero(String reason) {
        return new QualitativeAssessment(0, 0, 0, 0, 0, 0, reason, reason, reason, reason);
    }
}
