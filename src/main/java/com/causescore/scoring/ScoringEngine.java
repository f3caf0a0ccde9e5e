package com.causescore.scoring;

import com.causescore.domain.StoredPost;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pure scoring: deterministic components from dates, counts and rank, qualitative components from the assessment,
 * combined as a fixed weighted sum rounded and clamped to 0-100.
 */
@Component
public class ScoringEngine {

    private final ScoringProperties properties;
    private final ScoringWeights weights;
    private final Set<String> eligibleStatuses;

    public ScoringEngine(ScoringProperties properties) {
        this.properties = properties;
        this.weights = properties.toWeights();
        this.eligibleStatuses = properties.getEligibleStatuses().stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
    }

    public ProjectScore score(ScoringInput input, QualitativeAssessment assessment) {
        return score(input, assessment, Instant.now());
    }

    public ProjectScore score(ScoringInput input, QualitativeAssessment assessment, Instant now) {
        Instant newestPost = input.recentPosts().stream()
                .map(StoredPost::getPostTimestamp)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);
        Instant windowStart = now.minus(Duration.ofDays(properties.getSocialFrequencyWindowDays()));
        long postsInWindow = input.recentPosts().stream()
                .map(StoredPost::getPostTimestamp)
                .filter(t -> t != null && !t.isBefore(windowStart))
                .count();

        ScoreBreakdown breakdown = new ScoreBreakdown(
                ScoreMath.clampRound(assessment.projectInfoQualityScore()),
                ScoreMath.exponentialDecay(input.project().lastUpdateDate(), now, properties.getUpdateRecencyHalfLifeDays()),
                ScoreMath.clampRound(assessment.socialMediaQualityScore()),
                ScoreMath.exponentialDecay(newestPost, now, properties.getSocialRecencyHalfLifeDays()),
                ScoreMath.linearFrequency(postsInWindow, properties.getMinPostsForFullFrequency()),
                ScoreMath.clampRound(assessment.relevanceToCauseScore()),
                ScoreMath.clampRound(assessment.evidenceOfImpactScore()),
                ScoreMath.rankScore(input.project().powerRank(), input.topPowerRank()));
        return new ProjectScore(ScoreMath.clampRound(breakdown.weightedTotal(weights)), breakdown);
    }

    /** Active, verified and draft projects (any case) are scored; so are projects without a status. */
    public boolean isEligible(String status) {
        return status == null || status.isBlank() || eligibleStatuses.contains(status.strip().toLowerCase(Locale.ROOT));
    }

    public ScoringWeights weights() {
        return weights;
    }
}
