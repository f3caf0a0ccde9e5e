package com.causescore.scoring;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.beans.factory.InitializingBean;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Score weights and the deterministic component parameters. Invalid weights fail startup.
 */
@ConfigurationProperties(prefix = "causescore.scoring")
@NoArgsConstructor
@Getter
@Setter
public class ScoringProperties implements InitializingBean {

    private Weights weights = new Weights();

    /** Days until the update-recency score halves. Default 30. */
    private double updateRecencyHalfLifeDays = 30;

    /** Days until the social-recency score halves. Default 14. */
    private double socialRecencyHalfLifeDays = 14;

    /** Window counted by the frequency component. Default 30 days. */
    private int socialFrequencyWindowDays = 30;

    /** Posts inside the window needed for a full frequency score. Default 8. */
    private int minPostsForFullFrequency = 8;

    /** Statuses that may be scored (case-insensitive); a missing status is allowed. */
    private List<String> eligibleStatuses = List.of("active", "verified", "draft");

    @Override
    public void afterPropertiesSet() {
        toWeights();
        if (updateRecencyHalfLifeDays <= 0 || socialRecencyHalfLifeDays <= 0) {
            throw new IllegalStateException("Recency half-lives must be positive");
        }
        if (socialFrequencyWindowDays <= 0 || minPostsForFullFrequency <= 0) {
            throw new IllegalStateException("Frequency window and post threshold must be positive");
        }
    }

    public ScoringWeights toWeights() {
        return new ScoringWeights(weights.projectInfoQuality, weights.updateRecency, weights.socialMediaQuality,
                weights.socialMediaRecency, weights.socialMediaFrequency, weights.relevanceToCause,
                weights.evidenceOfImpact, weights.givPowerRank).validate();
    }

    @Getter
    @Setter
    public static class Weights {
        private double projectInfoQuality = 0.15;
        private double updateRecency = 0.10;
        private double socialMediaQuality = 0.10;
        private double socialMediaRecency = 0.05;
        private double socialMediaFrequency = 0.05;
        private double relevanceToCause = 0.20;
        private double evidenceOfImpact = 0.20;
        private double givPowerRank = 0.15;
    }
}
