package com.causescore.evaluation;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Evaluation fan-out limits and result propagation.
 */
@ConfigurationProperties(prefix = "causescore.evaluation")
@NoArgsConstructor
@Getter
@Setter
public class EvaluationProperties {

    /** Projects scored at once within one cause. Default 5. */
    private int maxConcurrentProjectsPerCause = 5;

    /** Stored posts per platform handed to scoring. Default 10. */
    private int postsPerPlatform = 10;

    /** Push scores to the catalog after each cause. Default true. */
    private boolean reportScores = true;
}
