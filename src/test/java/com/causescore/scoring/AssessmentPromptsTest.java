package com.causescore.scoring;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AssessmentPromptsTest {

    @Test
    void truncate_marksCutText() {
        assertThat(AssessmentPrompts.truncate("abcdef", 3)).isEqualTo("abc... [truncated]");
        assertThat(AssessmentPrompts.truncate("  abc ", 3)).isEqualTo("abc");
        assertThat(AssessmentPrompts.truncate(null, 3)).isEqualTo("none");
    }

    @Test
    void systemPrompt_listsEverySubScore() {
        assertThat(AssessmentPrompts.SYSTEM_PROMPT).contains("projectInfoQualityScore", "twitterQualityScore",
                "farcasterQualityScore", "socialRelevanceScore", "projectRelevanceScore", "evidenceOfImpactScore");
    }
}
