package com.causescore.scoring;

import com.causescore.scoring.llm.CompletionOptions;
import com.causescore.scoring.llm.LlmClient;
import com.causescore.scoring.llm.LlmProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Asks the text-generation provider for the qualitative sub-scores. Never throws: any provider or parsing
 * failure yields an all-zero assessment.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QualitativeAssessor {

    private final LlmClient llmClient;
    private final LlmProperties llmProperties;

    public QualitativeAssessment assess(ScoringInput input) {
        String projectId = input.project().id();
        try {
            String content = llmClient.complete(AssessmentPrompts.SYSTEM_PROMPT, AssessmentPrompts.userPrompt(input),
                    new CompletionOptions(llmProperties.getTemperature(), llmProperties.getMaxTokens(), true));
            return parseAssessment(content).orElseGet(() -> {
                log.warn("Unusable assessment for project {}, scoring qualitative components as 0", projectId);
                return QualitativeAssessment.zero("Assessment response could not be parsed");
            });
        } catch (RuntimeException e) {
            log.warn("Assessment failed for project {}: {}", projectId, e.getMessage());
            return QualitativeAssessment.zero("Assessment failed");
        }
    }

    /**
     * Empty when the content is not a JSON object or any sub-score is missing or non-numeric.
     * Tolerates a fenced code block around the object.
     */
    static Optional<QualitativeAssessment> parseAssessment(String content) {
        if (content == null) {
            return Optional.empty();
        }
        String json = content.strip();
        int start = json.indexOf('{');
        int end = json.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        JsonNode root;
        try {
            root = new ObjectMapper().readTree(json.substring(start, end + 1));
        } catch (Exception e) {
            return Optional.empty();
        }
        String[] required = {"projectInfoQualityScore", "twitterQualityScore", "farcasterQualityScore",
                "socialRelevanceScore", "projectRelevanceScore", "evidenceOfImpactScore"};
        for (String field : required) {
            if (!root.path(field).isNumber()) {
                return Optional.empty();
            }
        }
        return Optional.of(new QualitativeAssessment(
                root.path("projectInfoQualityScore").asDouble(),
                root.path("twitterQualityScore").asDouble(),
                root.path("farcasterQualityScore").asDouble(),
                root.path("socialRelevanceScore").asDouble(),
                root.path("projectRelevanceScore").asDouble(),
                root.path("evidenceOfImpactScore").asDouble(),
                root.path("projectInfoQualityReasoning").asText(null),
                root.path("socialMediaQualityReasoning").asText(null),
                root.path("relevanceReasoning").asText(null),
                root.path("evidenceOfImpactReasoning").asText(null)));
    }
}
