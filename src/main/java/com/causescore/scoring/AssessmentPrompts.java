package com.causescore.scoring;

import com.causescore.catalog.ProjectFacts;
import com.causescore.domain.Platform;
import com.causescore.domain.StoredPost;

import java.util.Comparator;
import java.util.List;

/**
 * Rubric prompts for the single JSON-mode assessment call.
 */
final class AssessmentPrompts {

    static final int MAX_DESCRIPTION_CHARS = 1500;
    static final int MAX_UPDATE_CHARS = 1000;
    static final int MAX_POST_CHARS = 200;
    static final int MAX_POSTS_PER_PLATFORM = 10;

    static final String SYSTEM_PROMPT = """
            You are an expert evaluator of charitable and impact projects. Score each criterion from 0 to 100 and \
            keep scores consistent across projects.

            Criteria:
            - projectInfoQualityScore: clarity, completeness, transparency and professionalism of the project \
            description and latest update.
            - twitterQualityScore: quality and value of the project's X/Twitter posts. 0 when there are none.
            - farcasterQualityScore: quality and value of the project's Farcaster casts. 0 when there are none.
            - socialRelevanceScore: how closely the social posts relate to the cause's mission.
            - projectRelevanceScore: thematic alignment and goal consistency between the project and the cause.
            - evidenceOfImpactScore: concrete, verifiable evidence of social or environmental impact \
            (numbers, outcomes, beneficiaries, reports) across description, update and posts.

            Scale: 90-100 exceptional, 70-89 strong, 50-69 adequate, 30-49 weak, 10-29 poor, 0-9 missing or unrelated.

            Respond with one JSON object only:
            {"projectInfoQualityScore": <number>, "projectInfoQualityReasoning": "<short>",
             "twitterQualityScore": <number>, "farcasterQualityScore": <number>, "socialMediaQualityReasoning": "<short>",
             "socialRelevanceScore": <number>, "projectRelevanceScore": <number>, "relevanceReasoning": "<short>",
             "evidenceOfImpactScore": <number>, "evidenceOfImpactReasoning": "<short>"}""";

    private AssessmentPrompts() {
    }

    static String userPrompt(ScoringInput input) {
        ProjectFacts project = input.project();
        CauseFacts cause = input.cause();
        StringBuilder sb = new StringBuilder();
        sb.append("CAUSE\n");
        sb.append("Title: ").append(orNone(cause.title())).append('\n');
        sb.append("Description: ").append(truncate(cause.description(), MAX_DESCRIPTION_CHARS)).append('\n');
        if (!cause.categories().isEmpty()) {
            sb.append("Categories:\n");
            for (CauseFacts.Category c : cause.categories()) {
                sb.append("- ").append(orNone(c.mainCategoryTitle())).append(" / ").append(orNone(c.name()));
                if (c.description() != null && !c.description().isBlank()) {
                    sb.append(": ").append(truncate(c.description(), MAX_POST_CHARS));
                }
                sb.append('\n');
            }
        }
        sb.append("\nPROJECT\n");
        sb.append("Title: ").append(orNone(project.title())).append('\n');
        sb.append("Description: ").append(truncate(project.description(), MAX_DESCRIPTION_CHARS)).append('\n');
        sb.append("\nLATEST UPDATE\n");
        sb.append("Title: ").append(orNone(project.lastUpdateTitle())).append('\n');
        sb.append("Content: ").append(truncate(project.lastUpdateContent(), MAX_UPDATE_CHARS)).append('\n');
        sb.append("Date: ").append(project.lastUpdateDate() == null ? "unknown" : project.lastUpdateDate()).append('\n');
        appendPosts(sb, "X/TWITTER POSTS", postsFor(input.recentPosts(), Platform.TWITTER));
        appendPosts(sb, "FARCASTER CASTS", postsFor(input.recentPosts(), Platform.FARCASTER));
        return sb.toString();
    }

    private static List<StoredPost> postsFor(List<StoredPost> posts, Platform platform) {
        return posts.stream()
                .filter(p -> p.getPlatform() == platform)
                .sorted(Comparator.comparing(StoredPost::getPostTimestamp, Comparator.nullsLast(Comparator.reverseOrder())))
                .limit(MAX_POSTS_PER_PLATFORM)
                .toList();
    }

    private static void appendPosts(StringBuilder sb, String heading, List<StoredPost> posts) {
        sb.append('\n').append(heading).append('\n');
        if (posts.isEmpty()) {
            sb.append("None\n");
            return;
        }
        int i = 1;
        for (StoredPost p : posts) {
            sb.append(i++).append(". [").append(p.getPostTimestamp()).append("] ")
                    .append(truncate(p.getContent(), MAX_POST_CHARS)).append('\n');
        }
    }

    static String truncate(String text, int max) {
        if (text == null || text.isBlank()) {
            return "none";
        }
        String s = text.strip();
        return s.length() > max ? s.substring(0, max) + "... [truncated]" : s;
    }

    private static String orNone(String s) {
        return s == null || s.isBlank() ? "none" : s;
    }
}
