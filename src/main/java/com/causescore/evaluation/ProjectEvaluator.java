package com.causescore.evaluation;

import com.causescore.catalog.ProjectFacts;
import com.causescore.domain.Platform;
import com.causescore.domain.StoredPost;
import com.causescore.domain.TrackedAccount;
import com.causescore.domain.TrackedAccountRepository;
import com.causescore.ingestion.store.PostStore;
import com.causescore.scoring.CauseFacts;
import com.causescore.scoring.ProjectScore;
import com.causescore.scoring.QualitativeAssessment;
import com.causescore.scoring.QualitativeAssessor;
import com.causescore.scoring.ScoringEngine;
import com.causescore.scoring.ScoringInput;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Scores one project for one cause from its stored posts and facts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProjectEvaluator {

    private final TrackedAccountRepository accountRepository;
    private final PostStore postStore;
    private final QualitativeAssessor assessor;
    private final ScoringEngine scoringEngine;
    private final EvaluationProperties properties;

    public ScoredProject evaluate(ProjectFacts project, CauseFacts cause, Integer topPowerRank) {
        List<StoredPost> posts = storedPosts(project.id());
        Instant lastPost = posts.stream()
                .map(StoredPost::getPostTimestamp)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElse(null);

        ProjectScore score;
        if (!scoringEngine.isEligible(project.status())) {
            log.debug("Project {} has status {}, not eligible for scoring", project.id(), project.status());
            score = ProjectScore.zero();
        } else {
            ScoringInput input = new ScoringInput(project, cause, posts, topPowerRank);
            QualitativeAssessment assessment = assessor.assess(input);
            score = scoringEngine.score(input, assessment);
        }
        return new ScoredProject(project.id(), project.title(), score.total(), score.breakdown(),
                !posts.isEmpty(), posts.size(), lastPost, Instant.now());
    }

    private List<StoredPost> storedPosts(String projectId) {
        TrackedAccount account = accountRepository.findByProjectId(projectId).orElse(null);
        if (account == null) {
            return List.of();
        }
        List<StoredPost> posts = new ArrayList<>();
        for (Platform platform : Platform.values()) {
            posts.addAll(postStore.recent(account.getId(), platform, properties.getPostsPerPlatform()));
        }
        return posts;
    }
}
