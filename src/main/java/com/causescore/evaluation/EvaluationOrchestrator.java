package com.causescore.evaluation;

import com.causescore.catalog.ProjectFacts;
import com.causescore.catalog.ProjectFactsService;
import com.causescore.config.AsyncConfig;
import com.causescore.scoring.CauseFacts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Bounded fan-out over causes (cause executor) and projects (project executor, at most N in flight per cause).
 * A failing project becomes a zero-score entry; a failing cause is reported without affecting the others.
 */
@Service
@Slf4j
public class EvaluationOrchestrator {

    private final ProjectFactsService projectFactsService;
    private final ProjectEvaluator projectEvaluator;
    private final ScoreReporter scoreReporter;
    private final EvaluationProperties properties;
    private final Executor causeExecutor;
    private final Executor projectExecutor;

    public EvaluationOrchestrator(ProjectFactsService projectFactsService,
                                  ProjectEvaluator projectEvaluator,
                                  ScoreReporter scoreReporter,
                                  EvaluationProperties properties,
                                  @Qualifier(AsyncConfig.CAUSE_EXECUTOR) Executor causeExecutor,
                                  @Qualifier(AsyncConfig.PROJECT_EXECUTOR) Executor projectExecutor) {
        this.projectFactsService = projectFactsService;
        this.projectEvaluator = projectEvaluator;
        this.scoreReporter = scoreReporter;
        this.properties = properties;
        this.causeExecutor = causeExecutor;
        this.projectExecutor = projectExecutor;
    }

    /**
     * Scores every requested project; the result has one entry per distinct id, sorted by score descending.
     */
    public EvaluationResult evaluate(CauseFacts cause, List<String> projectIds, Integer topPowerRank) {
        long started = System.currentTimeMillis();
        List<String> ids = new ArrayList<>(new LinkedHashSet<>(projectIds));
        log.info("Evaluating {} projects for cause {} ({})", ids.size(), cause.id(), cause.title());

        Map<String, ProjectFacts> facts = projectFactsService.getProjectsByIds(ids).stream()
                .collect(Collectors.toMap(ProjectFacts::id, Function.identity(), (a, b) -> a));

        Semaphore inFlight = new Semaphore(Math.max(1, properties.getMaxConcurrentProjectsPerCause()));
        List<CompletableFuture<ScoredProject>> futures = new ArrayList<>(ids.size());
        for (String id : ids) {
            ProjectFacts project = facts.get(id);
            if (project == null) {
                log.warn("No facts for project {} in cause {}, scoring 0", id, cause.id());
                futures.add(CompletableFuture.completedFuture(ScoredProject.zero(id, null)));
                continue;
            }
            inFlight.acquireUninterruptibly();
            CompletableFuture<ScoredProject> future;
            try {
                future = CompletableFuture.supplyAsync(() -> projectEvaluator.evaluate(project, cause, topPowerRank), projectExecutor);
            } catch (RuntimeException e) {
                inFlight.release();
                throw e;
            }
            futures.add(future
                    .whenComplete((r, e) -> inFlight.release())
                    .exceptionally(e -> {
                        Throwable failure = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                        log.warn("Scoring failed for project {} in cause {}: {}", id, cause.id(), failure.getMessage());
                        return ScoredProject.zero(id, project.title());
                    }));
        }

        List<ScoredProject> scored = futures.stream()
                .map(CompletableFuture::join)
                .sorted(Comparator.comparingInt(ScoredProject::causeScore).reversed())
                .toList();
        int withPosts = (int) scored.stream().filter(ScoredProject::hasStoredPosts).count();
        long elapsed = System.currentTimeMillis() - started;
        EvaluationResult result = new EvaluationResult(cause.id(), scored, EvaluationResult.SUCCESS, scored.size(),
                withPosts, elapsed, Instant.now());
        log.info("Cause {} evaluated: {} projects ({} with stored posts) in {} ms", cause.id(), scored.size(), withPosts, elapsed);

        if (properties.isReportScores()) {
            scoreReporter.reportAsync(cause.id(), scored);
        }
        return result;
    }

    /**
     * Evaluates causes concurrently on the cause executor. A cause that throws is reported as failed.
     */
    public MultiCauseEvaluationResult evaluateMany(List<CauseEvaluationRequest> requests, Integer topPowerRank) {
        long started = System.currentTimeMillis();
        List<CompletableFuture<CauseEvaluationOutcome>> futures = new ArrayList<>(requests.size());
        for (CauseEvaluationRequest request : requests) {
            CauseFacts cause = request.cause();
            futures.add(CompletableFuture
                    .supplyAsync(() -> evaluate(cause, request.projectIds(), topPowerRank), causeExecutor)
                    .thenApply(r -> CauseEvaluationOutcome.succeeded(cause.id(), cause.title(), r))
                    .exceptionally(e -> {
                        Throwable failure = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
                        log.error("Evaluation of cause {} failed", cause.id(), failure);
                        return CauseEvaluationOutcome.failed(cause.id(), cause.title(), String.valueOf(failure.getMessage()));
                    }));
        }
        List<CauseEvaluationOutcome> outcomes = futures.stream().map(CompletableFuture::join).toList();

        int successful = (int) outcomes.stream().filter(CauseEvaluationOutcome::success).count();
        int failed = outcomes.size() - successful;
        int totalProjects = outcomes.stream().filter(CauseEvaluationOutcome::success)
                .mapToInt(o -> o.result().totalProjects()).sum();
        int withPosts = outcomes.stream().filter(CauseEvaluationOutcome::success)
                .mapToInt(o -> o.result().projectsWithStoredPosts()).sum();
        EvaluationStatus status = failed == 0 ? EvaluationStatus.SUCCESS : EvaluationStatus.PARTIAL_SUCCESS;
        long elapsed = System.currentTimeMillis() - started;
        log.info("Batch evaluation: {} causes, {} succeeded, {} failed in {} ms", outcomes.size(), successful, failed, elapsed);
        return new MultiCauseEvaluationResult(outcomes, status, outcomes.size(), successful, failed, totalProjects,
                withPosts, elapsed, Instant.now());
    }
}
