package com.causescore.evaluation;

import com.causescore.catalog.ProjectFacts;
import com.causescore.catalog.ProjectFactsService;
import com.causescore.config.AsyncConfig;
import com.causescore.scoring.CauseFacts;
import com.causescore.scoring.ScoreBreakdown;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class EvaluationOrchestratorTest {

    private static final Executor DIRECT = Runnable::run;
    private static final CauseFacts CAUSE = new CauseFacts("7", "Oceans", "Clean oceans", List.of());

    @Mock
    private ProjectFactsService projectFactsService;
    @Mock
    private ProjectEvaluator projectEvaluator;
    @Mock
    private ScoreReporter scoreReporter;

    private EvaluationProperties properties;
    private EvaluationOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        properties = new EvaluationProperties();
        orchestrator = new EvaluationOrchestrator(projectFactsService, projectEvaluator, scoreReporter, properties, DIRECT, DIRECT);
    }

    @Test
    @DisplayName("a failing project scores 0 and the rest are sorted by score")
    void evaluate_failingProjectBecomesZeroEntry() {
        List<String> ids = List.of("1", "2", "3", "4", "5");
        when(projectFactsService.getProjectsByIds(ids)).thenReturn(ids.stream().map(EvaluationOrchestratorTest::facts).toList());
        when(projectEvaluator.evaluate(any(), eq(CAUSE), any())).thenAnswer(inv -> {
            ProjectFacts p = inv.getArgument(0);
            if (p.id().equals("3")) {
                throw new IllegalStateException("assessment exploded");
            }
            return scored(p.id(), Integer.parseInt(p.id()) * 10, true);
        });

        EvaluationResult result = orchestrator.evaluate(CAUSE, ids, 100);

        assertThat(result.data()).extracting(ScoredProject::projectId).containsExactly("5", "4", "2", "1", "3");
        assertThat(result.data()).extracting(ScoredProject::causeScore).containsExactly(50, 40, 20, 10, 0);
        ScoredProject failed = result.data().get(4);
        assertThat(failed.projectTitle()).isEqualTo("Project 3");
        assertThat(failed.scoreBreakdown()).isEqualTo(ScoreBreakdown.zero());
        assertThat(result.totalProjects()).isEqualTo(5);
        assertThat(result.projectsWithStoredPosts()).isEqualTo(4);
        assertThat(result.status()).isEqualTo(EvaluationResult.SUCCESS);
        verify(scoreReporter).reportAsync("7", result.data());
    }

    @Test
    void evaluate_unknownProjectScoresZeroWithoutTitle() {
        when(projectFactsService.getProjectsByIds(List.of("1", "404"))).thenReturn(List.of(facts("1")));
        when(projectEvaluator.evaluate(any(), eq(CAUSE), any())).thenReturn(scored("1", 30, false));

        EvaluationResult result = orchestrator.evaluate(CAUSE, List.of("1", "404", "1"), null);

        assertThat(result.data()).hasSize(2);
        assertThat(result.data().get(1).projectId()).isEqualTo("404");
        assertThat(result.data().get(1).projectTitle()).isNull();
        assertThat(result.data().get(1).causeScore()).isZero();
    }

    @Test
    void evaluate_reportingDisabled() {
        properties.setReportScores(false);
        when(projectFactsService.getProjectsByIds(anyList())).thenReturn(List.of());

        EvaluationResult result = orchestrator.evaluate(CAUSE, List.of(), null);

        assertThat(result.data()).isEmpty();
        verify(scoreReporter, never()).reportAsync(any(), any());
    }

    @Test
    @DisplayName("one failing cause yields PARTIAL_SUCCESS and keeps the others")
    void evaluateMany_partialSuccess() {
        CauseFacts broken = new CauseFacts("8", "Forests", null, List.of());
        when(projectFactsService.getProjectsByIds(List.of("1"))).thenReturn(List.of(facts("1")));
        when(projectFactsService.getProjectsByIds(List.of("2"))).thenThrow(new IllegalStateException("database down"));
        when(projectEvaluator.evaluate(any(), any(), any())).thenReturn(scored("1", 70, true));

        MultiCauseEvaluationResult result = orchestrator.evaluateMany(List.of(
                new CauseEvaluationRequest(CAUSE, List.of("1")),
                new CauseEvaluationRequest(broken, List.of("2"))), null);

        assertThat(result.status()).isEqualTo(EvaluationStatus.PARTIAL_SUCCESS);
        assertThat(result.totalCauses()).isEqualTo(2);
        assertThat(result.successfulCauses()).isEqualTo(1);
        assertThat(result.failedCauses()).isEqualTo(1);
        assertThat(result.totalProjects()).isEqualTo(1);
        assertThat(result.totalProjectsWithStoredPosts()).isEqualTo(1);
        assertThat(result.data().get(0).result().data().get(0).causeScore()).isEqualTo(70);
        CauseEvaluationOutcome failed = result.data().get(1);
        assertThat(failed.success()).isFalse();
        assertThat(failed.causeName()).isEqualTo("Forests");
        assertThat(failed.error()).isEqualTo("database down");
        assertThat(failed.result()).isNull();
    }

    @Test
    void evaluateMany_allSucceed() {
        when(projectFactsService.getProjectsByIds(anyList())).thenReturn(List.of());

        MultiCauseEvaluationResult result = orchestrator.evaluateMany(List.of(new CauseEvaluationRequest(CAUSE, List.of())), 10);

        assertThat(result.status()).isEqualTo(EvaluationStatus.SUCCESS);
        assertThat(result.failedCauses()).isZero();
    }

    @Test
    @DisplayName("no more than maxConcurrentProjectsPerCause projects are scored at once")
    void evaluate_capsConcurrentProjectsPerCause() throws Exception {
        ExecutorService projectPool = Executors.newFixedThreadPool(10);
        ExecutorService caller = Executors.newSingleThreadExecutor();
        try {
            orchestrator = new EvaluationOrchestrator(projectFactsService, projectEvaluator, scoreReporter, properties,
                    DIRECT, projectPool);
            List<String> ids = IntStream.rangeClosed(1, 12).mapToObj(String::valueOf).toList();
            when(projectFactsService.getProjectsByIds(ids)).thenReturn(ids.stream().map(EvaluationOrchestratorTest::facts).toList());
            int limit = properties.getMaxConcurrentProjectsPerCause();
            AtomicInteger running = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            CountDownLatch saturated = new CountDownLatch(limit);
            CountDownLatch release = new CountDownLatch(1);
            when(projectEvaluator.evaluate(any(), eq(CAUSE), any())).thenAnswer(inv -> {
                peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                saturated.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                    ProjectFacts p = inv.getArgument(0);
                    return scored(p.id(), 10, false);
                } finally {
                    running.decrementAndGet();
                }
            });

            Future<EvaluationResult> pending = caller.submit(() -> orchestrator.evaluate(CAUSE, ids, null));
            assertThat(saturated.await(5, TimeUnit.SECONDS)).isTrue();
            Thread.sleep(200);
            assertThat(running.get()).isEqualTo(limit);
            release.countDown();

            assertThat(pending.get(10, TimeUnit.SECONDS).data()).hasSize(12);
            assertThat(peak.get()).isEqualTo(limit);
        } finally {
            projectPool.shutdownNow();
            caller.shutdownNow();
        }
    }

    @Test
    @DisplayName("the cause pool runs at most three cause evaluations at once")
    void evaluateMany_capsConcurrentCauses() {
        AsyncConfig config = new AsyncConfig();
        ThreadPoolTaskExecutor causePool = (ThreadPoolTaskExecutor) config.causeExecutor();
        ThreadPoolTaskExecutor projectPool = (ThreadPoolTaskExecutor) config.projectExecutor();
        try {
            orchestrator = new EvaluationOrchestrator(projectFactsService, projectEvaluator, scoreReporter, properties,
                    causePool, projectPool);
            AtomicInteger running = new AtomicInteger();
            AtomicInteger peak = new AtomicInteger();
            CountDownLatch saturated = new CountDownLatch(3);
            when(projectFactsService.getProjectsByIds(anyList())).thenAnswer(inv -> {
                peak.accumulateAndGet(running.incrementAndGet(), Math::max);
                saturated.countDown();
                saturated.await(5, TimeUnit.SECONDS);
                Thread.sleep(100);
                List<String> ids = inv.getArgument(0);
                return ids.stream().map(EvaluationOrchestratorTest::facts).toList();
            });
            doAnswer(inv -> {
                running.decrementAndGet();
                return null;
            }).when(scoreReporter).reportAsync(any(), anyList());
            when(projectEvaluator.evaluate(any(), any(), any()))
                    .thenAnswer(inv -> scored(((ProjectFacts) inv.getArgument(0)).id(), 10, true));
            List<CauseEvaluationRequest> requests = IntStream.rangeClosed(1, 6)
                    .mapToObj(i -> new CauseEvaluationRequest(new CauseFacts(String.valueOf(i), "Cause " + i, null, List.of()),
                            List.of(i + "01", i + "02")))
                    .toList();

            MultiCauseEvaluationResult result = orchestrator.evaluateMany(requests, null);

            assertThat(result.successfulCauses()).isEqualTo(6);
            assertThat(result.totalProjects()).isEqualTo(12);
            assertThat(peak.get()).isEqualTo(3);
        } finally {
            causePool.shutdown();
            projectPool.shutdown();
        }
    }

    private static ProjectFacts facts(String id) {
        return new ProjectFacts(id, "Project " + id, "p" + id, "desc", "active", null, null, null, null, null, null, null);
    }

    private static ScoredProject scored(String id, int score, boolean hasPosts) {
        return new ScoredProject(id, "Project " + id, score, ScoreBreakdown.zero(), hasPosts, hasPosts ? 3 : 0,
                hasPosts ? Instant.now() : null, Instant.now());
    }
}
