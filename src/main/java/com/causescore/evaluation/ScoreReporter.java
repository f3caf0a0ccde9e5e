package com.causescore.evaluation;

import com.causescore.catalog.CatalogClient;
import com.causescore.catalog.ScoreUpdate;
import com.causescore.config.AsyncConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Pushes evaluated scores to the catalog in the background. Failures are logged and never reach the caller.
 */
@Component
@Slf4j
public class ScoreReporter {

    private final CatalogClient catalogClient;
    private final Executor reportExecutor;

    public ScoreReporter(CatalogClient catalogClient, @Qualifier(AsyncConfig.REPORT_EXECUTOR) Executor reportExecutor) {
        this.catalogClient = catalogClient;
        this.reportExecutor = reportExecutor;
    }

    public void reportAsync(String causeId, List<ScoredProject> scores) {
        try {
            reportExecutor.execute(() -> report(causeId, scores));
        } catch (RejectedExecutionException e) {
            log.warn("Score report for cause {} dropped: report queue full", causeId);
        }
    }

    void report(String causeId, List<ScoredProject> scores) {
        List<ScoreUpdate> updates = new ArrayList<>(scores.size());
        for (ScoredProject s : scores) {
            try {
                updates.add(ScoreUpdate.of(causeId, s.projectId(), s.causeScore()));
            } catch (IllegalArgumentException e) {
                log.warn("Skipping score report for project {} in cause {}: {}", s.projectId(), causeId, e.getMessage());
            }
        }
        if (updates.isEmpty()) {
            return;
        }
        try {
            int acknowledged = catalogClient.reportScores(updates);
            log.info("Reported {} scores for cause {} ({} acknowledged)", updates.size(), causeId, acknowledged);
        } catch (RuntimeException e) {
            log.warn("Score report for cause {} failed: {}", causeId, e.getMessage());
        }
    }
}
