package com.causescore.ingestion.job;

import com.causescore.catalog.CatalogClient;
import com.causescore.catalog.CatalogException;
import com.causescore.catalog.CauseWithProjects;
import com.causescore.catalog.ProjectFacts;
import com.causescore.catalog.ProjectFactsService;
import com.causescore.common.RetryPolicy;
import com.causescore.ingestion.config.JobProperties;
import com.causescore.ingestion.lock.DistributedLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Mirrors every project of every cause into tracked_accounts. Runs on a schedule, from a PROJECT_SYNC job
 * or on demand; only one instance syncs at a time. A failed page is retried with backoff before the sync aborts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CatalogSyncJob {

    public static final String LOCK_KEY = "project-sync";

    private final CatalogClient catalogClient;
    private final ProjectFactsService projectFactsService;
    private final DistributedLockService lockService;
    private final JobProperties properties;

    @Scheduled(cron = "${causescore.ingestion.jobs.catalog-sync-cron:0 0 */6 * * *}")
    public void runScheduled() {
        try {
            sync();
        } catch (RuntimeException e) {
            log.error("Scheduled catalog sync failed", e);
        }
    }

    public CatalogSyncResult sync() {
        Duration ttl = Duration.ofHours(properties.getCatalogSyncLockTtlHours());
        return lockService.withLock(LOCK_KEY, ttl, this::syncAllCauses)
                .orElseGet(() -> {
                    log.info("Catalog sync already running on another instance, skipping");
                    return CatalogSyncResult.lockHeldElsewhere();
                });
    }

    private CatalogSyncResult syncAllCauses() {
        long started = System.currentTimeMillis();
        int pageSize = properties.getCatalogPageSize();
        Set<String> seenProjects = new HashSet<>();
        int causes = 0;
        int errors = 0;
        int offset = 0;
        log.info("Catalog sync started");
        while (true) {
            List<CauseWithProjects> page = fetchPage(pageSize, offset);
            for (CauseWithProjects cause : page) {
                for (ProjectFacts project : cause.projects()) {
                    if (project.id() == null || !seenProjects.add(project.id())) {
                        continue;
                    }
                    try {
                        projectFactsService.upsertFacts(project);
                    } catch (RuntimeException e) {
                        errors++;
                        log.warn("Failed to sync project {} ({}) from cause {}: {}",
                                project.id(), project.title(), cause.id(), e.getMessage());
                    }
                }
                causes++;
            }
            log.debug("Catalog page at offset {}: {} causes, {} unique projects so far", offset, page.size(), seenProjects.size());
            if (page.size() < pageSize) {
                break;
            }
            offset += pageSize;
        }
        long elapsed = System.currentTimeMillis() - started;
        int synced = seenProjects.size() - errors;
        log.info("Catalog sync done: {} causes, {} projects, {} errors in {} ms", causes, synced, errors, elapsed);
        return new CatalogSyncResult(false, causes, synced, errors, elapsed);
    }

    List<CauseWithProjects> fetchPage(int pageSize, int offset) {
        RetryPolicy retryPolicy = new RetryPolicy(properties.getCatalogRetryBaseDelayMs(),
                properties.getCatalogRetryJitterMs(), properties.getCatalogPageRetries());
        CatalogException lastException = null;
        for (int attempt = 0; attempt < retryPolicy.totalAttempts(); attempt++) {
            if (attempt > 0) {
                long delay = retryPolicy.delayMs(attempt);
                log.info("Retrying catalog page at offset {} in {} ms ({}/{})", offset, delay, attempt, retryPolicy.getMaxRetries());
                try {
                    Thread.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new CatalogException("Interrupted while retrying catalog page at offset " + offset, e);
                }
            }
            try {
                return catalogClient.getCausesWithProjects(pageSize, offset);
            } catch (CatalogException e) {
                lastException = e;
                log.warn("Catalog page at offset {} attempt {} failed: {}", offset, attempt + 1, e.getMessage());
            }
        }
        throw lastException;
    }
}
