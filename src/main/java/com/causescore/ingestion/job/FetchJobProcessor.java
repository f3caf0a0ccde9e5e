package com.causescore.ingestion.job;

import com.causescore.domain.ScheduledFetchJob;
import com.causescore.domain.ScheduledFetchJob.JobStatus;
import com.causescore.domain.ScheduledFetchJob.JobType;
import com.causescore.ingestion.config.JobProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.FindAndModifyOptions;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Claims due PENDING jobs one at a time (atomic PENDING -> PROCESSING) and runs them.
 * A failed job goes back to PENDING with exponential delay until it runs out of attempts, then FAILED.
 * If a newer PENDING job for the same project and type exists by then, the retry is CANCELLED instead.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FetchJobProcessor {

    private final MongoTemplate mongoTemplate;
    private final PlatformFetchTask platformFetchTask;
    private final CatalogSyncJob catalogSyncJob;
    private final JobProperties properties;

    @Scheduled(
            fixedDelayString = "${causescore.ingestion.jobs.process-interval-ms:600000}",
            initialDelayString = "${causescore.ingestion.jobs.process-initial-delay-ms:60000}")
    public void runScheduled() {
        processDueJobs();
    }

    /** Returns the number of jobs claimed in this cycle. */
    public int processDueJobs() {
        int claimed = 0;
        int failed = 0;
        while (claimed < properties.getBatchSize()) {
            ScheduledFetchJob job = claimNext(Instant.now());
            if (job == null) {
                break;
            }
            claimed++;
            if (!run(job)) {
                failed++;
            }
        }
        if (claimed > 0) {
            log.info("Job cycle: {} claimed, {} failed", claimed, failed);
        }
        return claimed;
    }

    ScheduledFetchJob claimNext(Instant now) {
        Query due = new Query(where("status").is(JobStatus.PENDING).and("scheduledFor").lte(now))
                .with(Sort.by(Sort.Direction.ASC, "scheduledFor"));
        Update claim = new Update()
                .set("status", JobStatus.PROCESSING)
                .inc("attempts", 1)
                .set("updatedAt", now);
        return mongoTemplate.findAndModify(due, claim, FindAndModifyOptions.options().returnNew(true), ScheduledFetchJob.class);
    }

    private boolean run(ScheduledFetchJob job) {
        try {
            Map<String, Object> result = dispatch(job);
            Instant now = Instant.now();
            Update done = new Update()
                    .set("status", JobStatus.COMPLETED)
                    .set("processedAt", now)
                    .set("updatedAt", now)
                    .unset("error")
                    .set("metadata.result", result);
            mongoTemplate.updateFirst(new Query(where("_id").is(job.getId())), done, ScheduledFetchJob.class);
            return true;
        } catch (RuntimeException e) {
            handleFailure(job, e);
            return false;
        }
    }

    private Map<String, Object> dispatch(ScheduledFetchJob job) {
        if (job.getJobType() == JobType.PROJECT_SYNC) {
            CatalogSyncResult r = catalogSyncJob.sync();
            return Map.of("skipped", r.skipped(), "projectsProcessed", r.projectsProcessed(), "errors", r.errors());
        }
        FetchOutcome outcome = platformFetchTask.fetch(job.getProjectId(), job.getJobType().platform());
        return outcome.toMetadata();
    }

    void handleFailure(ScheduledFetchJob job, RuntimeException e) {
        Instant now = Instant.now();
        Update update = new Update().set("error", e.getMessage()).set("updatedAt", now);
        if (job.getAttempts() >= properties.getMaxAttempts()) {
            update.set("status", JobStatus.FAILED).set("processedAt", now);
            log.error("Job {} ({} for project {}) failed permanently after {} attempts: {}",
                    job.getId(), job.getJobType(), job.getProjectId(), job.getAttempts(), e.getMessage());
        } else {
            Instant retryAt = now.plus(retryDelay(job.getAttempts()));
            update.set("status", JobStatus.PENDING).set("scheduledFor", retryAt);
            log.warn("Job {} ({} for project {}) attempt {} failed, retry at {}: {}",
                    job.getId(), job.getJobType(), job.getProjectId(), job.getAttempts(), retryAt, e.getMessage());
        }
        Query byId = new Query(where("_id").is(job.getId()));
        try {
            mongoTemplate.updateFirst(byId, update, ScheduledFetchJob.class);
        } catch (DuplicateKeyException dup) {
            log.info("Job {} not requeued: {} for project {} is already pending", job.getId(), job.getJobType(), job.getProjectId());
            mongoTemplate.updateFirst(byId, new Update()
                    .set("status", JobStatus.CANCELLED)
                    .set("error", e.getMessage())
                    .set("processedAt", now)
                    .set("updatedAt", now), ScheduledFetchJob.class);
        }
    }

    /** base * 2^(attempts-1). */
    Duration retryDelay(int attempts) {
        int exponent = Math.max(0, Math.min(attempts - 1, 10));
        return Duration.ofMinutes((long) properties.getRetryBaseDelayMinutes() << exponent);
    }
}
