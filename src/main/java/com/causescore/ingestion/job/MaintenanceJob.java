package com.causescore.ingestion.job;

import com.causescore.domain.ScheduledFetchJob;
import com.causescore.domain.ScheduledFetchJob.JobStatus;
import com.causescore.domain.ScheduledFetchJobRepository;
import com.causescore.ingestion.config.JobProperties;
import com.causescore.ingestion.lock.DistributedLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Set;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Housekeeping: expired locks, jobs stuck in PROCESSING after a crash, and old terminal jobs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MaintenanceJob {

    private static final Set<JobStatus> TERMINAL = Set.of(JobStatus.COMPLETED, JobStatus.FAILED, JobStatus.CANCELLED);

    private final DistributedLockService lockService;
    private final ScheduledFetchJobRepository jobRepository;
    private final MongoTemplate mongoTemplate;
    private final JobProperties properties;

    @Scheduled(fixedDelayString = "${causescore.ingestion.jobs.maintenance-interval-ms:900000}")
    public void runScheduled() {
        try {
            runOnce();
        } catch (RuntimeException e) {
            log.error("Maintenance run failed", e);
        }
    }

    public void runOnce() {
        Instant now = Instant.now();
        long locks = lockService.deleteExpired();
        long reset = resetStuckJobs(now);
        long deleted = jobRepository.deleteByStatusInAndUpdatedAtBefore(TERMINAL,
                now.minus(Duration.ofDays(properties.getCompletedRetentionDays())));
        if (locks + reset + deleted > 0) {
            log.info("Maintenance: {} expired locks removed, {} stuck jobs reset, {} old jobs deleted", locks, reset, deleted);
        }
    }

    /**
     * Stuck jobs go back to PENDING one by one; a job whose project already has a PENDING job of the same type
     * is CANCELLED instead. Returns the number of jobs reset or cancelled.
     */
    long resetStuckJobs(Instant now) {
        Instant stuckBefore = now.minus(Duration.ofMinutes(properties.getStuckAfterMinutes()));
        Query stuck = new Query(where("status").is(JobStatus.PROCESSING).and("updatedAt").lt(stuckBefore));
        long handled = 0;
        for (ScheduledFetchJob job : mongoTemplate.find(stuck, ScheduledFetchJob.class)) {
            Query byId = new Query(where("_id").is(job.getId()).and("status").is(JobStatus.PROCESSING));
            Update reset = new Update()
                    .set("status", JobStatus.PENDING)
                    .set("scheduledFor", now)
                    .set("error", "Reset after being stuck in PROCESSING")
                    .set("updatedAt", now);
            try {
                handled += mongoTemplate.updateFirst(byId, reset, ScheduledFetchJob.class).getModifiedCount();
            } catch (DuplicateKeyException e) {
                Update cancel = new Update()
                        .set("status", JobStatus.CANCELLED)
                        .set("error", "Cancelled after being stuck in PROCESSING; another job is pending")
                        .set("updatedAt", now);
                handled += mongoTemplate.updateFirst(byId, cancel, ScheduledFetchJob.class).getModifiedCount();
            }
        }
        return handled;
    }
}
