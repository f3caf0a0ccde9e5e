package com.causescore.ingestion.job;

import com.causescore.domain.ScheduledFetchJob;
import com.causescore.domain.ScheduledFetchJob.JobStatus;
import com.causescore.domain.ScheduledFetchJob.JobType;
import com.causescore.domain.ScheduledFetchJobRepository;
import com.causescore.ingestion.config.JobProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.stream.Collectors;

/**
 * Turns a candidate project list into PENDING jobs spread evenly over the scheduling window.
 * Projects that already have a PENDING job of the same type are skipped, so re-running a cycle adds nothing.
 * A job inserted concurrently by another instance loses on the unique pending index and is skipped too.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JobDistributor {

    private final ScheduledFetchJobRepository jobRepository;
    private final JobProperties properties;

    public List<ScheduledFetchJob> scheduleFetchWindow(List<String> candidateProjectIds, JobType jobType) {
        return scheduleFetchWindow(candidateProjectIds, jobType, Instant.now());
    }

    List<ScheduledFetchJob> scheduleFetchWindow(List<String> candidateProjectIds, JobType jobType, Instant windowStart) {
        Set<String> candidates = new LinkedHashSet<>(candidateProjectIds);
        candidates.removeIf(id -> id == null || id.isBlank());
        if (candidates.isEmpty()) {
            return List.of();
        }
        Set<String> alreadyPending = jobRepository
                .findByJobTypeAndStatusAndProjectIdIn(jobType, JobStatus.PENDING, candidates).stream()
                .map(ScheduledFetchJob::getProjectId)
                .collect(Collectors.toSet());
        List<String> toSchedule = candidates.stream().filter(id -> !alreadyPending.contains(id)).toList();
        if (toSchedule.isEmpty()) {
            log.debug("No new {} jobs: all {} candidates already pending", jobType, candidates.size());
            return List.of();
        }

        long windowMs = Duration.ofMinutes(properties.getWindowMinutes()).toMillis();
        long spacingMs = windowMs / toSchedule.size();
        long maxJitterMs = Duration.ofSeconds(properties.getMaxJitterSeconds()).toMillis();
        List<ScheduledFetchJob> jobs = new ArrayList<>(toSchedule.size());
        for (int i = 0; i < toSchedule.size(); i++) {
            long jitter = maxJitterMs == 0 ? 0 : ThreadLocalRandom.current().nextLong(maxJitterMs + 1);
            Instant scheduledFor = windowStart.plusMillis(i * spacingMs + jitter);
            jobs.add(new ScheduledFetchJob(toSchedule.get(i), jobType, scheduledFor));
        }
        List<ScheduledFetchJob> saved = new ArrayList<>(jobs.size());
        int raced = 0;
        for (ScheduledFetchJob job : jobs) {
            try {
                saved.add(jobRepository.insert(job));
            } catch (DuplicateKeyException e) {
                raced++;
                log.debug("{} job for project {} already pending, skipped", jobType, job.getProjectId());
            }
        }
        log.info("Scheduled {} {} jobs over {} min ({} skipped as already pending)",
                saved.size(), jobType, properties.getWindowMinutes(), alreadyPending.size() + raced);
        return saved;
    }
}
