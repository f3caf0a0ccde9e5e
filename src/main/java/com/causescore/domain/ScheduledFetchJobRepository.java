package com.causescore.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Persistence for scheduled_jobs. Claiming and stuck-job resets use MongoTemplate for atomic transitions.
 */
public interface ScheduledFetchJobRepository extends MongoRepository<ScheduledFetchJob, String> {

    List<ScheduledFetchJob> findByJobTypeAndStatusAndProjectIdIn(ScheduledFetchJob.JobType jobType,
                                                                 ScheduledFetchJob.JobStatus status,
                                                                 Collection<String> projectIds);

    long countByStatus(ScheduledFetchJob.JobStatus status);

    /** TTL cleanup: remove terminal jobs last touched before cutoff. */
    long deleteByStatusInAndUpdatedAtBefore(Set<ScheduledFetchJob.JobStatus> statuses, Instant cutoff);
}
