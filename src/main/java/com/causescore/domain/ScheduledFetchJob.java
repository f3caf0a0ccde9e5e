package com.causescore.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Unit of scheduled work: one platform fetch for one project, or a catalog sync.
 * At most one PENDING job per (projectId, jobType), enforced by a partial unique index.
 */
@Document(collection = "scheduled_jobs")
@CompoundIndex(name = "status_scheduled", def = "{'status': 1, 'scheduledFor': 1}")
@CompoundIndex(name = "project_type_status", def = "{'projectId': 1, 'jobType': 1, 'status': 1}")
@CompoundIndex(name = "project_type_pending_unique", def = "{'projectId': 1, 'jobType': 1}", unique = true,
        partialFilter = "{'status': 'PENDING'}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ScheduledFetchJob {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String projectId;
    private JobType jobType;
    private Instant scheduledFor;
    private JobStatus status;
    private int attempts;
    private String error;
    private Instant processedAt;
    private Instant createdAt;
    private Instant updatedAt;
    private Map<String, Object> metadata = new HashMap<>();

    public ScheduledFetchJob(String projectId, JobType jobType, Instant scheduledFor) {
        this.projectId = projectId;
        this.jobType = jobType;
        this.scheduledFor = scheduledFor;
        this.status = JobStatus.PENDING;
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    public enum JobType {
        TWITTER_FETCH(Platform.TWITTER),
        FARCASTER_FETCH(Platform.FARCASTER),
        PROJECT_SYNC(null);

        private final Platform platform;

        JobType(Platform platform) {
            this.platform = platform;
        }

        /** Null for jobs that are not platform fetches. */
        public Platform platform() {
            return platform;
        }

        public static JobType fetchFor(Platform platform) {
            return platform == Platform.TWITTER ? TWITTER_FETCH : FARCASTER_FETCH;
        }
    }

    public enum JobStatus {
        PENDING,
        PROCESSING,
        COMPLETED,
        FAILED,
        CANCELLED
    }
}
