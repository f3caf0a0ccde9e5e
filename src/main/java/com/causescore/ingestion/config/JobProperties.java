package com.causescore.ingestion.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Fetch job scheduling, processing and housekeeping. Cron/delay strings live in application.yml.
 */
@ConfigurationProperties(prefix = "causescore.ingestion.jobs")
@NoArgsConstructor
@Getter
@Setter
public class JobProperties {

    /** Window over which one scheduling cycle spreads its jobs. Default 60 min. */
    private int windowMinutes = 60;

    /** Random jitter added per job, 0..this many seconds. Default 30. */
    private int maxJitterSeconds = 30;

    /** Due jobs claimed per processing cycle. Default 50. */
    private int batchSize = 50;

    /** Attempts before a job is FAILED. Default 3. */
    private int maxAttempts = 3;

    /** Retry delay base; delay = base * 2^(attempts-1). Default 1 min. */
    private int retryBaseDelayMinutes = 1;

    /** PROCESSING jobs older than this are reset to PENDING. Default 30 min. */
    private int stuckAfterMinutes = 30;

    /** Terminal jobs older than this are deleted. Default 7 days. */
    private int completedRetentionDays = 7;

    /** Causes requested per catalog page during project sync. Default 50. */
    private int catalogPageSize = 50;

    /** Lock TTL for the full catalog sync. Default 3h. */
    private int catalogSyncLockTtlHours = 3;

    /** Retries of one failed catalog page before the sync gives up. Default 3. */
    private int catalogPageRetries = 3;

    /** Base backoff before a catalog page retry, doubled per retry. Default 5 s. */
    private long catalogRetryBaseDelayMs = 5000;

    /** Random jitter added to each catalog page backoff. Default 1 s. */
    private long catalogRetryJitterMs = 1000;
}
