package com.causescore.api.dto;

import com.causescore.domain.ScheduledFetchJob.JobStatus;
import com.causescore.ingestion.job.AdminIngestionService.IngestionStats;

/**
 * GET /api/v1/admin/stats response.
 */
public record StatsResponse(Sync sync, Jobs jobs, SocialMedia socialMedia) {

    public static StatsResponse from(IngestionStats stats) {
        return new StatsResponse(
                new Sync(stats.totalProjects(), stats.projectsWithTwitter(), stats.projectsWithFarcaster()),
                new Jobs(
                        stats.jobsByStatus().getOrDefault(JobStatus.PENDING, 0L),
                        stats.jobsByStatus().getOrDefault(JobStatus.PROCESSING, 0L),
                        stats.jobsByStatus().getOrDefault(JobStatus.COMPLETED, 0L),
                        stats.jobsByStatus().getOrDefault(JobStatus.FAILED, 0L)),
                new SocialMedia(stats.posts().totalPosts(), stats.posts().twitterPosts(), stats.posts().farcasterPosts()));
    }

    public record Sync(long totalProjects, long projectsWithTwitter, long projectsWithFarcaster) {
    }

    public record Jobs(long pending, long processing, long completed, long failed) {
    }

    public record SocialMedia(long totalPosts, long twitterPosts, long farcasterPosts) {
    }
}
