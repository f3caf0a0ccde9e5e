package com.causescore.ingestion.job;

import com.causescore.domain.Platform;
import com.causescore.domain.ScheduledFetchJob.JobStatus;
import com.causescore.domain.ScheduledFetchJobRepository;
import com.causescore.domain.StoredPost;
import com.causescore.domain.TrackedAccount;
import com.causescore.domain.TrackedAccountRepository;
import com.causescore.ingestion.store.PostStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Operator actions: fetch one project now, inspect its stored posts, and overall ingestion counters.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AdminIngestionService {

    private final TrackedAccountRepository accountRepository;
    private final ScheduledFetchJobRepository jobRepository;
    private final PlatformFetchTask platformFetchTask;
    private final PostStore postStore;

    /**
     * Runs an immediate fetch on every platform the project has a handle for. Empty when the project is unknown.
     */
    public Optional<ManualFetchResult> fetchNow(String projectId) {
        Optional<TrackedAccount> account = accountRepository.findByProjectId(projectId);
        if (account.isEmpty()) {
            return Optional.empty();
        }
        log.info("Manual fetch requested for project {}", projectId);
        Map<Platform, ManualFetchResult.PlatformResult> results = new EnumMap<>(Platform.class);
        for (Platform platform : Platform.values()) {
            String handle = account.get().getHandle(platform);
            if (handle == null || handle.isBlank()) {
                results.put(platform, ManualFetchResult.PlatformResult.notAttempted());
                continue;
            }
            try {
                FetchOutcome outcome = platformFetchTask.fetch(projectId, platform);
                results.put(platform, ManualFetchResult.PlatformResult.succeeded(outcome.found(), outcome.stored()));
            } catch (RuntimeException e) {
                log.warn("Manual {} fetch for project {} failed: {}", platform, projectId, e.getMessage());
                results.put(platform, ManualFetchResult.PlatformResult.failed(e.getMessage()));
            }
        }
        return Optional.of(new ManualFetchResult(projectId, results));
    }

    /**
     * Stored posts newest first, for one platform or both. Empty when the project is unknown.
     */
    public Optional<List<StoredPost>> recentPosts(String projectId, Platform platform, int limit) {
        return accountRepository.findByProjectId(projectId).map(account -> {
            List<StoredPost> posts = new ArrayList<>();
            for (Platform p : platform == null ? Platform.values() : new Platform[]{platform}) {
                posts.addAll(postStore.recent(account.getId(), p, limit));
            }
            return posts.stream()
                    .sorted(Comparator.comparing(StoredPost::getPostTimestamp).reversed())
                    .limit(limit)
                    .toList();
        });
    }

    public IngestionStats stats() {
        PostStore.PostStats posts = postStore.stats();
        Map<JobStatus, Long> jobs = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            jobs.put(status, jobRepository.countByStatus(status));
        }
        return new IngestionStats(
                accountRepository.count(),
                accountRepository.countByTwitterHandleNotNull(),
                accountRepository.countByFarcasterHandleNotNull(),
                jobs,
                posts);
    }

    public record IngestionStats(long totalProjects,
                                 long projectsWithTwitter,
                                 long projectsWithFarcaster,
                                 Map<JobStatus, Long> jobsByStatus,
                                 PostStore.PostStats posts) {
    }
}
