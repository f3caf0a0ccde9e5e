package com.causescore.ingestion.job;

import com.causescore.domain.Platform;
import com.causescore.domain.ScheduledFetchJob.JobType;
import com.causescore.domain.TrackedAccount;
import com.causescore.domain.TrackedAccountRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Hourly: one fetch job per platform for every account that has a handle on that platform.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FetchJobScheduler {

    private final TrackedAccountRepository accountRepository;
    private final JobDistributor jobDistributor;

    @Scheduled(cron = "${causescore.ingestion.jobs.schedule-cron:0 0 * * * *}")
    public void runScheduled() {
        scheduleAll();
    }

    /** Returns the number of jobs created. */
    public int scheduleAll() {
        int created = 0;
        for (Platform platform : Platform.values()) {
            try {
                created += jobDistributor.scheduleFetchWindow(projectsWithHandle(platform), JobType.fetchFor(platform)).size();
            } catch (RuntimeException e) {
                log.error("Scheduling {} fetch jobs failed", platform, e);
            }
        }
        return created;
    }

    private List<String> projectsWithHandle(Platform platform) {
        List<TrackedAccount> accounts = switch (platform) {
            case TWITTER -> accountRepository.findByTwitterHandleNotNull();
            case FARCASTER -> accountRepository.findByFarcasterHandleNotNull();
        };
        return accounts.stream()
                .filter(a -> a.getHandle(platform) != null && !a.getHandle(platform).isBlank())
                .map(TrackedAccount::getProjectId)
                .toList();
    }
}
