package com.causescore.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Scheduler pool (4 threads) for @Scheduled jobs: FetchJobScheduler, FetchJobProcessor, CatalogSyncJob,
 * MaintenanceJob, WatermarkRepairJob. Disabled with causescore.scheduling.enabled=false (tests).
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "causescore.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerConfig {

    public static final String SCHEDULER_POOL = "scheduler-pool";

    @Bean(name = SCHEDULER_POOL)
    public ThreadPoolTaskScheduler schedulerPool() {
        ThreadPoolTaskScheduler s = new ThreadPoolTaskScheduler();
        s.setPoolSize(4);
        s.setThreadNamePrefix("scheduler-");
        s.initialize();
        return s;
    }
}
