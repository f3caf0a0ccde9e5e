package com.causescore.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools: cause-executor runs one cause evaluation per task, project-executor runs
 * per-project scoring, report-executor pushes scores to the catalog off the request path.
 * Per-cause project fan-out is additionally capped by the orchestrator.
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    public static final String CAUSE_EXECUTOR = "cause-executor";
    public static final String PROJECT_EXECUTOR = "project-executor";
    public static final String REPORT_EXECUTOR = "report-executor";

    @Bean(name = CAUSE_EXECUTOR)
    public Executor causeExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(3);
        e.setMaxPoolSize(3);
        e.setThreadNamePrefix("cause-");
        e.initialize();
        return e;
    }

    /** Sized for 3 concurrent causes with 5 projects each. */
    @Bean(name = PROJECT_EXECUTOR)
    public Executor projectExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(15);
        e.setMaxPoolSize(15);
        e.setThreadNamePrefix("project-");
        e.initialize();
        return e;
    }

    @Bean(name = REPORT_EXECUTOR)
    public Executor reportExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(1);
        e.setMaxPoolSize(2);
        e.setQueueCapacity(100);
        e.setThreadNamePrefix("report-");
        e.initialize();
        return e;
    }
}
