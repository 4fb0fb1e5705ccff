package com.heronix.attendance.config;

import java.util.concurrent.Executor;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Executors of the analytics pipeline.
 *
 * The pipeline never runs on request threads:
 * - analyticsExecutor receives the post-commit hand-off of submitted sessions,
 * - studentExecutor runs the per-student DAGs of one run in parallel,
 * - stageExecutor performs the (blocking) stage invocations.
 *
 * @author Heronix Development Team
 */
@Configuration
public class AsyncConfig {

    @Bean(name = "analyticsExecutor")
    public Executor analyticsExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("analytics-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "studentExecutor")
    public Executor studentExecutor(AttendanceProperties properties) {
        int threads = Math.max(1, properties.getAnalytics().getParallelStudents());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("analytics-student-");
        executor.initialize();
        return executor;
    }

    @Bean(name = "stageExecutor")
    public Executor stageExecutor(AttendanceProperties properties) {
        int threads = Math.max(1, properties.getAnalytics().getStageThreads());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix("analytics-stage-");
        executor.initialize();
        return executor;
    }
}
