package com.platform.servicehost.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Threads for the two status monitors.
 *
 * {@code taskScheduler} drives the baseline sweep and the coordinator tick;
 * {@code statusQueryExecutor} runs the coordinator's per-id status queries.
 */
@Configuration
public class SchedulingConfig {
    
    public static final String TASK_SCHEDULER = "taskScheduler";
    public static final String STATUS_QUERY_EXECUTOR = "statusQueryExecutor";
    
    @Bean(name = TASK_SCHEDULER)
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("status-sched-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(10);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
    
    @Bean(name = STATUS_QUERY_EXECUTOR)
    public ThreadPoolTaskExecutor statusQueryExecutor(ServiceHostProperties properties) {
        int size = Math.max(1, properties.getPolling().getMaxConcurrentQueries());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setQueueCapacity(256);
        executor.setThreadNamePrefix("status-query-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        return executor;
    }
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
