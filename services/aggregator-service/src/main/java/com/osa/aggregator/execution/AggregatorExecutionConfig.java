package com.osa.aggregator.execution;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class AggregatorExecutionConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService backendTaskExecutor(ConcurrencyProperties properties) {
        return Executors.newFixedThreadPool(Math.max(2, properties.getMaxConcurrent()));
    }

    // Attempts run here so a hung backend call can be abandoned by its caller.
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService backendCallExecutor() {
        return Executors.newCachedThreadPool();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService queueTimerExecutor() {
        return Executors.newSingleThreadScheduledExecutor();
    }

    // @Scheduled jobs would otherwise pick up the queue timer above.
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("aggregator-scheduled-");
        return scheduler;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
