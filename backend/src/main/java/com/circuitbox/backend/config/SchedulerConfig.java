package com.circuitbox.backend.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
@RequiredArgsConstructor
public class SchedulerConfig {

    private final CircuitBoxProperties properties;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs auto-reset timers and the scheduled audit flush.
     */
    @Bean(name = "breakerResetScheduler")
    public ThreadPoolTaskScheduler breakerResetScheduler() {
        int processors = Runtime.getRuntime().availableProcessors();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(2, processors / 2));
        scheduler.setThreadNamePrefix("breaker-reset-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    @Bean(name = "probeExecutor")
    public ThreadPoolTaskExecutor probeExecutor() {
        int poolSize = Math.max(1, properties.getProbe().getPoolSize());

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize * 2);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("probe-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }
}
