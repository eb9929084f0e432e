package com.starscape.mediareaper.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Enables @Scheduled methods and declares the thread pools used by deletion execution.
 */
@Configuration
@EnableScheduling
public class SchedulingConfig {
    
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
    
    /**
     * Shared by @Scheduled methods and the execution timer.
     */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("deletion-scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }
    
    /**
     * Fixed-size pool for the items of one execution pass.
     */
    @Bean
    public ThreadPoolTaskExecutor deletionWorkerExecutor(DeletionProperties properties) {
        return fixedPool(properties.getExecution().getWorkerThreads(), "deletion-worker-");
    }
    
    /**
     * Runs the integration calls themselves so a worker can stop waiting on a hung call.
     */
    @Bean
    public ThreadPoolTaskExecutor integrationCallExecutor(DeletionProperties properties) {
        return fixedPool(properties.getExecution().getWorkerThreads() * 2, "integration-call-");
    }
    
    private ThreadPoolTaskExecutor fixedPool(int size, String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(size);
        executor.setMaxPoolSize(size);
        executor.setThreadNamePrefix(prefix);
        executor.initialize();
        return executor;
    }
}
