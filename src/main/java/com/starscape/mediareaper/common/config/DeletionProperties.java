package com.starscape.mediareaper.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Configuration properties for rule evaluation and deletion execution.
 * Binds to app.deletion.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.deletion")
public class DeletionProperties {
    
    private Execution execution = new Execution();
    private Scheduler scheduler = new Scheduler();
    private Rules rules = new Rules();
    
    public Execution getExecution() {
        return execution;
    }
    
    public void setExecution(Execution execution) {
        this.execution = execution;
    }
    
    public Scheduler getScheduler() {
        return scheduler;
    }
    
    public void setScheduler(Scheduler scheduler) {
        this.scheduler = scheduler;
    }
    
    public Rules getRules() {
        return rules;
    }
    
    public void setRules(Rules rules) {
        this.rules = rules;
    }
    
    public static class Execution {
        
        /** Size of the pool that processes items of one execution pass. */
        private int workerThreads = 4;
        
        /** Upper bound for a single integration call. */
        private Duration itemTimeout = Duration.ofMinutes(2);
        
        private boolean retryFailed = true;
        
        private int maxAttempts = 3;
        
        /** A claim older than this is treated as abandoned (process died mid-pass). */
        private Duration leaseTimeout = Duration.ofMinutes(30);
        
        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }
        public Duration getItemTimeout() { return itemTimeout; }
        public void setItemTimeout(Duration itemTimeout) { this.itemTimeout = itemTimeout; }
        public boolean isRetryFailed() { return retryFailed; }
        public void setRetryFailed(boolean retryFailed) { this.retryFailed = retryFailed; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public Duration getLeaseTimeout() { return leaseTimeout; }
        public void setLeaseTimeout(Duration leaseTimeout) { this.leaseTimeout = leaseTimeout; }
    }
    
    public static class Scheduler {
        
        /** Arm the recurring execution timer when the application starts. */
        private boolean enabled = false;
        
        private int intervalMinutes = 60;
        
        private int minIntervalMinutes = 5;
        
        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public int getIntervalMinutes() { return intervalMinutes; }
        public void setIntervalMinutes(int intervalMinutes) { this.intervalMinutes = intervalMinutes; }
        public int getMinIntervalMinutes() { return minIntervalMinutes; }
        public void setMinIntervalMinutes(int minIntervalMinutes) { this.minIntervalMinutes = minIntervalMinutes; }
    }
    
    public static class Rules {
        
        /** Zone used to interpret the time-of-day of rule schedules. */
        private ZoneId timeZone = ZoneId.of("UTC");
        
        private boolean scheduledRunsEnabled = true;
        
        /** How often rule schedules are checked for due runs. */
        private Duration checkInterval = Duration.ofMinutes(1);
        
        public ZoneId getTimeZone() { return timeZone; }
        public void setTimeZone(ZoneId timeZone) { this.timeZone = timeZone; }
        public boolean isScheduledRunsEnabled() { return scheduledRunsEnabled; }
        public void setScheduledRunsEnabled(boolean scheduledRunsEnabled) { this.scheduledRunsEnabled = scheduledRunsEnabled; }
        public Duration getCheckInterval() { return checkInterval; }
        public void setCheckInterval(Duration checkInterval) { this.checkInterval = checkInterval; }
    }
}
