package com.intelcompliance.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Scheduler and clock for the background jobs.
 *
 * Jobs:
 * - Incident pattern sweep (fixed delay)
 * - Overdue incident escalation (fixed delay)
 * - Key rotation (daily)
 * - Audit retention purge (daily)
 * - Compliance snapshot (hourly)
 *
 * Each job guards against overlapping with itself; the pool only keeps
 * different jobs from queueing behind each other.
 */
@Configuration
@EnableScheduling
@Slf4j
public class SchedulingConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        log.info("Configuring compliance job scheduler");

        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(4);
        scheduler.setThreadNamePrefix("compliance-job-");
        scheduler.setErrorHandler(t -> log.error("Scheduled job failed", t));
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }
}
