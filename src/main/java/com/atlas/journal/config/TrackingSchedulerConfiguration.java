package com.atlas.journal.config;

import java.time.Clock;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import com.atlas.journal.client.DeviceLocationCapability;
import com.atlas.journal.client.LoggingStepAssignmentClient;
import com.atlas.journal.repository.InMemoryJournalSink;

import lombok.extern.slf4j.Slf4j;

/**
 * Threads, clock and default collaborators for the tracking and curation engines.
 *
 * <p>The tracking scheduler has exactly one thread: ticks and periodic syncs never run
 * concurrently with each other. Stop-time flushes run on a separate executor so that the caller
 * can bound the wait and cancel the flush.
 *
 * <p>The collaborators declared here are defaults: the REST-fed device capability, an in-memory
 * journal and a logging step assignment client. A real implementation replaces one by declaring
 * its own bean of the port type as {@code @Primary}.
 */
@Configuration
@Slf4j
public class TrackingSchedulerConfiguration {

    @Bean(name = "trackingTaskScheduler")
    public ThreadPoolTaskScheduler trackingTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("tracking-tick-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();

        log.info("Initialized tracking scheduler with a single tick thread");
        return scheduler;
    }

    @Bean(name = "journalFlushExecutor")
    public ThreadPoolTaskExecutor journalFlushExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(10);
        executor.setThreadNamePrefix("journal-flush-");

        // Graceful shutdown configuration
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("Initialized journal flush executor");
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public DeviceLocationCapability deviceLocationCapability() {
        return new DeviceLocationCapability();
    }

    @Bean
    public InMemoryJournalSink inMemoryJournalSink() {
        return new InMemoryJournalSink();
    }

    @Bean
    public LoggingStepAssignmentClient loggingStepAssignmentClient() {
        return new LoggingStepAssignmentClient();
    }
}
