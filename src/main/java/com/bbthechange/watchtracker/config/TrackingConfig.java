package com.bbthechange.watchtracker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Threads and time source for the tracking engine.
 *
 * Snapshot delivery runs on a single thread so every subscription sees its
 * snapshots in the order they were read. Catalog lookups get their own bounded pool.
 * Progress streams write to clients on their own threads, never on the delivery thread.
 */
@Configuration
public class TrackingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "trackingSyncScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService trackingSyncScheduler() {
        return Executors.newSingleThreadScheduledExecutor(namedThreads("tracking-sync"));
    }

    @Bean(name = "metadataFetchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService metadataFetchExecutor(TrackingProperties properties) {
        return Executors.newFixedThreadPool(properties.getEnrichmentConcurrency(), namedThreads("metadata-fetch"));
    }

    @Bean(name = "progressStreamExecutor", destroyMethod = "shutdownNow")
    public ExecutorService progressStreamExecutor() {
        return Executors.newCachedThreadPool(namedThreads("progress-stream"));
    }

    @Bean(name = "trackingWriteExecutor", destroyMethod = "shutdownNow")
    public ExecutorService trackingWriteExecutor() {
        return Executors.newCachedThreadPool(namedThreads("tracking-write"));
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
