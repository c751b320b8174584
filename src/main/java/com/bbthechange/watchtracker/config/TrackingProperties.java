package com.bbthechange.watchtracker.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.temporal.ChronoUnit;

/**
 * Tunables for the watch-progress engine: metadata caching, subscription polling,
 * write timeouts and enrichment fan-out.
 */
@Component
@ConfigurationProperties(prefix = "tracking")
public class TrackingProperties {

    /**
     * How long fetched catalog metadata is served before the next read re-fetches it.
     */
    @DurationUnit(ChronoUnit.MINUTES)
    private Duration metadataStaleness = Duration.ofMinutes(30);

    private long metadataMaxEntries = 10_000;

    /**
     * Bound on resolved next episodes, one entry per (user, show).
     */
    private long nextEpisodeMaxEntries = 50_000;

    @DurationUnit(ChronoUnit.MINUTES)
    private Duration nextEpisodeTtl = Duration.ofMinutes(5);

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration pollInterval = Duration.ofSeconds(5);

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration writeTimeout = Duration.ofSeconds(10);

    /**
     * Limit on a single DynamoDB call, retries included. Kept below writeTimeout.
     */
    @DurationUnit(ChronoUnit.SECONDS)
    private Duration storeCallTimeout = Duration.ofSeconds(5);

    @DurationUnit(ChronoUnit.SECONDS)
    private Duration enrichmentTimeout = Duration.ofSeconds(20);

    private int enrichmentConcurrency = 5;

    private int defaultAvgRuntimeMinutes = 45;

    @DurationUnit(ChronoUnit.MINUTES)
    private Duration streamTimeout = Duration.ofMinutes(30);

    public Duration getMetadataStaleness() {
        return metadataStaleness;
    }

    public void setMetadataStaleness(Duration metadataStaleness) {
        this.metadataStaleness = metadataStaleness;
    }

    public long getMetadataMaxEntries() {
        return metadataMaxEntries;
    }

    public void setMetadataMaxEntries(long metadataMaxEntries) {
        this.metadataMaxEntries = metadataMaxEntries;
    }

    public long getNextEpisodeMaxEntries() {
        return nextEpisodeMaxEntries;
    }

    public void setNextEpisodeMaxEntries(long nextEpisodeMaxEntries) {
        this.nextEpisodeMaxEntries = nextEpisodeMaxEntries;
    }

    public Duration getNextEpisodeTtl() {
        return nextEpisodeTtl;
    }

    public void setNextEpisodeTtl(Duration nextEpisodeTtl) {
        this.nextEpisodeTtl = nextEpisodeTtl;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public void setPollInterval(Duration pollInterval) {
        this.pollInterval = pollInterval;
    }

    public Duration getWriteTimeout() {
        return writeTimeout;
    }

    public void setWriteTimeout(Duration writeTimeout) {
        this.writeTimeout = writeTimeout;
    }

    public Duration getStoreCallTimeout() {
        return storeCallTimeout;
    }

    public void setStoreCallTimeout(Duration storeCallTimeout) {
        this.storeCallTimeout = storeCallTimeout;
    }

    public Duration getEnrichmentTimeout() {
        return enrichmentTimeout;
    }

    public void setEnrichmentTimeout(Duration enrichmentTimeout) {
        this.enrichmentTimeout = enrichmentTimeout;
    }

    public int getEnrichmentConcurrency() {
        return enrichmentConcurrency;
    }

    public void setEnrichmentConcurrency(int enrichmentConcurrency) {
        this.enrichmentConcurrency = enrichmentConcurrency;
    }

    public int getDefaultAvgRuntimeMinutes() {
        return defaultAvgRuntimeMinutes;
    }

    public void setDefaultAvgRuntimeMinutes(int defaultAvgRuntimeMinutes) {
        this.defaultAvgRuntimeMinutes = defaultAvgRuntimeMinutes;
    }

    public Duration getStreamTimeout() {
        return streamTimeout;
    }

    public void setStreamTimeout(Duration streamTimeout) {
        this.streamTimeout = streamTimeout;
    }
}
