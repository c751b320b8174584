package com.bbthechange.watchtracker.model;

import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.util.Objects;

/**
 * Denormalized show data cached on a tracking document so the dashboard can
 * render without calling the catalog.
 *
 * The next episode has three states, kept in nextEpisodeStatus:
 * UNKNOWN (never computed), AVAILABLE (nextEpisode is set) and CAUGHT_UP.
 */
@DynamoDbBean
public class EpisodeTrackingMetadata {

    public static final String NEXT_UNKNOWN = "UNKNOWN";
    public static final String NEXT_AVAILABLE = "AVAILABLE";
    public static final String NEXT_CAUGHT_UP = "CAUGHT_UP";

    private String tvShowName;
    private String posterPath;
    private Long lastUpdated;           // epoch millis of the last write to the document
    private Integer totalEpisodes;      // catalog episode count, specials excluded
    private Integer avgRuntime;         // minutes
    private NextEpisode nextEpisode;
    private String nextEpisodeStatus;

    // Default constructor for DynamoDB
    public EpisodeTrackingMetadata() {
        this.nextEpisodeStatus = NEXT_UNKNOWN;
    }

    public EpisodeTrackingMetadata(String tvShowName, String posterPath, Long lastUpdated) {
        this.tvShowName = tvShowName;
        this.posterPath = posterPath;
        this.lastUpdated = lastUpdated;
        this.nextEpisodeStatus = NEXT_UNKNOWN;
    }

    public EpisodeTrackingMetadata copy() {
        EpisodeTrackingMetadata copy = new EpisodeTrackingMetadata(tvShowName, posterPath, lastUpdated);
        copy.totalEpisodes = totalEpisodes;
        copy.avgRuntime = avgRuntime;
        copy.nextEpisode = nextEpisode;
        copy.nextEpisodeStatus = nextEpisodeStatus;
        return copy;
    }

    public String getTvShowName() {
        return tvShowName;
    }

    public void setTvShowName(String tvShowName) {
        this.tvShowName = tvShowName;
    }

    public String getPosterPath() {
        return posterPath;
    }

    public void setPosterPath(String posterPath) {
        this.posterPath = posterPath;
    }

    public Long getLastUpdated() {
        return lastUpdated;
    }

    public void setLastUpdated(Long lastUpdated) {
        this.lastUpdated = lastUpdated;
    }

    public Integer getTotalEpisodes() {
        return totalEpisodes;
    }

    public void setTotalEpisodes(Integer totalEpisodes) {
        this.totalEpisodes = totalEpisodes;
    }

    public Integer getAvgRuntime() {
        return avgRuntime;
    }

    public void setAvgRuntime(Integer avgRuntime) {
        this.avgRuntime = avgRuntime;
    }

    public NextEpisode getNextEpisode() {
        return nextEpisode;
    }

    public void setNextEpisode(NextEpisode nextEpisode) {
        this.nextEpisode = nextEpisode;
    }

    public String getNextEpisodeStatus() {
        return nextEpisodeStatus;
    }

    public void setNextEpisodeStatus(String nextEpisodeStatus) {
        this.nextEpisodeStatus = nextEpisodeStatus;
    }

    /**
     * Record the resolver's answer: a next episode, or caught up when null.
     */
    public void recordNextEpisode(NextEpisode next) {
        this.nextEpisode = next;
        this.nextEpisodeStatus = next != null ? NEXT_AVAILABLE : NEXT_CAUGHT_UP;
    }

    /**
     * Forget the cached next episode, e.g. after an un-watch made it wrong.
     */
    public void clearNextEpisode() {
        this.nextEpisode = null;
        this.nextEpisodeStatus = NEXT_UNKNOWN;
    }

    public boolean hasComputedNextEpisode() {
        return NEXT_AVAILABLE.equals(nextEpisodeStatus) || NEXT_CAUGHT_UP.equals(nextEpisodeStatus);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EpisodeTrackingMetadata)) return false;
        EpisodeTrackingMetadata that = (EpisodeTrackingMetadata) o;
        return Objects.equals(tvShowName, that.tvShowName)
                && Objects.equals(posterPath, that.posterPath)
                && Objects.equals(lastUpdated, that.lastUpdated)
                && Objects.equals(totalEpisodes, that.totalEpisodes)
                && Objects.equals(avgRuntime, that.avgRuntime)
                && Objects.equals(nextEpisode, that.nextEpisode)
                && Objects.equals(nextEpisodeStatus, that.nextEpisodeStatus);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tvShowName, posterPath, lastUpdated, totalEpisodes, avgRuntime, nextEpisode, nextEpisodeStatus);
    }
}
