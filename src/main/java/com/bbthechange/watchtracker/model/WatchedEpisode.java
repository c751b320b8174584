package com.bbthechange.watchtracker.model;

import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;

import java.util.Objects;

/**
 * One watch event, embedded in the episodes map of an EpisodeTrackingItem.
 *
 * Never updated in place: re-marking replaces the entry (new watchedAt),
 * un-marking removes it.
 */
@DynamoDbBean
public class WatchedEpisode {

    private Integer episodeId;      // TMDB episode ID
    private Integer tvShowId;       // TMDB show ID
    private Integer seasonNumber;
    private Integer episodeNumber;
    private Long watchedAt;         // epoch millis
    private String episodeName;
    private String episodeAirDate;  // yyyy-MM-dd, null when unknown

    // Default constructor for DynamoDB
    public WatchedEpisode() {
    }

    public WatchedEpisode(Integer episodeId, Integer tvShowId, Integer seasonNumber, Integer episodeNumber,
                          Long watchedAt, String episodeName, String episodeAirDate) {
        this.episodeId = episodeId;
        this.tvShowId = tvShowId;
        this.seasonNumber = seasonNumber;
        this.episodeNumber = episodeNumber;
        this.watchedAt = watchedAt;
        this.episodeName = episodeName;
        this.episodeAirDate = episodeAirDate;
    }

    public Integer getEpisodeId() {
        return episodeId;
    }

    public void setEpisodeId(Integer episodeId) {
        this.episodeId = episodeId;
    }

    public Integer getTvShowId() {
        return tvShowId;
    }

    public void setTvShowId(Integer tvShowId) {
        this.tvShowId = tvShowId;
    }

    public Integer getSeasonNumber() {
        return seasonNumber;
    }

    public void setSeasonNumber(Integer seasonNumber) {
        this.seasonNumber = seasonNumber;
    }

    public Integer getEpisodeNumber() {
        return episodeNumber;
    }

    public void setEpisodeNumber(Integer episodeNumber) {
        this.episodeNumber = episodeNumber;
    }

    public Long getWatchedAt() {
        return watchedAt;
    }

    public void setWatchedAt(Long watchedAt) {
        this.watchedAt = watchedAt;
    }

    public String getEpisodeName() {
        return episodeName;
    }

    public void setEpisodeName(String episodeName) {
        this.episodeName = episodeName;
    }

    public String getEpisodeAirDate() {
        return episodeAirDate;
    }

    public void setEpisodeAirDate(String episodeAirDate) {
        this.episodeAirDate = episodeAirDate;
    }

    public EpisodeKey toKey() {
        return EpisodeKey.of(seasonNumber, episodeNumber);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof WatchedEpisode)) return false;
        WatchedEpisode that = (WatchedEpisode) o;
        return Objects.equals(episodeId, that.episodeId)
                && Objects.equals(tvShowId, that.tvShowId)
                && Objects.equals(seasonNumber, that.seasonNumber)
                && Objects.equals(episodeNumber, that.episodeNumber)
                && Objects.equals(watchedAt, that.watchedAt)
                && Objects.equals(episodeName, that.episodeName)
                && Objects.equals(episodeAirDate, that.episodeAirDate);
    }

    @Override
    public int hashCode() {
        return Objects.hash(episodeId, tvShowId, seasonNumber, episodeNumber, watchedAt, episodeName, episodeAirDate);
    }

    @Override
    public String toString() {
        return "WatchedEpisode{" +
                "tvShowId=" + tvShowId +
                ", season=" + seasonNumber +
                ", episode=" + episodeNumber +
                ", watchedAt=" + watchedAt +
                '}';
    }
}
