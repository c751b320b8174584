package com.bbthechange.watchtracker.model;

import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbBean;
import software.amazon.awssdk.enhanced.dynamodb.mapper.annotations.DynamoDbIgnore;

import java.util.Objects;

/**
 * The episode a user should watch next.
 *
 * Stored inside EpisodeTrackingMetadata and returned by the resolver.
 * Confidence is EXACT when copied from a real episode record, APPROXIMATE for
 * the episode-1 placeholder produced on season rollover, whose title is
 * generated and whose air date is the season's premiere date.
 */
@DynamoDbBean
public class NextEpisode {

    public static final String CONFIDENCE_EXACT = "EXACT";
    public static final String CONFIDENCE_APPROXIMATE = "APPROXIMATE";

    private Integer season;
    private Integer episode;
    private String title;
    private String airDate;     // yyyy-MM-dd, null when unknown
    private String confidence;  // "EXACT" or "APPROXIMATE"

    // Default constructor for DynamoDB
    public NextEpisode() {
    }

    private NextEpisode(Integer season, Integer episode, String title, String airDate, String confidence) {
        this.season = season;
        this.episode = episode;
        this.title = title;
        this.airDate = airDate;
        this.confidence = confidence;
    }

    public static NextEpisode exact(int season, int episode, String title, String airDate) {
        return new NextEpisode(season, episode, title, airDate, CONFIDENCE_EXACT);
    }

    public static NextEpisode approximate(int season, int episode, String title, String airDate) {
        return new NextEpisode(season, episode, title, airDate, CONFIDENCE_APPROXIMATE);
    }

    public Integer getSeason() {
        return season;
    }

    public void setSeason(Integer season) {
        this.season = season;
    }

    public Integer getEpisode() {
        return episode;
    }

    public void setEpisode(Integer episode) {
        this.episode = episode;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getAirDate() {
        return airDate;
    }

    public void setAirDate(String airDate) {
        this.airDate = airDate;
    }

    public String getConfidence() {
        return confidence;
    }

    public void setConfidence(String confidence) {
        this.confidence = confidence;
    }

    @DynamoDbIgnore
    public boolean isApproximate() {
        return CONFIDENCE_APPROXIMATE.equals(confidence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NextEpisode)) return false;
        NextEpisode that = (NextEpisode) o;
        return Objects.equals(season, that.season)
                && Objects.equals(episode, that.episode)
                && Objects.equals(title, that.title)
                && Objects.equals(airDate, that.airDate)
                && Objects.equals(confidence, that.confidence);
    }

    @Override
    public int hashCode() {
        return Objects.hash(season, episode, title, airDate, confidence);
    }

    @Override
    public String toString() {
        return "NextEpisode{S" + season + "E" + episode + ", '" + title + "', " + confidence + '}';
    }
}
