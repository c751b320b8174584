package com.bbthechange.watchtracker.dto.tmdb;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO for TMDB show details.
 * Maps the JSON response from GET /tv/{id}
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TmdbShowDetailsResponse {

    private Integer id;

    private String name;

    @JsonProperty("poster_path")
    private String posterPath;

    /**
     * Catalog episode count across all seasons.
     */
    @JsonProperty("number_of_episodes")
    private Integer numberOfEpisodes;

    /**
     * Typical runtimes in minutes; often a single value, sometimes empty.
     */
    @JsonProperty("episode_run_time")
    private List<Integer> episodeRunTime;

    private List<TmdbSeasonSummary> seasons;

    /**
     * Season entry embedded in the show details.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class TmdbSeasonSummary {

        @JsonProperty("season_number")
        private Integer seasonNumber;

        private String name;

        @JsonProperty("episode_count")
        private Integer episodeCount;

        /**
         * Premiere date in YYYY-MM-DD format, absent for announced seasons.
         */
        @JsonProperty("air_date")
        private String airDate;
    }
}
