package com.bbthechange.watchtracker.dto.tmdb;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Episode entry inside a TMDB season details response.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class TmdbEpisodeResponse {

    /**
     * TMDB episode ID.
     */
    private Integer id;

    @JsonProperty("season_number")
    private Integer seasonNumber;

    @JsonProperty("episode_number")
    private Integer episodeNumber;

    private String name;

    /**
     * Air date in YYYY-MM-DD format; null or empty when not yet scheduled.
     */
    @JsonProperty("air_date")
    private String airDate;

    private Integer runtime;
}
