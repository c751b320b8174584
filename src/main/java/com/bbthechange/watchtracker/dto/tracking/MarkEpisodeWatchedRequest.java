package com.bbthechange.watchtracker.dto.tracking;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body for marking one episode watched. Show name and poster refresh the
 * metadata cached on the tracking document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class MarkEpisodeWatchedRequest {

    @Positive(message = "Episode ID must be positive")
    private Integer episodeId;

    @Size(max = 500, message = "Episode name must be 500 characters or less")
    private String episodeName;

    @Pattern(regexp = "^\\d{4}-\\d{2}-\\d{2}$", message = "Air date must be in YYYY-MM-DD format")
    private String episodeAirDate;

    @Size(max = 500, message = "Show name must be 500 characters or less")
    private String tvShowName;

    @Size(max = 500, message = "Poster path must be 500 characters or less")
    private String posterPath;

    /**
     * Also mark every aired, not yet watched earlier episode of the same season.
     */
    private boolean markPreviousEpisodesWatched;
}
