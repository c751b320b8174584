package com.bbthechange.watchtracker.dto.progress;

import com.bbthechange.watchtracker.model.NextEpisode;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Dashboard row for a show the user has started. Derived on every read.
 *
 * When metadataStatus is UNAVAILABLE only the raw watched count is
 * meaningful; percentage and timeRemainingMinutes are null.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class InProgressShow {

    public enum MetadataStatus {
        /** Built from the metadata stored on the tracking document. */
        CACHED,
        /** Enriched from catalog metadata within the staleness window. */
        FRESH,
        /** Enriched after a failed re-fetch, from last good metadata or season summaries. */
        STALE,
        /** No catalog metadata could be obtained. */
        UNAVAILABLE
    }

    private Integer tvShowId;
    private String tvShowName;
    private String posterPath;
    private Long lastUpdated;
    private int watchedCount;
    private Integer totalEpisodes;
    private Integer avgRuntime;
    private Integer percentage;
    private Integer timeRemainingMinutes;
    private ShowProgress progress;
    private LastWatchedEpisode lastWatchedEpisode;
    private NextEpisode nextEpisode;
    private MetadataStatus metadataStatus;
}
