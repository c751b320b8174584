package com.bbthechange.watchtracker.dto.metadata;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.List;

/**
 * One season of a show. Episodes are null until the season's episode list has
 * been loaded; season summaries from the show details carry only the count.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SeasonMetadata {

    private Integer seasonNumber;
    private String name;
    private Integer episodeCount;
    private LocalDate airDate;
    private List<EpisodeMetadata> episodes;

    public boolean isSpecials() {
        return seasonNumber == null || seasonNumber <= 0;
    }

    public boolean hasEpisodes() {
        return episodes != null;
    }
}
