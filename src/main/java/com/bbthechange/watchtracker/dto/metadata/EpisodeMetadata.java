package com.bbthechange.watchtracker.dto.metadata;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EpisodeMetadata {

    private Integer episodeId;
    private Integer seasonNumber;
    private Integer episodeNumber;
    private String name;
    private LocalDate airDate;

    /**
     * Aired on or before the given day. Episodes without an air date have not aired.
     */
    public boolean hasAiredBy(LocalDate today) {
        return airDate != null && !airDate.isAfter(today);
    }
}
