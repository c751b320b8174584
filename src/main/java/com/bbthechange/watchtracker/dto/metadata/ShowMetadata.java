package com.bbthechange.watchtracker.dto.metadata;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Catalog view of a show, as the engine consumes it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShowMetadata {

    private Integer showId;
    private String name;
    private String posterPath;
    private Integer totalEpisodes;
    private Integer avgRuntime;

    @Builder.Default
    private List<SeasonMetadata> seasons = new ArrayList<>();
}
