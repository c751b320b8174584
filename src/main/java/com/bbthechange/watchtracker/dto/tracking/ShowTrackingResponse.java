package com.bbthechange.watchtracker.dto.tracking;

import com.bbthechange.watchtracker.dto.progress.ShowProgress;
import com.bbthechange.watchtracker.model.NextEpisode;
import com.bbthechange.watchtracker.model.WatchedEpisode;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One show's watched episodes in season/episode order, with progress when
 * catalog metadata could be obtained.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ShowTrackingResponse {

    private Integer showId;
    private String tvShowName;
    private String posterPath;
    private Long lastUpdated;

    @Builder.Default
    private List<WatchedEpisode> episodes = new ArrayList<>();

    private ShowProgress progress;
    private boolean progressAvailable;
    private NextEpisode nextEpisode;
}
