package com.bbthechange.watchtracker.dto.progress;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Show-level totals over all non-special seasons.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShowProgress {

    private int totalWatched;
    private int totalEpisodes;
    private int totalAiredEpisodes;
    private int percentage;

    @Builder.Default
    private List<SeasonProgress> seasonProgress = new ArrayList<>();
}
