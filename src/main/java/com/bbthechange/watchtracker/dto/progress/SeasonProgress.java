package com.bbthechange.watchtracker.dto.progress;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Watched/aired/announced counts for one season.
 * 0 <= watchedCount <= totalAiredCount <= totalCount.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SeasonProgress {

    private int seasonNumber;
    private int watchedCount;
    private int totalCount;
    private int totalAiredCount;
    private int percentage;
}
