package com.bbthechange.watchtracker.dto.progress;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * In-progress shows, most recently updated first. enriching is true while
 * catalog lookups for some of the rows are still outstanding.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InProgressShowsResponse {

    @Builder.Default
    private List<InProgressShow> shows = new ArrayList<>();

    private boolean enriching;
}
