package com.bbthechange.watchtracker.dto.tracking;

import com.bbthechange.watchtracker.model.NextEpisode;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a committed tracking write.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class WriteResultResponse {

    private Integer showId;

    /**
     * Store keys ("{season}_{episode}") written by the request.
     */
    @Builder.Default
    private List<String> episodeKeys = new ArrayList<>();

    private int watchedCount;
    private NextEpisode nextEpisode;

    /**
     * Epoch millis stamped on the show's tracking document; absent once cleared.
     */
    private Long lastUpdated;
}
