package com.bbthechange.watchtracker.service;

import com.bbthechange.watchtracker.dto.progress.InProgressShowsResponse;
import com.bbthechange.watchtracker.dto.tracking.MarkEpisodeWatchedRequest;
import com.bbthechange.watchtracker.dto.tracking.MarkSeasonWatchedRequest;
import com.bbthechange.watchtracker.dto.tracking.ShowTrackingResponse;
import com.bbthechange.watchtracker.dto.tracking.WriteResultResponse;
import com.bbthechange.watchtracker.sync.TrackingScope;
import com.bbthechange.watchtracker.sync.UserContext;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Watch-progress operations behind the REST and streaming endpoints.
 *
 * Reads accept guests and return empty results. Writes require an
 * authenticated user and block until the store confirms them.
 */
public interface WatchProgressService {

    /**
     * The user's in-progress shows.
     *
     * @param enrich refine rows with catalog metadata before returning
     */
    InProgressShowsResponse getInProgressShows(UserContext user, boolean enrich);

    ShowTrackingResponse getShowTracking(UserContext user, Integer showId);

    WriteResultResponse markEpisodeWatched(UserContext user, Integer showId, int season, int episode,
                                           MarkEpisodeWatchedRequest request);

    /**
     * Idempotent: un-marking an episode that is not watched succeeds.
     */
    void markEpisodeUnwatched(UserContext user, Integer showId, int season, int episode);

    WriteResultResponse markSeasonWatched(UserContext user, Integer showId, int season, MarkSeasonWatchedRequest request);

    void clearShow(UserContext user, Integer showId);

    /**
     * Stream progress for the scope until the emitter completes, errors or
     * times out.
     */
    SseEmitter streamProgress(UserContext user, TrackingScope scope);
}
