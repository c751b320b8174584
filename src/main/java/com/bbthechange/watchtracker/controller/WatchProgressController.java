package com.bbthechange.watchtracker.controller;

import com.bbthechange.watchtracker.dto.progress.InProgressShowsResponse;
import com.bbthechange.watchtracker.dto.tracking.MarkEpisodeWatchedRequest;
import com.bbthechange.watchtracker.dto.tracking.MarkSeasonWatchedRequest;
import com.bbthechange.watchtracker.dto.tracking.ShowTrackingResponse;
import com.bbthechange.watchtracker.dto.tracking.WriteResultResponse;
import com.bbthechange.watchtracker.service.WatchProgressService;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for episode-level watch tracking.
 *
 * Reads work for guests and return empty results; writes need a signed-in user.
 */
@RestController
@RequestMapping("/tracking")
@Validated
public class WatchProgressController extends BaseController {

    private static final Logger logger = LoggerFactory.getLogger(WatchProgressController.class);

    private final WatchProgressService watchProgressService;

    @Autowired
    public WatchProgressController(WatchProgressService watchProgressService) {
        this.watchProgressService = watchProgressService;
    }

    /**
     * In-progress shows, newest first.
     *
     * @param enrich when true, refine every row with catalog metadata before responding
     */
    @GetMapping("/progress")
    public ResponseEntity<InProgressShowsResponse> getInProgressShows(
            @RequestParam(name = "enrich", defaultValue = "false") boolean enrich,
            HttpServletRequest httpRequest) {
        return ResponseEntity.ok(watchProgressService.getInProgressShows(currentUser(httpRequest), enrich));
    }

    @GetMapping("/shows/{showId}")
    public ResponseEntity<ShowTrackingResponse> getShowTracking(
            @PathVariable Integer showId,
            HttpServletRequest httpRequest) {
        return ResponseEntity.ok(watchProgressService.getShowTracking(currentUser(httpRequest), showId));
    }

    @PutMapping("/shows/{showId}/seasons/{season}/episodes/{episode}")
    public ResponseEntity<WriteResultResponse> markEpisodeWatched(
            @PathVariable Integer showId,
            @PathVariable int season,
            @PathVariable int episode,
            @Valid @RequestBody(required = false) MarkEpisodeWatchedRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("User {} marking show {} S{}E{} watched", userId, showId, season, episode);

        WriteResultResponse result = watchProgressService.markEpisodeWatched(
                currentUser(httpRequest), showId, season, episode, request);
        return ResponseEntity.ok(result);
    }

    @DeleteMapping("/shows/{showId}/seasons/{season}/episodes/{episode}")
    public ResponseEntity<Void> markEpisodeUnwatched(
            @PathVariable Integer showId,
            @PathVariable int season,
            @PathVariable int episode,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("User {} un-marking show {} S{}E{}", userId, showId, season, episode);

        watchProgressService.markEpisodeUnwatched(currentUser(httpRequest), showId, season, episode);
        return ResponseEntity.noContent().build();
    }

    /**
     * Mark every aired episode of a season watched.
     */
    @PutMapping("/shows/{showId}/seasons/{season}")
    public ResponseEntity<WriteResultResponse> markSeasonWatched(
            @PathVariable Integer showId,
            @PathVariable int season,
            @Valid @RequestBody(required = false) MarkSeasonWatchedRequest request,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("User {} marking show {} season {} watched", userId, showId, season);

        return ResponseEntity.ok(watchProgressService.markSeasonWatched(currentUser(httpRequest), showId, season, request));
    }

    @DeleteMapping("/shows/{showId}")
    public ResponseEntity<Void> clearShow(
            @PathVariable Integer showId,
            HttpServletRequest httpRequest) {

        String userId = extractUserId(httpRequest);
        logger.info("User {} clearing tracking for show {}", userId, showId);

        watchProgressService.clearShow(currentUser(httpRequest), showId);
        return ResponseEntity.noContent().build();
    }
}
