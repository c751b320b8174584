package com.bbthechange.watchtracker.service;

import com.bbthechange.watchtracker.dto.metadata.CachedMetadata;
import com.bbthechange.watchtracker.dto.metadata.EpisodeMetadata;
import com.bbthechange.watchtracker.dto.metadata.ShowMetadata;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Read-through cache in front of the TMDB catalog.
 *
 * Values are served for the configured staleness window; the first read after
 * that re-fetches. Concurrent reads of the same key share one fetch. When a
 * re-fetch fails the previous value is served flagged stale; with no previous
 * value the future fails with MetadataUnavailableException.
 */
public interface MetadataCache {

    CompletableFuture<CachedMetadata<ShowMetadata>> getShowMetadata(Integer showId);

    CompletableFuture<CachedMetadata<List<EpisodeMetadata>>> getSeasonEpisodes(Integer showId, Integer seasonNumber);

    /**
     * Drop the show and all of its seasons.
     */
    void invalidateShow(Integer showId);
}
