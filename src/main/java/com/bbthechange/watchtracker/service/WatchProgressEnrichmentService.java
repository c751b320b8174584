package com.bbthechange.watchtracker.service;

import com.bbthechange.watchtracker.dto.progress.InProgressShow;
import com.bbthechange.watchtracker.model.ShowTracking;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Turns tracking documents into dashboard rows.
 */
public interface WatchProgressEnrichmentService {

    /**
     * Rows built only from metadata cached on the documents. Shows with no
     * watched episode outside season 0 are left out. Sorted by lastUpdated, newest first.
     */
    List<InProgressShow> buildFromCache(Map<Integer, ShowTracking> shows);

    /**
     * Row for one show built from the document alone.
     */
    InProgressShow buildFromCache(ShowTracking tracking);

    /**
     * Rows refined with catalog metadata. A show whose metadata cannot be
     * obtained degrades to an UNAVAILABLE row; the future itself does not fail.
     */
    CompletableFuture<List<InProgressShow>> enrich(String userId, Map<Integer, ShowTracking> shows);

    CompletableFuture<InProgressShow> enrichShow(String userId, ShowTracking tracking);

    /**
     * Whether the show belongs on the in-progress dashboard.
     */
    boolean isInProgress(ShowTracking tracking);
}
