package com.bbthechange.watchtracker.repository;

import com.bbthechange.watchtracker.model.EpisodeTrackingItem;
import com.bbthechange.watchtracker.model.MetadataPatch;
import com.bbthechange.watchtracker.model.WatchedEpisode;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Repository for per-user, per-show episode tracking documents in the WatchTrackerTable.
 *
 * Episode maps are keyed by the store key "{season}_{episode}". Every write
 * targets individual entries of the map, so concurrent writes to different
 * episodes of the same show do not overwrite each other.
 */
public interface EpisodeTrackingRepository {

    /**
     * Find one show's tracking document.
     *
     * @return the document if present, empty otherwise
     */
    Optional<EpisodeTrackingItem> findByUserAndShow(String userId, Integer showId);

    /**
     * All of a user's tracking documents, in sort-key order.
     */
    List<EpisodeTrackingItem> findAllByUser(String userId);

    /**
     * Add or replace episode entries and apply the metadata patch, creating
     * the document when it does not exist yet. Re-writing an existing key
     * replaces that entry only.
     *
     * @param episodes entries keyed by store key
     * @param patch metadata changes; lastUpdated is stamped with {@code now}
     * @param now epoch millis of the write
     */
    void upsertEpisodes(String userId, Integer showId, Map<String, WatchedEpisode> episodes,
                        MetadataPatch patch, long now);

    /**
     * Remove episode entries and apply the metadata patch.
     * Idempotent: a missing document or missing keys are not an error.
     *
     * @return false when there was no document to update
     */
    boolean removeEpisodes(String userId, Integer showId, Set<String> episodeKeys,
                           MetadataPatch patch, long now);

    /**
     * Delete the whole tracking document for a show. Idempotent.
     */
    void delete(String userId, Integer showId);
}
