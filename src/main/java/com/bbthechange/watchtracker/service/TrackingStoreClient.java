package com.bbthechange.watchtracker.service;

import com.bbthechange.watchtracker.model.EpisodeKey;
import com.bbthechange.watchtracker.model.MetadataPatch;
import com.bbthechange.watchtracker.model.ShowTracking;
import com.bbthechange.watchtracker.model.WatchedEpisode;
import com.bbthechange.watchtracker.sync.Subscription;

import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Access to users' tracking documents: keyed reads, live subscriptions and
 * entry-level writes.
 *
 * Subscriptions deliver full snapshots keyed by show ID. Every delivery
 * replaces the previous one. Writes are synchronous and throw
 * RepositoryException on failure.
 */
public interface TrackingStoreClient {

    Optional<ShowTracking> fetchOne(String userId, Integer showId);

    Map<Integer, ShowTracking> fetchAll(String userId);

    /**
     * Live snapshots of every show the user tracks.
     */
    Subscription subscribeAll(String userId, Consumer<Map<Integer, ShowTracking>> onChange, Consumer<Throwable> onError);

    /**
     * Live snapshots of one show, as a map with at most that show's entry.
     */
    Subscription subscribeOne(String userId, Integer showId,
                              Consumer<Map<Integer, ShowTracking>> onChange, Consumer<Throwable> onError);

    void upsertEpisode(String userId, Integer showId, EpisodeKey key, WatchedEpisode episode, MetadataPatch patch);

    void upsertEpisodes(String userId, Integer showId, Map<EpisodeKey, WatchedEpisode> episodes, MetadataPatch patch);

    /**
     * Un-mark one episode and reset the cached next episode. A missing
     * document or entry is a no-op.
     */
    void deleteEpisode(String userId, Integer showId, EpisodeKey key);

    void deleteAllForShow(String userId, Integer showId);
}
