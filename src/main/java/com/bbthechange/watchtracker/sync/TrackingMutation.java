package com.bbthechange.watchtracker.sync;

import com.bbthechange.watchtracker.model.EpisodeKey;
import com.bbthechange.watchtracker.model.MetadataPatch;
import com.bbthechange.watchtracker.model.ShowTracking;
import com.bbthechange.watchtracker.model.WatchedEpisode;
import com.bbthechange.watchtracker.service.TrackingStoreClient;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * A change to one show's tracking document. Applied to in-memory state for the
 * optimistic view, then executed against the store.
 *
 * Every variant writes or deletes whole "{season}_{episode}" entries, so
 * executing a mutation twice leaves the same document.
 */
public final class TrackingMutation {

    private final Integer showId;
    private final Map<EpisodeKey, WatchedEpisode> upserts;
    private final Set<EpisodeKey> removals;
    private final MetadataPatch patch;
    private final boolean clearShow;

    private TrackingMutation(Integer showId, Map<EpisodeKey, WatchedEpisode> upserts, Set<EpisodeKey> removals,
                             MetadataPatch patch, boolean clearShow) {
        this.showId = showId;
        this.upserts = Collections.unmodifiableMap(new TreeMap<>(upserts));
        this.removals = Collections.unmodifiableSet(new TreeSet<>(removals));
        this.patch = patch != null ? patch : MetadataPatch.none();
        this.clearShow = clearShow;
    }

    public static TrackingMutation upsert(Integer showId, Map<EpisodeKey, WatchedEpisode> episodes, MetadataPatch patch) {
        return new TrackingMutation(showId, episodes, Set.of(), patch, false);
    }

    /**
     * Un-mark one episode. The cached next episode is reset, matching what the
     * store does on delete.
     */
    public static TrackingMutation remove(Integer showId, EpisodeKey key) {
        return new TrackingMutation(showId, Map.of(), Set.of(key), MetadataPatch.builder().resetNextEpisode().build(), false);
    }

    public static TrackingMutation clearShow(Integer showId) {
        return new TrackingMutation(showId, Map.of(), Set.of(), MetadataPatch.none(), true);
    }

    public Integer getShowId() {
        return showId;
    }

    public Map<EpisodeKey, WatchedEpisode> getUpserts() {
        return upserts;
    }

    public Set<EpisodeKey> getRemovals() {
        return removals;
    }

    public MetadataPatch getPatch() {
        return patch;
    }

    public boolean isClearShow() {
        return clearShow;
    }

    /**
     * The show's state after this mutation, or null when no document remains.
     */
    public ShowTracking applyTo(ShowTracking current, long now) {
        if (clearShow) {
            return null;
        }
        if (current == null && upserts.isEmpty()) {
            // Removing from a document that does not exist creates nothing
            return null;
        }
        ShowTracking base = current != null ? current : ShowTracking.empty(showId, null);
        ShowTracking next = base.withEpisodes(upserts);
        for (EpisodeKey key : removals) {
            next = next.withoutEpisode(key);
        }
        return next.withMetadata(patch.applyTo(base.getMetadata(), now));
    }

    /**
     * Perform the store write. Store failures propagate.
     */
    public void execute(TrackingStoreClient store, String userId) {
        if (clearShow) {
            store.deleteAllForShow(userId, showId);
            return;
        }
        if (!upserts.isEmpty() || removals.isEmpty()) {
            store.upsertEpisodes(userId, showId, upserts, patch);
        }
        for (EpisodeKey key : removals) {
            store.deleteEpisode(userId, showId, key);
        }
    }

    @Override
    public String toString() {
        if (clearShow) {
            return "TrackingMutation{clear show " + showId + '}';
        }
        return "TrackingMutation{show " + showId + ", upserts=" + upserts.keySet() + ", removals=" + removals + '}';
    }
}
