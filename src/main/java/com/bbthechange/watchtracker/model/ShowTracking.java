package com.bbthechange.watchtracker.model;

import java.util.Collections;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Immutable in-memory view of one show's tracking document.
 *
 * Watched episodes are keyed by {@link EpisodeKey}; store-format keys never
 * appear here. Every "with"/"without" method returns a new instance.
 */
public final class ShowTracking {

    private final Integer showId;
    private final NavigableMap<EpisodeKey, WatchedEpisode> episodes;
    private final EpisodeTrackingMetadata metadata;

    public ShowTracking(Integer showId, Map<EpisodeKey, WatchedEpisode> episodes, EpisodeTrackingMetadata metadata) {
        this.showId = Objects.requireNonNull(showId, "showId");
        this.episodes = Collections.unmodifiableNavigableMap(new TreeMap<>(episodes));
        this.metadata = metadata != null ? metadata.copy() : new EpisodeTrackingMetadata();
    }

    public static ShowTracking empty(Integer showId, EpisodeTrackingMetadata metadata) {
        return new ShowTracking(showId, Collections.emptyMap(), metadata);
    }

    public Integer getShowId() {
        return showId;
    }

    public SortedMap<EpisodeKey, WatchedEpisode> getEpisodes() {
        return episodes;
    }

    /**
     * Returns a copy; callers may mutate it freely.
     */
    public EpisodeTrackingMetadata getMetadata() {
        return metadata.copy();
    }

    public boolean isWatched(EpisodeKey key) {
        return episodes.containsKey(key);
    }

    public Set<EpisodeKey> watchedKeys() {
        return episodes.keySet();
    }

    public int watchedCountInSeason(int seasonNumber) {
        return (int) episodes.keySet().stream().filter(k -> k.getSeason() == seasonNumber).count();
    }

    /**
     * Watched episodes outside season 0.
     */
    public int regularWatchedCount() {
        return (int) episodes.keySet().stream().filter(k -> !k.isSpecial()).count();
    }

    public boolean hasRegularWatched() {
        return episodes.keySet().stream().anyMatch(k -> !k.isSpecial());
    }

    /**
     * Highest non-special season with a watched episode; 1 when there is none.
     */
    public int maxWatchedSeason() {
        return episodes.keySet().stream()
                .filter(k -> !k.isSpecial())
                .mapToInt(EpisodeKey::getSeason)
                .max()
                .orElse(1);
    }

    /**
     * Key of the most recently watched non-special episode, by watchedAt; null
     * when there is none.
     */
    public EpisodeKey lastWatchedKey() {
        EpisodeKey latest = null;
        long latestAt = Long.MIN_VALUE;
        for (Map.Entry<EpisodeKey, WatchedEpisode> entry : episodes.entrySet()) {
            if (entry.getKey().isSpecial()) {
                continue;
            }
            long at = watchedAt(entry.getValue());
            if (latest == null || at > latestAt) {
                latest = entry.getKey();
                latestAt = at;
            }
        }
        return latest;
    }

    public WatchedEpisode lastWatched() {
        EpisodeKey key = lastWatchedKey();
        return key != null ? episodes.get(key) : null;
    }

    public ShowTracking withEpisodes(Map<EpisodeKey, WatchedEpisode> upserts) {
        TreeMap<EpisodeKey, WatchedEpisode> next = new TreeMap<>(episodes);
        next.putAll(upserts);
        return new ShowTracking(showId, next, metadata);
    }

    public ShowTracking withoutEpisode(EpisodeKey key) {
        if (!episodes.containsKey(key)) {
            return this;
        }
        TreeMap<EpisodeKey, WatchedEpisode> next = new TreeMap<>(episodes);
        next.remove(key);
        return new ShowTracking(showId, next, metadata);
    }

    public ShowTracking withMetadata(EpisodeTrackingMetadata newMetadata) {
        return new ShowTracking(showId, episodes, newMetadata);
    }

    /**
     * Stable digest of the watched key set, used to detect whether a cached
     * derivation still matches this document.
     */
    public String fingerprint() {
        return episodes.keySet().stream().map(EpisodeKey::toStoreKey).collect(Collectors.joining(","));
    }

    private static long watchedAt(WatchedEpisode episode) {
        return episode.getWatchedAt() != null ? episode.getWatchedAt() : 0L;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShowTracking)) return false;
        ShowTracking that = (ShowTracking) o;
        return showId.equals(that.showId)
                && episodes.equals(that.episodes)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(showId, episodes, metadata);
    }

    @Override
    public String toString() {
        return "ShowTracking{showId=" + showId + ", watched=" + episodes.size() + '}';
    }
}
