package com.bbthechange.watchtracker.util;

import com.bbthechange.watchtracker.model.EpisodeKey;
import com.bbthechange.watchtracker.model.EpisodeTrackingItem;
import com.bbthechange.watchtracker.model.ShowTracking;
import com.bbthechange.watchtracker.model.WatchedEpisode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Converts between the persisted tracking document and the in-memory
 * {@link ShowTracking}. This is the only place "{season}_{episode}" strings
 * are turned into {@link EpisodeKey}s and back.
 */
@Component
public class TrackingDocumentMapper {

    private static final Logger logger = LoggerFactory.getLogger(TrackingDocumentMapper.class);

    /**
     * Map a stored document to its domain form. Documents failing the shape
     * check come back empty and are treated as absent.
     */
    public Optional<ShowTracking> toDomain(EpisodeTrackingItem item) {
        if (item == null) {
            return Optional.empty();
        }
        Optional<Integer> showId = TrackingKeyFactory.parseShowId(item.getSk());
        if (showId.isEmpty()) {
            logger.warn("Skipping tracking document with unparseable sort key: pk={}, sk={}", item.getPk(), item.getSk());
            return Optional.empty();
        }
        if (item.getShowId() != null && !item.getShowId().equals(showId.get())) {
            logger.warn("Skipping tracking document whose showId {} disagrees with sort key {}", item.getShowId(), item.getSk());
            return Optional.empty();
        }
        if (item.getMetadata() == null || item.getEpisodes() == null) {
            logger.warn("Skipping malformed tracking document for show {}: metadata={}, episodes={}",
                    showId.get(), item.getMetadata() != null, item.getEpisodes() != null);
            return Optional.empty();
        }

        Map<EpisodeKey, WatchedEpisode> episodes = new TreeMap<>();
        for (Map.Entry<String, WatchedEpisode> entry : item.getEpisodes().entrySet()) {
            Optional<EpisodeKey> key = EpisodeKey.parse(entry.getKey());
            if (key.isEmpty() || entry.getValue() == null) {
                logger.warn("Dropping episode entry with bad key '{}' in show {}", entry.getKey(), showId.get());
                continue;
            }
            episodes.put(key.get(), entry.getValue());
        }
        return Optional.of(new ShowTracking(showId.get(), episodes, item.getMetadata()));
    }

    EpisodeTrackingItem toItem(String userId, ShowTracking tracking) {
        EpisodeTrackingItem item = new EpisodeTrackingItem(userId, tracking.getShowId(), tracking.getMetadata());
        item.setEpisodes(toStoreEpisodes(tracking.getEpisodes()));
        return item;
    }

    public Map<String, WatchedEpisode> toStoreEpisodes(Map<EpisodeKey, WatchedEpisode> episodes) {
        Map<String, WatchedEpisode> stored = new HashMap<>();
        episodes.forEach((key, episode) -> stored.put(key.toStoreKey(), episode));
        return stored;
    }
}
