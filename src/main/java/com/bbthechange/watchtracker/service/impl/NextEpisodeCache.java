package com.bbthechange.watchtracker.service.impl;

import com.bbthechange.watchtracker.config.TrackingProperties;
import com.bbthechange.watchtracker.model.NextEpisode;
import com.bbthechange.watchtracker.model.ShowTracking;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Resolved next episodes per (user, show), keyed to the watched-key
 * fingerprint they were computed from.
 *
 * A lookup whose fingerprint no longer matches is a miss. Writes and changed
 * snapshots invalidate the show's entry.
 */
@Component
public class NextEpisodeCache {

    private static final Logger logger = LoggerFactory.getLogger(NextEpisodeCache.class);

    private final Cache<String, Resolved> entries;

    @Autowired
    public NextEpisodeCache(TrackingProperties properties, Clock clock) {
        this.entries = Caffeine.newBuilder()
                .maximumSize(properties.getNextEpisodeMaxEntries())
                .expireAfterWrite(properties.getNextEpisodeTtl())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .build();
    }

    public Optional<Resolved> get(String userId, Integer showId, String fingerprint) {
        Resolved resolved = entries.getIfPresent(key(userId, showId));
        if (resolved == null || !resolved.fingerprint.equals(fingerprint)) {
            return Optional.empty();
        }
        return Optional.of(resolved);
    }

    /**
     * @param next the resolved episode, or null when the user is caught up
     */
    public void put(String userId, Integer showId, String fingerprint, NextEpisode next) {
        entries.put(key(userId, showId), new Resolved(fingerprint, next));
    }

    public void invalidate(String userId, Integer showId) {
        entries.invalidate(key(userId, showId));
    }

    /**
     * Drop the entry when a delivered snapshot no longer matches it.
     */
    public void onSnapshot(String userId, ShowTracking tracking) {
        String key = key(userId, tracking.getShowId());
        Resolved resolved = entries.getIfPresent(key);
        if (resolved != null && !resolved.fingerprint.equals(tracking.fingerprint())) {
            logger.debug("Watched episodes changed for user {} show {}; dropping cached next episode",
                    userId, tracking.getShowId());
            entries.invalidate(key);
        }
    }

    long size() {
        entries.cleanUp();
        return entries.estimatedSize();
    }

    private static String key(String userId, Integer showId) {
        return userId + ":" + showId;
    }

    public static final class Resolved {
        private final String fingerprint;
        private final NextEpisode nextEpisode;

        private Resolved(String fingerprint, NextEpisode nextEpisode) {
            this.fingerprint = fingerprint;
            this.nextEpisode = nextEpisode;
        }

        public Optional<NextEpisode> getNextEpisode() {
            return Optional.ofNullable(nextEpisode);
        }
    }
}
