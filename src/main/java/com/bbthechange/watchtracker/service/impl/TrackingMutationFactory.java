package com.bbthechange.watchtracker.service.impl;

import com.bbthechange.watchtracker.config.TrackingProperties;
import com.bbthechange.watchtracker.dto.metadata.EpisodeMetadata;
import com.bbthechange.watchtracker.dto.metadata.ShowMetadata;
import com.bbthechange.watchtracker.dto.tracking.MarkEpisodeWatchedRequest;
import com.bbthechange.watchtracker.dto.tracking.MarkSeasonWatchedRequest;
import com.bbthechange.watchtracker.exception.MetadataUnavailableException;
import com.bbthechange.watchtracker.exception.ValidationException;
import com.bbthechange.watchtracker.model.EpisodeKey;
import com.bbthechange.watchtracker.model.MetadataPatch;
import com.bbthechange.watchtracker.model.NextEpisode;
import com.bbthechange.watchtracker.model.ShowTracking;
import com.bbthechange.watchtracker.model.WatchedEpisode;
import com.bbthechange.watchtracker.service.MetadataCache;
import com.bbthechange.watchtracker.service.NextEpisodeResolver;
import com.bbthechange.watchtracker.sync.TrackingMutation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Builds {@link TrackingMutation}s for user actions, filling episode details
 * and the cached next episode from the catalog when it can be reached.
 */
@Component
public class TrackingMutationFactory {

    private static final Logger logger = LoggerFactory.getLogger(TrackingMutationFactory.class);

    private final MetadataCache metadataCache;
    private final NextEpisodeResolver nextEpisodeResolver;
    private final Clock clock;
    private final long lookupTimeoutMs;

    @Autowired
    public TrackingMutationFactory(MetadataCache metadataCache,
                                   NextEpisodeResolver nextEpisodeResolver,
                                   TrackingProperties properties,
                                   Clock clock) {
        this.metadataCache = metadataCache;
        this.nextEpisodeResolver = nextEpisodeResolver;
        this.clock = clock;
        this.lookupTimeoutMs = properties.getEnrichmentTimeout().toMillis();
    }

    /**
     * Mark one episode watched, optionally with the aired episodes before it in
     * the same season. Without catalog data the episode is still recorded and
     * the cached next episode is reset.
     */
    public TrackingMutation markWatched(ShowTracking current, Integer showId, EpisodeKey key,
                                        MarkEpisodeWatchedRequest request) {
        MarkEpisodeWatchedRequest body = request != null ? request : new MarkEpisodeWatchedRequest();
        long now = clock.millis();
        Optional<Catalog> catalog = lookup(showId, key.getSeason());

        Map<EpisodeKey, WatchedEpisode> upserts = new TreeMap<>();
        Optional<EpisodeMetadata> known = catalog.flatMap(c -> c.episode(key.getEpisode()));
        upserts.put(key, new WatchedEpisode(
                body.getEpisodeId() != null ? body.getEpisodeId() : known.map(EpisodeMetadata::getEpisodeId).orElse(null),
                showId, key.getSeason(), key.getEpisode(), now,
                body.getEpisodeName() != null ? body.getEpisodeName() : known.map(EpisodeMetadata::getName).orElse(null),
                body.getEpisodeAirDate() != null ? body.getEpisodeAirDate() : known.map(e -> isoDate(e.getAirDate())).orElse(null)));

        if (body.isMarkPreviousEpisodesWatched()) {
            addPrevious(upserts, current, showId, key, catalog, now);
        }

        MetadataPatch.Builder patch = MetadataPatch.builder()
                .tvShowName(body.getTvShowName() != null ? body.getTvShowName() : catalog.map(c -> c.show.getName()).orElse(null))
                .posterPath(body.getPosterPath() != null ? body.getPosterPath() : catalog.map(c -> c.show.getPosterPath()).orElse(null));
        if (catalog.isPresent()) {
            Catalog c = catalog.get();
            patch.totalEpisodes(c.show.getTotalEpisodes())
                    .avgRuntime(c.show.getAvgRuntime())
                    .nextEpisode(nextEpisodeResolver.computeNextEpisode(key, c.seasonEpisodes, c.show.getSeasons()).orElse(null));
        } else {
            patch.resetNextEpisode();
        }

        return TrackingMutation.upsert(showId, upserts, patch.build());
    }

    /**
     * Mark every aired episode of a season watched. Already watched episodes
     * keep their original watch time. Needs the season's episode list.
     *
     * @throws MetadataUnavailableException when the catalog cannot be reached
     * @throws ValidationException when nothing in the season has aired
     */
    public TrackingMutation markSeasonWatched(ShowTracking current, Integer showId, int seasonNumber,
                                              MarkSeasonWatchedRequest request) {
        MarkSeasonWatchedRequest body = request != null ? request : new MarkSeasonWatchedRequest();
        Catalog catalog = lookup(showId, seasonNumber)
                .orElseThrow(() -> new MetadataUnavailableException(showId, null));
        long now = clock.millis();

        List<EpisodeMetadata> aired = catalog.aired(LocalDate.now(clock));
        if (aired.isEmpty()) {
            throw new ValidationException("Season " + seasonNumber + " has no aired episodes");
        }

        Map<EpisodeKey, WatchedEpisode> upserts = new TreeMap<>();
        for (EpisodeMetadata episode : aired) {
            EpisodeKey key = EpisodeKey.of(seasonNumber, episode.getEpisodeNumber());
            if (current == null || !current.isWatched(key)) {
                upserts.put(key, watchedFromCatalog(showId, key, episode, now));
            }
        }

        EpisodeKey last = EpisodeKey.of(seasonNumber, aired.get(aired.size() - 1).getEpisodeNumber());
        Optional<NextEpisode> next = nextEpisodeResolver.computeNextEpisode(last, catalog.seasonEpisodes,
                catalog.show.getSeasons());

        MetadataPatch patch = MetadataPatch.builder()
                .tvShowName(body.getTvShowName() != null ? body.getTvShowName() : catalog.show.getName())
                .posterPath(body.getPosterPath() != null ? body.getPosterPath() : catalog.show.getPosterPath())
                .totalEpisodes(catalog.show.getTotalEpisodes())
                .avgRuntime(catalog.show.getAvgRuntime())
                .nextEpisode(next.orElse(null))
                .build();
        return TrackingMutation.upsert(showId, upserts, patch);
    }

    public TrackingMutation markUnwatched(Integer showId, EpisodeKey key) {
        return TrackingMutation.remove(showId, key);
    }

    public TrackingMutation clearShow(Integer showId) {
        return TrackingMutation.clearShow(showId);
    }

    private void addPrevious(Map<EpisodeKey, WatchedEpisode> upserts, ShowTracking current, Integer showId,
                             EpisodeKey key, Optional<Catalog> catalog, long now) {
        if (catalog.isPresent()) {
            for (EpisodeMetadata episode : catalog.get().aired(LocalDate.now(clock))) {
                if (episode.getEpisodeNumber() >= key.getEpisode()) {
                    break;
                }
                EpisodeKey earlier = EpisodeKey.of(key.getSeason(), episode.getEpisodeNumber());
                if (current == null || !current.isWatched(earlier)) {
                    upserts.putIfAbsent(earlier, watchedFromCatalog(showId, earlier, episode, now));
                }
            }
            return;
        }

        // Catalog unreachable: episode numbers within a season are contiguous from 1
        logger.warn("Marking earlier episodes of show {} season {} without catalog data", showId, key.getSeason());
        for (int number = 1; number < key.getEpisode(); number++) {
            EpisodeKey earlier = EpisodeKey.of(key.getSeason(), number);
            if (current == null || !current.isWatched(earlier)) {
                upserts.putIfAbsent(earlier, new WatchedEpisode(null, showId, earlier.getSeason(), number, now, null, null));
            }
        }
    }

    private static WatchedEpisode watchedFromCatalog(Integer showId, EpisodeKey key, EpisodeMetadata episode, long now) {
        return new WatchedEpisode(episode.getEpisodeId(), showId, key.getSeason(), key.getEpisode(), now,
                episode.getName(), isoDate(episode.getAirDate()));
    }

    /**
     * Show metadata plus one season's episodes, or empty when either lookup fails.
     */
    private Optional<Catalog> lookup(Integer showId, int seasonNumber) {
        try {
            ShowMetadata show = metadataCache.getShowMetadata(showId)
                    .get(lookupTimeoutMs, TimeUnit.MILLISECONDS).getValue();
            List<EpisodeMetadata> episodes = metadataCache.getSeasonEpisodes(showId, seasonNumber)
                    .get(lookupTimeoutMs, TimeUnit.MILLISECONDS).getValue();
            return Optional.of(new Catalog(show, episodes));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while loading catalog data for show {} season {}", showId, seasonNumber);
            return Optional.empty();
        } catch (ExecutionException | TimeoutException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("Catalog data for show {} season {} unavailable: {}", showId, seasonNumber, cause.getMessage());
            return Optional.empty();
        }
    }

    private static String isoDate(LocalDate date) {
        return date != null ? date.toString() : null;
    }

    private static final class Catalog {
        private final ShowMetadata show;
        private final List<EpisodeMetadata> seasonEpisodes;

        private Catalog(ShowMetadata show, List<EpisodeMetadata> seasonEpisodes) {
            this.show = show;
            this.seasonEpisodes = seasonEpisodes;
        }

        Optional<EpisodeMetadata> episode(int episodeNumber) {
            return seasonEpisodes.stream()
                    .filter(e -> e.getEpisodeNumber() != null && e.getEpisodeNumber() == episodeNumber)
                    .findFirst();
        }

        List<EpisodeMetadata> aired(LocalDate today) {
            return seasonEpisodes.stream()
                    .filter(e -> e.getEpisodeNumber() != null && e.hasAiredBy(today))
                    .sorted(Comparator.comparing(EpisodeMetadata::getEpisodeNumber))
                    .collect(Collectors.toList());
        }
    }
}
