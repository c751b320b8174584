package com.bbthechange.watchtracker.service.impl;

import com.bbthechange.watchtracker.config.TrackingProperties;
import com.bbthechange.watchtracker.dto.metadata.CachedMetadata;
import com.bbthechange.watchtracker.dto.metadata.EpisodeMetadata;
import com.bbthechange.watchtracker.dto.metadata.SeasonMetadata;
import com.bbthechange.watchtracker.dto.metadata.ShowMetadata;
import com.bbthechange.watchtracker.dto.progress.InProgressShow;
import com.bbthechange.watchtracker.dto.progress.LastWatchedEpisode;
import com.bbthechange.watchtracker.dto.progress.ShowProgress;
import com.bbthechange.watchtracker.model.EpisodeKey;
import com.bbthechange.watchtracker.model.EpisodeTrackingMetadata;
import com.bbthechange.watchtracker.model.NextEpisode;
import com.bbthechange.watchtracker.model.ShowTracking;
import com.bbthechange.watchtracker.model.WatchedEpisode;
import com.bbthechange.watchtracker.service.MetadataCache;
import com.bbthechange.watchtracker.service.NextEpisodeResolver;
import com.bbthechange.watchtracker.service.ProgressAggregator;
import com.bbthechange.watchtracker.service.WatchProgressEnrichmentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Builds in-progress rows from tracking documents, refining them with catalog
 * metadata on demand.
 *
 * Enrichment loads the show summary plus the episode lists of at most two
 * seasons: the highest watched one and the one after it, or the last two
 * aired seasons when neither exists.
 */
@Service
public class WatchProgressEnrichmentServiceImpl implements WatchProgressEnrichmentService {

    private static final Logger logger = LoggerFactory.getLogger(WatchProgressEnrichmentServiceImpl.class);

    static final Comparator<InProgressShow> MOST_RECENT_FIRST = Comparator.comparing(
            InProgressShow::getLastUpdated, Comparator.nullsLast(Comparator.reverseOrder()));

    private final MetadataCache metadataCache;
    private final ProgressAggregator progressAggregator;
    private final NextEpisodeResolver nextEpisodeResolver;
    private final NextEpisodeCache nextEpisodeCache;
    private final Clock clock;
    private final int defaultAvgRuntime;
    private final long enrichmentTimeoutMs;

    @Autowired
    public WatchProgressEnrichmentServiceImpl(MetadataCache metadataCache,
                                              ProgressAggregator progressAggregator,
                                              NextEpisodeResolver nextEpisodeResolver,
                                              NextEpisodeCache nextEpisodeCache,
                                              TrackingProperties properties,
                                              Clock clock) {
        this.metadataCache = metadataCache;
        this.progressAggregator = progressAggregator;
        this.nextEpisodeResolver = nextEpisodeResolver;
        this.nextEpisodeCache = nextEpisodeCache;
        this.clock = clock;
        this.defaultAvgRuntime = properties.getDefaultAvgRuntimeMinutes();
        this.enrichmentTimeoutMs = properties.getEnrichmentTimeout().toMillis();
    }

    @Override
    public List<InProgressShow> buildFromCache(Map<Integer, ShowTracking> shows) {
        return shows.values().stream()
                .filter(this::isInProgress)
                .map(this::buildFromCache)
                .sorted(MOST_RECENT_FIRST)
                .collect(Collectors.toList());
    }

    @Override
    public InProgressShow buildFromCache(ShowTracking tracking) {
        EpisodeTrackingMetadata metadata = tracking.getMetadata();
        int watched = tracking.regularWatchedCount();
        Integer total = metadata.getTotalEpisodes();
        int avgRuntime = metadata.getAvgRuntime() != null ? metadata.getAvgRuntime() : defaultAvgRuntime;

        Integer percentage = null;
        Integer timeRemaining = null;
        if (total != null && total > 0) {
            percentage = ProgressAggregator.percentage(Math.min(watched, total), total);
            timeRemaining = Math.max(0, total - watched) * avgRuntime;
        }

        NextEpisode next = EpisodeTrackingMetadata.NEXT_AVAILABLE.equals(metadata.getNextEpisodeStatus())
                ? metadata.getNextEpisode()
                : null;

        return InProgressShow.builder()
                .tvShowId(tracking.getShowId())
                .tvShowName(metadata.getTvShowName())
                .posterPath(metadata.getPosterPath())
                .lastUpdated(lastUpdated(tracking))
                .watchedCount(watched)
                .totalEpisodes(total)
                .avgRuntime(avgRuntime)
                .percentage(percentage)
                .timeRemainingMinutes(timeRemaining)
                .lastWatchedEpisode(lastWatched(tracking))
                .nextEpisode(next)
                .metadataStatus(InProgressShow.MetadataStatus.CACHED)
                .build();
    }

    @Override
    public CompletableFuture<List<InProgressShow>> enrich(String userId, Map<Integer, ShowTracking> shows) {
        List<CompletableFuture<InProgressShow>> rows = shows.values().stream()
                .filter(this::isInProgress)
                .map(tracking -> enrichShow(userId, tracking))
                .collect(Collectors.toList());

        return CompletableFuture.allOf(rows.toArray(new CompletableFuture[0]))
                .thenApply(done -> rows.stream()
                        .map(CompletableFuture::join)
                        .sorted(MOST_RECENT_FIRST)
                        .collect(Collectors.toList()));
    }

    @Override
    public CompletableFuture<InProgressShow> enrichShow(String userId, ShowTracking tracking) {
        Integer showId = tracking.getShowId();
        return metadataCache.getShowMetadata(showId)
                .thenCompose(show -> loadSeasons(tracking, show.getValue())
                        .thenApply(seasons -> buildEnriched(userId, tracking, show, seasons)))
                .orTimeout(enrichmentTimeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(error -> {
                    logger.warn("Enrichment for show {} unavailable, showing raw counts: {}", showId, rootMessage(error));
                    return unavailable(tracking);
                });
    }

    @Override
    public boolean isInProgress(ShowTracking tracking) {
        return tracking.hasRegularWatched();
    }

    /**
     * Show seasons with episode lists filled in for the seasons worth loading.
     * A season whose episodes cannot be fetched stays as a summary and marks
     * the load incomplete.
     */
    private CompletableFuture<LoadedSeasons> loadSeasons(ShowTracking tracking, ShowMetadata show) {
        List<Integer> toLoad = seasonsToLoad(tracking, show.getSeasons());
        Map<Integer, CompletableFuture<CachedMetadata<List<EpisodeMetadata>>>> fetches = new LinkedHashMap<>();
        for (Integer seasonNumber : toLoad) {
            fetches.put(seasonNumber, metadataCache.getSeasonEpisodes(show.getShowId(), seasonNumber)
                    .exceptionally(error -> {
                        logger.debug("Season {} of show {} not loaded: {}", seasonNumber, show.getShowId(), rootMessage(error));
                        return null;
                    }));
        }

        return CompletableFuture.allOf(fetches.values().toArray(new CompletableFuture[0]))
                .thenApply(done -> {
                    boolean stale = false;
                    boolean incomplete = false;
                    List<SeasonMetadata> seasons = new ArrayList<>();
                    for (SeasonMetadata season : show.getSeasons()) {
                        CompletableFuture<CachedMetadata<List<EpisodeMetadata>>> fetch = fetches.get(season.getSeasonNumber());
                        CachedMetadata<List<EpisodeMetadata>> episodes = fetch != null ? fetch.join() : null;
                        if (episodes != null) {
                            stale |= episodes.isStale();
                            seasons.add(season.toBuilder().episodes(episodes.getValue()).build());
                        } else {
                            incomplete |= fetch != null;
                            seasons.add(season);
                        }
                    }
                    return new LoadedSeasons(seasons, stale, incomplete);
                });
    }

    /**
     * Highest watched regular season and the next one; the last two aired
     * seasons when neither is in the catalog.
     */
    List<Integer> seasonsToLoad(ShowTracking tracking, List<SeasonMetadata> seasons) {
        List<Integer> regular = seasons.stream()
                .filter(season -> !season.isSpecials())
                .map(SeasonMetadata::getSeasonNumber)
                .sorted()
                .collect(Collectors.toList());

        int maxWatched = tracking.maxWatchedSeason();
        List<Integer> chosen = new ArrayList<>();
        if (regular.contains(maxWatched)) {
            chosen.add(maxWatched);
        }
        if (regular.contains(maxWatched + 1)) {
            chosen.add(maxWatched + 1);
        }
        if (!chosen.isEmpty()) {
            return chosen;
        }

        LocalDate today = LocalDate.now(clock);
        return seasons.stream()
                .filter(season -> !season.isSpecials())
                .filter(season -> season.getAirDate() != null && !season.getAirDate().isAfter(today))
                .map(SeasonMetadata::getSeasonNumber)
                .sorted(Comparator.reverseOrder())
                .limit(2)
                .sorted()
                .collect(Collectors.toList());
    }

    private InProgressShow buildEnriched(String userId, ShowTracking tracking, CachedMetadata<ShowMetadata> cachedShow,
                                         LoadedSeasons loaded) {
        ShowMetadata show = cachedShow.getValue();
        ShowProgress progress = progressAggregator.computeShowProgress(tracking, loaded.seasons);
        int watched = tracking.regularWatchedCount();
        int avgRuntime = show.getAvgRuntime() != null ? show.getAvgRuntime() : defaultAvgRuntime;
        int total = show.getTotalEpisodes() != null ? show.getTotalEpisodes() : progress.getTotalEpisodes();
        boolean stale = cachedShow.isStale() || loaded.stale || loaded.incomplete;
        if (cachedShow.isStale()) {
            logger.debug("Show {} enriched from metadata fetched at {}", show.getShowId(), cachedShow.getFetchedAtMillis());
        }
        Optional<NextEpisode> next = loaded.incomplete
                ? lastKnownNext(userId, tracking)
                : resolveNext(userId, tracking, loaded.seasons);

        EpisodeTrackingMetadata cached = tracking.getMetadata();
        return InProgressShow.builder()
                .tvShowId(tracking.getShowId())
                .tvShowName(cached.getTvShowName() != null ? cached.getTvShowName() : show.getName())
                .posterPath(cached.getPosterPath() != null ? cached.getPosterPath() : show.getPosterPath())
                .lastUpdated(lastUpdated(tracking))
                .watchedCount(watched)
                .totalEpisodes(total)
                .avgRuntime(avgRuntime)
                .percentage(progress.getPercentage())
                .timeRemainingMinutes(Math.max(0, total - watched) * avgRuntime)
                .progress(progress)
                .lastWatchedEpisode(lastWatched(tracking))
                .nextEpisode(next.orElse(null))
                .metadataStatus(stale ? InProgressShow.MetadataStatus.STALE : InProgressShow.MetadataStatus.FRESH)
                .build();
    }

    /**
     * First unwatched aired episode in the loaded seasons. When those are all
     * watched, roll over from the latest watched episode.
     */
    Optional<NextEpisode> resolveNext(String userId, ShowTracking tracking, List<SeasonMetadata> seasons) {
        String fingerprint = tracking.fingerprint();
        Optional<NextEpisodeCache.Resolved> cached = nextEpisodeCache.get(userId, tracking.getShowId(), fingerprint);
        if (cached.isPresent()) {
            return cached.get().getNextEpisode();
        }

        Optional<NextEpisode> next = nextEpisodeResolver.findFirstUnwatched(tracking, seasons);
        if (next.isEmpty()) {
            int maxSeason = tracking.maxWatchedSeason();
            Optional<SeasonMetadata> current = seasons.stream()
                    .filter(season -> season.getSeasonNumber() == maxSeason && season.hasEpisodes())
                    .findFirst();
            Optional<EpisodeKey> latest = tracking.watchedKeys().stream()
                    .filter(key -> key.getSeason() == maxSeason)
                    .max(Comparator.naturalOrder());
            if (current.isPresent() && latest.isPresent()) {
                next = nextEpisodeResolver.computeNextEpisode(latest.get(), current.get().getEpisodes(), seasons);
            }
        }

        nextEpisodeCache.put(userId, tracking.getShowId(), fingerprint, next.orElse(null));
        return next;
    }

    /**
     * Next episode without a complete season load: a still-valid resolved
     * entry, else the value stored on the document. Nothing is cached.
     */
    Optional<NextEpisode> lastKnownNext(String userId, ShowTracking tracking) {
        Optional<NextEpisodeCache.Resolved> cached = nextEpisodeCache.get(userId, tracking.getShowId(), tracking.fingerprint());
        if (cached.isPresent()) {
            return cached.get().getNextEpisode();
        }
        EpisodeTrackingMetadata metadata = tracking.getMetadata();
        return EpisodeTrackingMetadata.NEXT_AVAILABLE.equals(metadata.getNextEpisodeStatus())
                ? Optional.ofNullable(metadata.getNextEpisode())
                : Optional.empty();
    }

    private InProgressShow unavailable(ShowTracking tracking) {
        return buildFromCache(tracking).toBuilder()
                .percentage(null)
                .timeRemainingMinutes(null)
                .metadataStatus(InProgressShow.MetadataStatus.UNAVAILABLE)
                .build();
    }

    private static Long lastUpdated(ShowTracking tracking) {
        Long stamped = tracking.getMetadata().getLastUpdated();
        if (stamped != null) {
            return stamped;
        }
        WatchedEpisode last = tracking.lastWatched();
        return last != null ? last.getWatchedAt() : null;
    }

    private static LastWatchedEpisode lastWatched(ShowTracking tracking) {
        EpisodeKey key = tracking.lastWatchedKey();
        return key != null ? LastWatchedEpisode.from(key, tracking.getEpisodes().get(key)) : null;
    }

    private static String rootMessage(Throwable error) {
        Throwable root = error;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getClass().getSimpleName() + ": " + root.getMessage();
    }

    private static final class LoadedSeasons {
        private final List<SeasonMetadata> seasons;
        private final boolean stale;
        private final boolean incomplete;

        private LoadedSeasons(List<SeasonMetadata> seasons, boolean stale, boolean incomplete) {
            this.seasons = seasons;
            this.stale = stale;
            this.incomplete = incomplete;
        }
    }
}
