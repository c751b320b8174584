package com.bbthechange.watchtracker.service.impl;

import com.bbthechange.watchtracker.client.TmdbClient;
import com.bbthechange.watchtracker.config.TrackingProperties;
import com.bbthechange.watchtracker.dto.metadata.CachedMetadata;
import com.bbthechange.watchtracker.dto.metadata.EpisodeMetadata;
import com.bbthechange.watchtracker.dto.metadata.SeasonMetadata;
import com.bbthechange.watchtracker.dto.metadata.ShowMetadata;
import com.bbthechange.watchtracker.dto.tmdb.TmdbEpisodeResponse;
import com.bbthechange.watchtracker.dto.tmdb.TmdbSeasonDetailsResponse;
import com.bbthechange.watchtracker.dto.tmdb.TmdbShowDetailsResponse;
import com.bbthechange.watchtracker.exception.MetadataUnavailableException;
import com.bbthechange.watchtracker.service.MetadataCache;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.cache.CaffeineCacheMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Caffeine-backed {@link MetadataCache}.
 *
 * Entries are not expired by Caffeine: an entry past the staleness window is
 * still the last known good value for stale-while-error. Size is bounded.
 */
@Service
public class MetadataCacheImpl implements MetadataCache {

    private static final Logger logger = LoggerFactory.getLogger(MetadataCacheImpl.class);

    private static final String METRIC_NAME = "metadata_cache_requests_total";

    private final TmdbClient tmdbClient;
    private final Executor fetchExecutor;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final long stalenessMs;
    private final int defaultAvgRuntime;

    private final Cache<String, Entry> entries;
    private final ConcurrentMap<String, CompletableFuture<CachedMetadata<?>>> inFlight = new ConcurrentHashMap<>();

    @Autowired
    public MetadataCacheImpl(TmdbClient tmdbClient,
                             TrackingProperties properties,
                             @Qualifier("metadataFetchExecutor") Executor fetchExecutor,
                             Clock clock,
                             MeterRegistry meterRegistry) {
        this.tmdbClient = tmdbClient;
        this.fetchExecutor = fetchExecutor;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.stalenessMs = properties.getMetadataStaleness().toMillis();
        this.defaultAvgRuntime = properties.getDefaultAvgRuntimeMinutes();
        this.entries = Caffeine.newBuilder()
                .maximumSize(properties.getMetadataMaxEntries())
                .recordStats()
                .build();
        CaffeineCacheMetrics.monitor(meterRegistry, entries, "tracking-metadata");
    }

    @Override
    public CompletableFuture<CachedMetadata<ShowMetadata>> getShowMetadata(Integer showId) {
        return read(showKey(showId), showId, () -> toShowMetadata(showId, tmdbClient.getShowDetails(showId)));
    }

    @Override
    public CompletableFuture<CachedMetadata<List<EpisodeMetadata>>> getSeasonEpisodes(Integer showId, Integer seasonNumber) {
        return read(seasonKey(showId, seasonNumber), showId,
                () -> toEpisodes(tmdbClient.getSeasonDetails(showId, seasonNumber)));
    }

    @Override
    public void invalidateShow(Integer showId) {
        String seasonPrefix = "season:" + showId + ":";
        entries.invalidate(showKey(showId));
        entries.asMap().keySet().removeIf(key -> key.startsWith(seasonPrefix));
        logger.debug("Invalidated cached metadata for show {}", showId);
    }

    @SuppressWarnings("unchecked")
    private <T> CompletableFuture<CachedMetadata<T>> read(String key, Integer showId, Supplier<T> loader) {
        Entry cached = entries.getIfPresent(key);
        if (cached != null && clock.millis() - cached.fetchedAt < stalenessMs) {
            count("hit");
            return CompletableFuture.completedFuture(
                    new CachedMetadata<>((T) cached.value, CachedMetadata.Source.HIT, cached.fetchedAt));
        }

        CompletableFuture<CachedMetadata<?>> fetch = new CompletableFuture<>();
        CompletableFuture<CachedMetadata<?>> existing = inFlight.putIfAbsent(key, fetch);
        if (existing != null) {
            logger.debug("Joining in-flight metadata fetch for {}", key);
            return (CompletableFuture<CachedMetadata<T>>) (CompletableFuture<?>) existing;
        }

        count("miss");
        try {
            fetchExecutor.execute(() -> load(key, showId, loader, fetch));
        } catch (RejectedExecutionException e) {
            logger.error("Metadata fetch for {} rejected by executor", key, e);
            inFlight.remove(key, fetch);
            fetch.completeExceptionally(new MetadataUnavailableException(showId, e));
        }
        return (CompletableFuture<CachedMetadata<T>>) (CompletableFuture<?>) fetch;
    }

    private <T> void load(String key, Integer showId, Supplier<T> loader, CompletableFuture<CachedMetadata<?>> fetch) {
        CachedMetadata<T> result;
        try {
            T value = loader.get();
            long fetchedAt = clock.millis();
            entries.put(key, new Entry(value, fetchedAt));
            result = new CachedMetadata<>(value, CachedMetadata.Source.FETCHED, fetchedAt);
        } catch (RuntimeException e) {
            Entry lastKnown = entries.getIfPresent(key);
            inFlight.remove(key, fetch);
            if (lastKnown != null) {
                logger.warn("Metadata fetch for {} failed, serving value from {}: {}",
                        key, lastKnown.fetchedAt, e.getMessage());
                count("stale");
                @SuppressWarnings("unchecked")
                T stale = (T) lastKnown.value;
                fetch.complete(new CachedMetadata<>(stale, CachedMetadata.Source.STALE, lastKnown.fetchedAt));
            } else {
                logger.warn("Metadata fetch for {} failed with nothing cached: {}", key, e.getMessage());
                count("unavailable");
                fetch.completeExceptionally(new MetadataUnavailableException(showId, e));
            }
            return;
        }
        inFlight.remove(key, fetch);
        fetch.complete(result);
    }

    private ShowMetadata toShowMetadata(Integer showId, TmdbShowDetailsResponse details) {
        List<SeasonMetadata> seasons = new ArrayList<>();
        if (details.getSeasons() != null) {
            for (TmdbShowDetailsResponse.TmdbSeasonSummary summary : details.getSeasons()) {
                if (summary.getSeasonNumber() == null) {
                    continue;
                }
                seasons.add(SeasonMetadata.builder()
                        .seasonNumber(summary.getSeasonNumber())
                        .name(summary.getName())
                        .episodeCount(summary.getEpisodeCount() != null ? summary.getEpisodeCount() : 0)
                        .airDate(parseDate(summary.getAirDate()))
                        .build());
            }
        }

        return ShowMetadata.builder()
                .showId(showId)
                .name(details.getName())
                .posterPath(details.getPosterPath())
                .totalEpisodes(details.getNumberOfEpisodes() != null ? details.getNumberOfEpisodes() : 0)
                .avgRuntime(averageRuntime(details.getEpisodeRunTime()))
                .seasons(seasons)
                .build();
    }

    private List<EpisodeMetadata> toEpisodes(TmdbSeasonDetailsResponse season) {
        if (season.getEpisodes() == null) {
            return Collections.emptyList();
        }
        return season.getEpisodes().stream()
                .filter(episode -> episode.getEpisodeNumber() != null)
                .map(episode -> toEpisode(season, episode))
                .collect(Collectors.toUnmodifiableList());
    }

    private EpisodeMetadata toEpisode(TmdbSeasonDetailsResponse season, TmdbEpisodeResponse episode) {
        Integer seasonNumber = episode.getSeasonNumber() != null ? episode.getSeasonNumber() : season.getSeasonNumber();
        return EpisodeMetadata.builder()
                .episodeId(episode.getId())
                .seasonNumber(seasonNumber)
                .episodeNumber(episode.getEpisodeNumber())
                .name(episode.getName())
                .airDate(parseDate(episode.getAirDate()))
                .build();
    }

    /**
     * Rounded mean of the listed runtimes, or the configured default when TMDB
     * lists none.
     */
    int averageRuntime(List<Integer> runtimes) {
        if (runtimes == null) {
            return defaultAvgRuntime;
        }
        List<Integer> valid = runtimes.stream().filter(Objects::nonNull).filter(r -> r > 0).collect(Collectors.toList());
        if (valid.isEmpty()) {
            return defaultAvgRuntime;
        }
        double mean = valid.stream().mapToInt(Integer::intValue).average().orElse(defaultAvgRuntime);
        return (int) Math.round(mean);
    }

    private static LocalDate parseDate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDate.parse(value);
        } catch (DateTimeParseException e) {
            logger.debug("Ignoring unparseable TMDB air date '{}'", value);
            return null;
        }
    }

    private void count(String result) {
        meterRegistry.counter(METRIC_NAME, "result", result).increment();
    }

    private static String showKey(Integer showId) {
        return "show:" + showId;
    }

    private static String seasonKey(Integer showId, Integer seasonNumber) {
        return "season:" + showId + ":" + seasonNumber;
    }

    private static final class Entry {
        private final Object value;
        private final long fetchedAt;

        private Entry(Object value, long fetchedAt) {
            this.value = value;
            this.fetchedAt = fetchedAt;
        }
    }
}
