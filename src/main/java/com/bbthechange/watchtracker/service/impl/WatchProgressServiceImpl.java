package com.bbthechange.watchtracker.service.impl;

import com.bbthechange.watchtracker.config.TrackingProperties;
import com.bbthechange.watchtracker.dto.progress.InProgressShow;
import com.bbthechange.watchtracker.dto.progress.InProgressShowsResponse;
import com.bbthechange.watchtracker.dto.tracking.MarkEpisodeWatchedRequest;
import com.bbthechange.watchtracker.dto.tracking.MarkSeasonWatchedRequest;
import com.bbthechange.watchtracker.dto.tracking.ShowTrackingResponse;
import com.bbthechange.watchtracker.dto.tracking.WriteResultResponse;
import com.bbthechange.watchtracker.exception.UnauthorizedException;
import com.bbthechange.watchtracker.exception.ValidationException;
import com.bbthechange.watchtracker.model.EpisodeKey;
import com.bbthechange.watchtracker.model.EpisodeTrackingMetadata;
import com.bbthechange.watchtracker.model.ShowTracking;
import com.bbthechange.watchtracker.service.TrackingStoreClient;
import com.bbthechange.watchtracker.service.WatchProgressEnrichmentService;
import com.bbthechange.watchtracker.service.WatchProgressService;
import com.bbthechange.watchtracker.sync.EnrichmentSession;
import com.bbthechange.watchtracker.sync.OptimisticWrite;
import com.bbthechange.watchtracker.sync.TrackingMutation;
import com.bbthechange.watchtracker.sync.TrackingScope;
import com.bbthechange.watchtracker.sync.TrackingSync;
import com.bbthechange.watchtracker.sync.TrackingSyncFactory;
import com.bbthechange.watchtracker.sync.TrackingView;
import com.bbthechange.watchtracker.sync.UserContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Service
public class WatchProgressServiceImpl implements WatchProgressService {

    private static final Logger logger = LoggerFactory.getLogger(WatchProgressServiceImpl.class);

    private final TrackingStoreClient store;
    private final TrackingSyncFactory syncFactory;
    private final TrackingMutationFactory mutationFactory;
    private final WatchProgressEnrichmentService enrichmentService;
    private final Executor streamExecutor;
    private final Clock clock;
    private final long streamTimeoutMs;

    @Autowired
    public WatchProgressServiceImpl(TrackingStoreClient store,
                                    TrackingSyncFactory syncFactory,
                                    TrackingMutationFactory mutationFactory,
                                    WatchProgressEnrichmentService enrichmentService,
                                    @Qualifier("progressStreamExecutor") Executor streamExecutor,
                                    TrackingProperties properties,
                                    Clock clock) {
        this.store = store;
        this.syncFactory = syncFactory;
        this.mutationFactory = mutationFactory;
        this.enrichmentService = enrichmentService;
        this.streamExecutor = streamExecutor;
        this.clock = clock;
        this.streamTimeoutMs = properties.getStreamTimeout().toMillis();
    }

    @Override
    public InProgressShowsResponse getInProgressShows(UserContext user, boolean enrich) {
        if (user.isGuest()) {
            return InProgressShowsResponse.builder().build();
        }
        Map<Integer, ShowTracking> shows = store.fetchAll(user.getUserId());
        List<InProgressShow> rows = enrich
                ? enrichmentService.enrich(user.getUserId(), shows).join()
                : enrichmentService.buildFromCache(shows);
        logger.debug("Returning {} in-progress shows for user {} (enriched={})", rows.size(), user.getUserId(), enrich);
        return InProgressShowsResponse.builder().shows(rows).enriching(false).build();
    }

    @Override
    public ShowTrackingResponse getShowTracking(UserContext user, Integer showId) {
        validateShowId(showId);
        if (user.isGuest()) {
            return ShowTrackingResponse.builder().showId(showId).build();
        }
        Optional<ShowTracking> found = store.fetchOne(user.getUserId(), showId);
        if (found.isEmpty()) {
            return ShowTrackingResponse.builder().showId(showId).build();
        }

        ShowTracking tracking = found.get();
        EpisodeTrackingMetadata metadata = tracking.getMetadata();
        ShowTrackingResponse.ShowTrackingResponseBuilder response = ShowTrackingResponse.builder()
                .showId(showId)
                .tvShowName(metadata.getTvShowName())
                .posterPath(metadata.getPosterPath())
                .lastUpdated(metadata.getLastUpdated())
                .episodes(new ArrayList<>(tracking.getEpisodes().values()));

        if (enrichmentService.isInProgress(tracking)) {
            InProgressShow enriched = enrichmentService.enrichShow(user.getUserId(), tracking).join();
            boolean available = enriched.getMetadataStatus() != InProgressShow.MetadataStatus.UNAVAILABLE;
            response.progress(enriched.getProgress())
                    .progressAvailable(available)
                    .nextEpisode(enriched.getNextEpisode());
        }
        return response.build();
    }

    @Override
    public WriteResultResponse markEpisodeWatched(UserContext user, Integer showId, int season, int episode,
                                                  MarkEpisodeWatchedRequest request) {
        requireUser(user);
        EpisodeKey key = episodeKey(showId, season, episode);
        ShowTracking current = store.fetchOne(user.getUserId(), showId).orElse(null);
        TrackingMutation mutation = mutationFactory.markWatched(current, showId, key, request);
        return write(user, mutation, current);
    }

    @Override
    public void markEpisodeUnwatched(UserContext user, Integer showId, int season, int episode) {
        requireUser(user);
        EpisodeKey key = episodeKey(showId, season, episode);
        write(user, mutationFactory.markUnwatched(showId, key), null);
    }

    @Override
    public WriteResultResponse markSeasonWatched(UserContext user, Integer showId, int season,
                                                 MarkSeasonWatchedRequest request) {
        requireUser(user);
        validateShowId(showId);
        if (season < 1) {
            throw new ValidationException("Season number must be 1 or greater");
        }
        ShowTracking current = store.fetchOne(user.getUserId(), showId).orElse(null);
        TrackingMutation mutation = mutationFactory.markSeasonWatched(current, showId, season, request);
        return write(user, mutation, current);
    }

    @Override
    public void clearShow(UserContext user, Integer showId) {
        requireUser(user);
        validateShowId(showId);
        write(user, mutationFactory.clearShow(showId), null);
    }

    @Override
    public SseEmitter streamProgress(UserContext user, TrackingScope scope) {
        SseEmitter emitter = new SseEmitter(streamTimeoutMs);
        TrackingSync sync = syncFactory.create(user);
        TrackingView view = sync.watch(scope);
        AtomicLong eventIds = new AtomicLong();

        EnrichmentSession session = EnrichmentSession.bind(user.getUserId(), view, enrichmentService, response -> {
            try {
                emitter.send(SseEmitter.event()
                        .id(Long.toString(eventIds.incrementAndGet()))
                        .name("progress")
                        .data(response, MediaType.APPLICATION_JSON));
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, streamExecutor);

        Runnable teardown = () -> {
            session.close();
            sync.close();
            logger.debug("Progress stream for {} on {} closed", user, scope);
        };
        emitter.onCompletion(teardown);
        emitter.onTimeout(() -> {
            teardown.run();
            emitter.complete();
        });
        emitter.onError(error -> teardown.run());

        logger.info("Opened progress stream for {} on {}", user, scope);
        return emitter;
    }

    /**
     * Run a mutation through a request-scoped sync and wait for the store.
     */
    private WriteResultResponse write(UserContext user, TrackingMutation mutation, ShowTracking current) {
        try (TrackingSync sync = syncFactory.create(user)) {
            OptimisticWrite write = sync.apply(mutation);
            write.await();
        }

        ShowTracking after = mutation.applyTo(current, clock.millis());
        EpisodeTrackingMetadata metadata = after != null ? after.getMetadata() : null;
        return WriteResultResponse.builder()
                .showId(mutation.getShowId())
                .episodeKeys(mutation.getUpserts().keySet().stream()
                        .map(EpisodeKey::toStoreKey)
                        .collect(Collectors.toList()))
                .watchedCount(after != null ? after.regularWatchedCount() : 0)
                .nextEpisode(metadata != null
                        && EpisodeTrackingMetadata.NEXT_AVAILABLE.equals(metadata.getNextEpisodeStatus())
                        ? metadata.getNextEpisode() : null)
                .lastUpdated(metadata != null ? metadata.getLastUpdated() : null)
                .build();
    }

    private static void requireUser(UserContext user) {
        if (user.isGuest()) {
            throw new UnauthorizedException("Sign in to track episodes");
        }
    }

    private static EpisodeKey episodeKey(Integer showId, int season, int episode) {
        validateShowId(showId);
        if (season < 0) {
            throw new ValidationException("Season number must not be negative");
        }
        if (episode < 1) {
            throw new ValidationException("Episode number must be 1 or greater");
        }
        return EpisodeKey.of(season, episode);
    }

    private static void validateShowId(Integer showId) {
        if (showId == null || showId <= 0) {
            throw new ValidationException("Invalid show ID: " + showId);
        }
    }
}
