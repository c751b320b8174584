package com.bbthechange.watchtracker.service.impl;

import com.bbthechange.watchtracker.config.TrackingProperties;
import com.bbthechange.watchtracker.model.EpisodeKey;
import com.bbthechange.watchtracker.model.EpisodeTrackingItem;
import com.bbthechange.watchtracker.model.MetadataPatch;
import com.bbthechange.watchtracker.model.ShowTracking;
import com.bbthechange.watchtracker.model.WatchedEpisode;
import com.bbthechange.watchtracker.repository.EpisodeTrackingRepository;
import com.bbthechange.watchtracker.service.TrackingStoreClient;
import com.bbthechange.watchtracker.sync.Subscription;
import com.bbthechange.watchtracker.util.TrackingDocumentMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * {@link TrackingStoreClient} over DynamoDB. Subscriptions poll the table on
 * the single tracking-sync thread and deliver a snapshot the first time and
 * whenever it differs from the last one delivered. A write refreshes the
 * writing user's subscriptions immediately so it is echoed without waiting
 * for the next poll.
 */
@Service
public class PollingTrackingStoreClient implements TrackingStoreClient {

    private static final Logger logger = LoggerFactory.getLogger(PollingTrackingStoreClient.class);

    private final EpisodeTrackingRepository repository;
    private final TrackingDocumentMapper mapper;
    private final NextEpisodeCache nextEpisodeCache;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final long pollIntervalMs;

    private final Map<String, Set<PollingSubscription>> subscriptionsByUser = new ConcurrentHashMap<>();
    private final AtomicInteger activeSubscriptions = new AtomicInteger(0);
    private final Counter deliveries;

    @Autowired
    public PollingTrackingStoreClient(EpisodeTrackingRepository repository,
                                      TrackingDocumentMapper mapper,
                                      NextEpisodeCache nextEpisodeCache,
                                      @Qualifier("trackingSyncScheduler") ScheduledExecutorService scheduler,
                                      TrackingProperties properties,
                                      Clock clock,
                                      MeterRegistry meterRegistry) {
        this.repository = repository;
        this.mapper = mapper;
        this.nextEpisodeCache = nextEpisodeCache;
        this.scheduler = scheduler;
        this.clock = clock;
        this.pollIntervalMs = properties.getPollInterval().toMillis();
        this.deliveries = meterRegistry.counter("tracking_snapshot_deliveries_total");

        // Register gauge once with the AtomicInteger as the value source
        meterRegistry.gauge("tracking_subscriptions_active", activeSubscriptions);
    }

    @Override
    public Optional<ShowTracking> fetchOne(String userId, Integer showId) {
        return repository.findByUserAndShow(userId, showId).flatMap(mapper::toDomain);
    }

    @Override
    public Map<Integer, ShowTracking> fetchAll(String userId) {
        Map<Integer, ShowTracking> shows = new LinkedHashMap<>();
        for (EpisodeTrackingItem item : repository.findAllByUser(userId)) {
            mapper.toDomain(item).ifPresent(tracking -> shows.put(tracking.getShowId(), tracking));
        }
        return shows;
    }

    @Override
    public Subscription subscribeAll(String userId, Consumer<Map<Integer, ShowTracking>> onChange,
                                     Consumer<Throwable> onError) {
        return register(new PollingSubscription(userId, "all", () -> fetchAll(userId), onChange, onError));
    }

    @Override
    public Subscription subscribeOne(String userId, Integer showId, Consumer<Map<Integer, ShowTracking>> onChange,
                                     Consumer<Throwable> onError) {
        Supplier<Map<Integer, ShowTracking>> read = () -> fetchOne(userId, showId)
                .map(tracking -> Collections.singletonMap(showId, tracking))
                .orElse(Collections.emptyMap());
        return register(new PollingSubscription(userId, "show:" + showId, read, onChange, onError));
    }

    @Override
    public void upsertEpisode(String userId, Integer showId, EpisodeKey key, WatchedEpisode episode, MetadataPatch patch) {
        upsertEpisodes(userId, showId, Map.of(key, episode), patch);
    }

    @Override
    public void upsertEpisodes(String userId, Integer showId, Map<EpisodeKey, WatchedEpisode> episodes,
                               MetadataPatch patch) {
        repository.upsertEpisodes(userId, showId, mapper.toStoreEpisodes(episodes), patch, clock.millis());
        logger.info("User {} marked {} watched on show {}", userId, episodes.keySet(), showId);
        afterWrite(userId, showId);
    }

    @Override
    public void deleteEpisode(String userId, Integer showId, EpisodeKey key) {
        boolean existed = repository.removeEpisodes(userId, showId, Set.of(key.toStoreKey()),
                MetadataPatch.builder().resetNextEpisode().build(), clock.millis());
        logger.info("User {} un-marked {} on show {}{}", userId, key, showId, existed ? "" : " (no document)");
        afterWrite(userId, showId);
    }

    @Override
    public void deleteAllForShow(String userId, Integer showId) {
        repository.delete(userId, showId);
        logger.info("User {} cleared tracking for show {}", userId, showId);
        afterWrite(userId, showId);
    }

    int activeSubscriptionCount() {
        return activeSubscriptions.get();
    }

    private void afterWrite(String userId, Integer showId) {
        nextEpisodeCache.invalidate(userId, showId);
        Set<PollingSubscription> subscriptions = subscriptionsByUser.get(userId);
        if (subscriptions == null) {
            return;
        }
        for (PollingSubscription subscription : subscriptions) {
            subscription.refreshNow();
        }
    }

    private Subscription register(PollingSubscription subscription) {
        subscriptionsByUser.computeIfAbsent(subscription.userId, id -> ConcurrentHashMap.newKeySet()).add(subscription);
        activeSubscriptions.incrementAndGet();
        subscription.start();
        logger.debug("Subscribed user {} to {}", subscription.userId, subscription.label);
        return subscription;
    }

    private void deregister(PollingSubscription subscription) {
        subscriptionsByUser.computeIfPresent(subscription.userId, (id, set) -> {
            set.remove(subscription);
            return set.isEmpty() ? null : set;
        });
        activeSubscriptions.decrementAndGet();
        logger.debug("Unsubscribed user {} from {}", subscription.userId, subscription.label);
    }

    /**
     * One polling subscription. poll() only ever runs on the scheduler thread,
     * so lastDelivered needs no further guarding.
     */
    private final class PollingSubscription implements Subscription {

        private final String userId;
        private final String label;
        private final Supplier<Map<Integer, ShowTracking>> read;
        private final Consumer<Map<Integer, ShowTracking>> onChange;
        private final Consumer<Throwable> onError;

        private final AtomicBoolean active = new AtomicBoolean(true);
        private volatile ScheduledFuture<?> schedule;
        private Map<Integer, ShowTracking> lastDelivered;

        private PollingSubscription(String userId, String label, Supplier<Map<Integer, ShowTracking>> read,
                                    Consumer<Map<Integer, ShowTracking>> onChange, Consumer<Throwable> onError) {
            this.userId = userId;
            this.label = label;
            this.read = read;
            this.onChange = onChange;
            this.onError = onError;
        }

        void start() {
            schedule = scheduler.scheduleWithFixedDelay(this::poll, 0, pollIntervalMs, TimeUnit.MILLISECONDS);
        }

        void refreshNow() {
            if (!active.get()) {
                return;
            }
            try {
                scheduler.execute(this::poll);
            } catch (RejectedExecutionException e) {
                logger.debug("Scheduler shut down; skipping refresh of {} for user {}", label, userId);
            }
        }

        private void poll() {
            if (!active.get()) {
                return;
            }
            Map<Integer, ShowTracking> snapshot;
            try {
                snapshot = read.get();
            } catch (RuntimeException e) {
                logger.warn("Polling {} for user {} failed: {}", label, userId, e.getMessage());
                // the next good read must be delivered so the consumer leaves its error state
                lastDelivered = null;
                deliverError(e);
                return;
            }
            if (lastDelivered != null && lastDelivered.equals(snapshot)) {
                return;
            }
            lastDelivered = snapshot;
            if (!active.get()) {
                return;
            }
            snapshot.values().forEach(tracking -> nextEpisodeCache.onSnapshot(userId, tracking));
            deliveries.increment();
            try {
                onChange.accept(Collections.unmodifiableMap(snapshot));
            } catch (RuntimeException e) {
                logger.error("Snapshot listener for {} of user {} failed", label, userId, e);
            }
        }

        private void deliverError(Throwable error) {
            if (!active.get()) {
                return;
            }
            try {
                onError.accept(error);
            } catch (RuntimeException e) {
                logger.error("Error listener for {} of user {} failed", label, userId, e);
            }
        }

        @Override
        public void unsubscribe() {
            if (!active.compareAndSet(true, false)) {
                return;
            }
            ScheduledFuture<?> scheduled = schedule;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
            deregister(this);
        }

        @Override
        public boolean isActive() {
            return active.get();
        }
    }
}
