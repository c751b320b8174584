package com.bbthechange.watchtracker.sync;

import com.bbthechange.watchtracker.dto.progress.InProgressShow;
import com.bbthechange.watchtracker.dto.progress.InProgressShowsResponse;
import com.bbthechange.watchtracker.model.ShowTracking;
import com.bbthechange.watchtracker.service.WatchProgressEnrichmentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * Feeds a {@link TrackingView} through enrichment to a consumer.
 *
 * Each change publishes the document-only rows at once with enriching=true,
 * then republishes as catalog-refined rows arrive; enriching drops to false
 * when the last lookup for that change is in. Lookups started for an older
 * change, or for a show that has since left the view, are ignored when they finish.
 *
 * The consumer is called on the publish executor, never on the thread that
 * delivered the snapshot. At most one response waits for a slow consumer;
 * a newer one replaces it.
 */
public class EnrichmentSession implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EnrichmentSession.class);

    private final String userId;
    private final TrackingView view;
    private final WatchProgressEnrichmentService enrichmentService;
    private final Consumer<InProgressShowsResponse> sink;
    private final Executor publishExecutor;
    private final TrackingView.Listener listener = this::onChange;

    private final Map<Integer, InProgressShow> rows = new LinkedHashMap<>();
    private long generation;
    private int outstanding;
    private boolean closed;
    private InProgressShowsResponse pending;
    private boolean draining;

    private EnrichmentSession(String userId, TrackingView view, WatchProgressEnrichmentService enrichmentService,
                              Consumer<InProgressShowsResponse> sink, Executor publishExecutor) {
        this.userId = userId;
        this.view = view;
        this.enrichmentService = enrichmentService;
        this.sink = sink;
        this.publishExecutor = publishExecutor;
    }

    /**
     * Start publishing for the view. If it already holds data the first
     * publication is handed to the executor before this returns.
     */
    public static EnrichmentSession bind(String userId, TrackingView view,
                                         WatchProgressEnrichmentService enrichmentService,
                                         Consumer<InProgressShowsResponse> sink,
                                         Executor publishExecutor) {
        EnrichmentSession session = new EnrichmentSession(userId, view, enrichmentService, sink, publishExecutor);
        view.addListener(session.listener);
        if (view.getState() == TrackingView.State.READY) {
            session.onChange(view);
        }
        return session;
    }

    public synchronized boolean isEnriching() {
        return outstanding > 0;
    }

    @Override
    public void close() {
        synchronized (this) {
            closed = true;
            pending = null;
            rows.clear();
        }
        view.removeListener(listener);
    }

    private synchronized void onChange(TrackingView changed) {
        if (closed || changed.getState() == TrackingView.State.ERROR) {
            return;
        }
        Map<Integer, ShowTracking> shows = changed.getShows();
        long current = ++generation;

        rows.clear();
        for (InProgressShow row : enrichmentService.buildFromCache(shows)) {
            rows.put(row.getTvShowId(), row);
        }
        List<ShowTracking> toEnrich = shows.values().stream()
                .filter(enrichmentService::isInProgress)
                .collect(Collectors.toList());
        outstanding = toEnrich.size();
        publish();

        for (ShowTracking tracking : toEnrich) {
            Integer showId = tracking.getShowId();
            enrichmentService.enrichShow(userId, tracking)
                    .thenAccept(row -> onEnriched(current, showId, row));
        }
    }

    private synchronized void onEnriched(long forGeneration, Integer showId, InProgressShow row) {
        if (closed || forGeneration != generation) {
            logger.debug("Discarding enrichment of show {} from an older snapshot", showId);
            return;
        }
        if (!rows.containsKey(showId)) {
            logger.debug("Discarding enrichment of show {}: no longer tracked", showId);
            return;
        }
        rows.put(showId, row);
        outstanding--;
        publish();
    }

    private void publish() {
        List<InProgressShow> shows = new ArrayList<>(rows.values());
        shows.sort(Comparator.comparing(InProgressShow::getLastUpdated,
                Comparator.nullsLast(Comparator.reverseOrder())));
        pending = InProgressShowsResponse.builder()
                .shows(shows)
                .enriching(outstanding > 0)
                .build();
        if (draining) {
            return;
        }
        draining = true;
        try {
            publishExecutor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            logger.warn("Publish executor rejected progress for user {}, closing session", userId);
            draining = false;
            closed = true;
            pending = null;
        }
    }

    private void drain() {
        while (true) {
            InProgressShowsResponse next;
            synchronized (this) {
                if (closed || pending == null) {
                    draining = false;
                    pending = null;
                    return;
                }
                next = pending;
                pending = null;
            }
            try {
                sink.accept(next);
            } catch (RuntimeException e) {
                logger.warn("Progress consumer for user {} failed, closing session: {}", userId, e.getMessage());
                synchronized (this) {
                    draining = false;
                }
                close();
                return;
            }
        }
    }
}
