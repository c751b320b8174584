package com.bbthechange.watchtracker.sync;

import com.bbthechange.watchtracker.model.ShowTracking;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Live, locally held tracking data for one {@link TrackingScope}.
 *
 * Store snapshots replace the whole map; optimistic writes patch single shows
 * until the store confirms or rejects them. All state is guarded by the
 * view's monitor. Listeners are called while it is held, so a listener never
 * runs after {@link #detach()} has returned and must not block; anything
 * that writes to a client hands off to its own thread, as
 * {@link EnrichmentSession} does.
 */
public final class TrackingView {

    private static final Logger logger = LoggerFactory.getLogger(TrackingView.class);

    public enum State {
        /** Waiting for the first snapshot. */
        LOADING,
        /** Holding the latest snapshot, possibly with optimistic writes applied. */
        READY,
        /** The subscription reported an error; the last known data is kept. */
        ERROR
    }

    /**
     * Called after every change to the view.
     */
    @FunctionalInterface
    public interface Listener {
        void onChange(TrackingView view);
    }

    private final TrackingScope scope;
    private final List<Listener> listeners = new CopyOnWriteArrayList<>();

    private Map<Integer, ShowTracking> shows = Collections.emptyMap();
    private State state = State.LOADING;
    private Throwable error;
    private long snapshotVersion;
    private boolean detached;

    TrackingView(TrackingScope scope) {
        this.scope = scope;
    }

    public TrackingScope getScope() {
        return scope;
    }

    public synchronized State getState() {
        return state;
    }

    public synchronized Throwable getError() {
        return error;
    }

    /**
     * Current shows in store order. The returned map is a copy.
     */
    public synchronized Map<Integer, ShowTracking> getShows() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(shows));
    }

    public synchronized Optional<ShowTracking> getShow(Integer showId) {
        return Optional.ofNullable(shows.get(showId));
    }

    public synchronized boolean isDetached() {
        return detached;
    }

    public void addListener(Listener listener) {
        listeners.add(listener);
    }

    public void removeListener(Listener listener) {
        listeners.remove(listener);
    }

    /**
     * Replace everything with a store snapshot.
     */
    synchronized void deliver(Map<Integer, ShowTracking> snapshot) {
        if (detached) {
            return;
        }
        Map<Integer, ShowTracking> next = new LinkedHashMap<>();
        snapshot.forEach((showId, tracking) -> {
            if (scope.covers(showId)) {
                next.put(showId, tracking);
            }
        });
        shows = next;
        state = State.READY;
        error = null;
        snapshotVersion++;
        notifyListeners();
    }

    synchronized void fail(Throwable cause) {
        if (detached) {
            return;
        }
        state = State.ERROR;
        error = cause;
        notifyListeners();
    }

    /**
     * Apply a mutation locally and remember enough to undo it.
     */
    synchronized Applied applyOptimistic(TrackingMutation mutation, long now) {
        Integer showId = mutation.getShowId();
        if (detached || !scope.covers(showId)) {
            return null;
        }
        ShowTracking previous = shows.get(showId);
        ShowTracking optimistic = mutation.applyTo(previous, now);
        replace(showId, optimistic);
        notifyListeners();
        return new Applied(showId, previous, optimistic, snapshotVersion);
    }

    /**
     * Undo an optimistic apply, unless a snapshot or a later write has
     * replaced the optimistic value since.
     */
    synchronized void rollback(Applied applied) {
        if (detached) {
            return;
        }
        if (snapshotVersion != applied.snapshotVersion || shows.get(applied.showId) != applied.optimistic) {
            logger.debug("Not rolling back show {} in {}: value replaced since the write", applied.showId, scope);
            return;
        }
        replace(applied.showId, applied.previous);
        notifyListeners();
    }

    synchronized void detach() {
        detached = true;
        listeners.clear();
    }

    private void replace(Integer showId, ShowTracking value) {
        Map<Integer, ShowTracking> next = new LinkedHashMap<>(shows);
        if (value == null) {
            next.remove(showId);
        } else {
            next.put(showId, value);
        }
        shows = next;
    }

    private void notifyListeners() {
        for (Listener listener : new ArrayList<>(listeners)) {
            try {
                listener.onChange(this);
            } catch (RuntimeException e) {
                logger.error("Tracking view listener failed for scope {}", scope, e);
            }
        }
    }

    /**
     * Record of one optimistic apply.
     */
    static final class Applied {
        private final Integer showId;
        private final ShowTracking previous;
        private final ShowTracking optimistic;
        private final long snapshotVersion;

        private Applied(Integer showId, ShowTracking previous, ShowTracking optimistic, long snapshotVersion) {
            this.showId = showId;
            this.previous = previous;
            this.optimistic = optimistic;
            this.snapshotVersion = snapshotVersion;
        }
    }
}
