package com.bbthechange.watchtracker.sync;

import com.bbthechange.watchtracker.exception.TrackingWriteException;
import com.bbthechange.watchtracker.exception.UnauthorizedException;
import com.bbthechange.watchtracker.service.TrackingStoreClient;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Keeps tracking data in sync for one consumer (an SSE connection, a request)
 * acting for one user.
 *
 * At most one live subscription exists per scope; watching a scope again
 * returns the same view. {@link #close()} and {@link #changeUser(UserContext)}
 * tear every subscription down, after which no view listener runs. Guests get
 * empty ready views and never reach the store.
 */
public class TrackingSync implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TrackingSync.class);

    private final TrackingStoreClient store;
    private final Executor writeExecutor;
    private final Duration writeTimeout;
    private final Clock clock;
    private final MeterRegistry meterRegistry;

    private final Map<TrackingScope, LiveView> live = new LinkedHashMap<>();
    private UserContext user;
    private boolean closed;

    public TrackingSync(UserContext user, TrackingStoreClient store, Executor writeExecutor, Duration writeTimeout,
                        Clock clock, MeterRegistry meterRegistry) {
        this.user = user;
        this.store = store;
        this.writeExecutor = writeExecutor;
        this.writeTimeout = writeTimeout;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    /**
     * The live view for a scope, subscribing on first use.
     */
    public synchronized TrackingView watch(TrackingScope scope) {
        if (closed) {
            throw new IllegalStateException("TrackingSync is closed");
        }
        LiveView existing = live.get(scope);
        if (existing != null) {
            return existing.view;
        }

        TrackingView view = new TrackingView(scope);
        Subscription subscription;
        if (user.isGuest()) {
            view.deliver(Collections.emptyMap());
            subscription = Subscription.NONE;
        } else if (scope.isAllShows()) {
            subscription = store.subscribeAll(user.getUserId(), view::deliver, view::fail);
        } else {
            subscription = store.subscribeOne(user.getUserId(), scope.getShowId(), view::deliver, view::fail);
        }
        live.put(scope, new LiveView(view, subscription));
        logger.debug("Watching {} for {}", scope, user);
        return view;
    }

    /**
     * Apply a mutation to every live view covering its show, then write it to
     * the store. On failure or timeout the views are restored and the write
     * ends ROLLED_BACK with the cause attached.
     *
     * @throws UnauthorizedException for guest contexts
     */
    public OptimisticWrite apply(TrackingMutation mutation) {
        String userId;
        List<TrackingView> views = new ArrayList<>();
        synchronized (this) {
            if (closed) {
                throw new IllegalStateException("TrackingSync is closed");
            }
            if (user.isGuest()) {
                throw new UnauthorizedException("Sign in to track episodes");
            }
            userId = user.getUserId();
            for (LiveView liveView : live.values()) {
                views.add(liveView.view);
            }
        }

        long now = clock.millis();
        List<Runnable> rollbacks = new ArrayList<>();
        for (TrackingView view : views) {
            TrackingView.Applied applied = view.applyOptimistic(mutation, now);
            if (applied != null) {
                rollbacks.add(() -> view.rollback(applied));
            }
        }

        OptimisticWrite write = new OptimisticWrite(mutation);
        CompletableFuture<Void> storeWrite;
        try {
            storeWrite = CompletableFuture.runAsync(() -> mutation.execute(store, userId), writeExecutor);
        } catch (RejectedExecutionException e) {
            storeWrite = CompletableFuture.failedFuture(e);
        }

        storeWrite
                .orTimeout(writeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((ignored, failure) -> {
                    if (failure == null) {
                        write.commit();
                        meterRegistry.counter("tracking_write_total", "status", "committed").increment();
                        logger.debug("Committed {} for user {}", mutation, userId);
                        return;
                    }
                    Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                            ? failure.getCause()
                            : failure;
                    rollbacks.forEach(Runnable::run);
                    String message = cause instanceof TimeoutException
                            ? "Tracking write timed out after " + writeTimeout.toSeconds() + "s"
                            : "Tracking write failed: " + cause.getMessage();
                    logger.warn("Rolled back {} for user {}: {}", mutation, userId, message);
                    meterRegistry.counter("tracking_write_total", "status", "rolled_back").increment();
                    write.rollBack(new TrackingWriteException(mutation.getShowId(), message, cause));
                });
        return write;
    }

    /**
     * Drop every subscription and continue for a different user.
     */
    public void changeUser(UserContext newUser) {
        List<LiveView> toClose;
        synchronized (this) {
            if (closed) {
                throw new IllegalStateException("TrackingSync is closed");
            }
            toClose = drain();
            this.user = newUser;
        }
        teardown(toClose);
        logger.debug("TrackingSync switched to {}", newUser);
    }

    @Override
    public void close() {
        List<LiveView> toClose;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = drain();
        }
        teardown(toClose);
    }

    synchronized int liveSubscriptionCount() {
        return live.size();
    }

    private List<LiveView> drain() {
        List<LiveView> drained = new ArrayList<>(live.values());
        live.clear();
        return drained;
    }

    // Outside our own monitor: a listener holding a view's monitor may call apply()
    private static void teardown(List<LiveView> views) {
        for (LiveView liveView : views) {
            liveView.subscription.unsubscribe();
            liveView.view.detach();
        }
    }

    private static final class LiveView {
        private final TrackingView view;
        private final Subscription subscription;

        private LiveView(TrackingView view, Subscription subscription) {
            this.view = view;
            this.subscription = subscription;
        }
    }
}
