package com.bbthechange.watchtracker.sync;

import com.bbthechange.watchtracker.exception.TrackingWriteException;

import java.util.concurrent.CompletableFuture;

/**
 * A write that has been applied locally and is being confirmed by the store.
 * Starts PENDING and ends in exactly one of COMMITTED or ROLLED_BACK.
 */
public final class OptimisticWrite {

    private final TrackingMutation mutation;
    private final CompletableFuture<OptimisticWrite> completion = new CompletableFuture<>();
    private volatile WriteState state = WriteState.PENDING;
    private volatile TrackingWriteException error;

    OptimisticWrite(TrackingMutation mutation) {
        this.mutation = mutation;
    }

    public TrackingMutation getMutation() {
        return mutation;
    }

    public WriteState getState() {
        return state;
    }

    /**
     * Why the write was rolled back; null otherwise.
     */
    public TrackingWriteException getError() {
        return error;
    }

    /**
     * Completes with this write once it leaves PENDING. Never completes exceptionally.
     */
    public CompletableFuture<OptimisticWrite> getCompletion() {
        return completion;
    }

    /**
     * Block until the write settles.
     *
     * @throws TrackingWriteException when it was rolled back
     */
    public OptimisticWrite await() {
        completion.join();
        if (state == WriteState.ROLLED_BACK) {
            throw error;
        }
        return this;
    }

    void commit() {
        this.state = WriteState.COMMITTED;
        completion.complete(this);
    }

    void rollBack(TrackingWriteException cause) {
        this.error = cause;
        this.state = WriteState.ROLLED_BACK;
        completion.complete(this);
    }
}
