package com.bbthechange.watchtracker.sync;

public enum WriteState {
    /** Applied locally, store write outstanding. */
    PENDING,
    /** The store accepted the write. */
    COMMITTED,
    /** The store write failed or timed out; local state was restored. */
    ROLLED_BACK
}
