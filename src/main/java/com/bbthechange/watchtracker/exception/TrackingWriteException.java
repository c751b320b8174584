package com.bbthechange.watchtracker.exception;

/**
 * A watch/un-watch write that did not reach the store.
 * The optimistic local value has already been rolled back when this surfaces.
 */
public class TrackingWriteException extends RuntimeException {

    private final Integer showId;

    public TrackingWriteException(Integer showId, String message, Throwable cause) {
        super(message, cause);
        this.showId = showId;
    }

    public Integer getShowId() {
        return showId;
    }
}
