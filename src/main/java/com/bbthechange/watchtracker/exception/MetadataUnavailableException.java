package com.bbthechange.watchtracker.exception;

/**
 * Raised by the metadata cache when a catalog fetch failed and there is no
 * previously fetched value to fall back on.
 * Callers show raw watched counts without percentages.
 */
public class MetadataUnavailableException extends RuntimeException {

    private final Integer showId;

    public MetadataUnavailableException(Integer showId, Throwable cause) {
        super("Metadata unavailable for show " + showId, cause);
        this.showId = showId;
    }

    public Integer getShowId() {
        return showId;
    }
}
