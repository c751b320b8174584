package com.bbthechange.watchtracker.sync;

import java.util.Objects;

/**
 * What a subscription covers: every show the user tracks, or one show.
 */
public final class TrackingScope {

    private static final TrackingScope ALL_SHOWS = new TrackingScope(null);

    private final Integer showId;

    private TrackingScope(Integer showId) {
        this.showId = showId;
    }

    public static TrackingScope allShows() {
        return ALL_SHOWS;
    }

    public static TrackingScope show(Integer showId) {
        if (showId == null || showId <= 0) {
            throw new IllegalArgumentException("Invalid show ID: " + showId);
        }
        return new TrackingScope(showId);
    }

    public boolean isAllShows() {
        return showId == null;
    }

    public Integer getShowId() {
        return showId;
    }

    public boolean covers(Integer otherShowId) {
        return isAllShows() || showId.equals(otherShowId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TrackingScope)) return false;
        return Objects.equals(showId, ((TrackingScope) o).showId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(showId);
    }

    @Override
    public String toString() {
        return isAllShows() ? "allShows" : "show:" + showId;
    }
}
