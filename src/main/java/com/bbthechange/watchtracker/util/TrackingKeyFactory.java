package com.bbthechange.watchtracker.util;

import com.bbthechange.watchtracker.exception.InvalidKeyException;

import java.util.Optional;

/**
 * Type-safe key factory for the WatchTrackerTable single-table design.
 *
 * Key Pattern: PK = USER#{userId}, SK = TRACKING#SHOW#{showId}
 */
public final class TrackingKeyFactory {

    private static final String DELIMITER = "#";

    public static final String TABLE_NAME = "WatchTrackerTable";

    public static final String USER_PREFIX = "USER";
    public static final String TRACKING_SHOW_PREFIX = "TRACKING" + DELIMITER + "SHOW";
    public static final String EPISODE_TRACKING_ITEM_TYPE = "EPISODE_TRACKING";

    private TrackingKeyFactory() {
        throw new UnsupportedOperationException("Utility class");
    }

    public static String getUserPk(String userId) {
        validateUserId(userId);
        return USER_PREFIX + DELIMITER + userId;
    }

    public static String getShowTrackingSk(Integer showId) {
        validateShowId(showId);
        return TRACKING_SHOW_PREFIX + DELIMITER + showId;
    }

    /**
     * Prefix matching every show-tracking sort key in a user's partition.
     */
    public static String getShowTrackingSkPrefix() {
        return TRACKING_SHOW_PREFIX + DELIMITER;
    }

    /**
     * Recover the show ID from a sort key; empty for anything that is not a
     * show-tracking key.
     */
    public static Optional<Integer> parseShowId(String sk) {
        if (sk == null || !sk.startsWith(getShowTrackingSkPrefix())) {
            return Optional.empty();
        }
        try {
            int showId = Integer.parseInt(sk.substring(getShowTrackingSkPrefix().length()));
            return showId > 0 ? Optional.of(showId) : Optional.empty();
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    private static void validateUserId(String userId) {
        if (userId == null || userId.trim().isEmpty()) {
            throw new InvalidKeyException("User ID cannot be null or empty");
        }
        if (userId.contains(DELIMITER)) {
            throw new InvalidKeyException("Invalid User ID format: " + userId);
        }
    }

    private static void validateShowId(Integer showId) {
        if (showId == null || showId <= 0) {
            throw new InvalidKeyException("Invalid show ID: " + showId);
        }
    }
}
