package com.bbthechange.watchtracker.sync;

import java.util.Objects;

/**
 * Who a {@link TrackingSync} acts for. Passed explicitly; there is no ambient
 * current user.
 */
public final class UserContext {

    private static final UserContext GUEST = new UserContext(null);

    private final String userId;

    private UserContext(String userId) {
        this.userId = userId;
    }

    public static UserContext authenticated(String userId) {
        if (userId == null || userId.trim().isEmpty()) {
            throw new IllegalArgumentException("userId must not be blank");
        }
        return new UserContext(userId);
    }

    public static UserContext guest() {
        return GUEST;
    }

    /**
     * Authenticated context for a non-blank user ID, guest otherwise.
     */
    public static UserContext of(String userId) {
        return userId == null || userId.trim().isEmpty() ? GUEST : new UserContext(userId);
    }

    public boolean isGuest() {
        return userId == null;
    }

    public String getUserId() {
        return userId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UserContext)) return false;
        return Objects.equals(userId, ((UserContext) o).userId);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(userId);
    }

    @Override
    public String toString() {
        return isGuest() ? "UserContext{guest}" : "UserContext{" + userId + '}';
    }
}
