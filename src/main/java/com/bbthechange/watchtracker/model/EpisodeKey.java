package com.bbthechange.watchtracker.model;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Identifies one episode within a show: {season, episode}.
 *
 * This is the in-memory key of a show's watched-episode map. The store keeps the
 * same identity as the string "{season}_{episode}"; conversion happens only in
 * {@link #toStoreKey()} and {@link #parse(String)}.
 */
public final class EpisodeKey implements Comparable<EpisodeKey> {

    private static final Pattern STORE_KEY_PATTERN = Pattern.compile("^(\\d+)_(\\d+)$");

    private final int season;
    private final int episode;

    private EpisodeKey(int season, int episode) {
        this.season = season;
        this.episode = episode;
    }

    public static EpisodeKey of(int season, int episode) {
        if (season < 0 || episode < 0) {
            throw new IllegalArgumentException("Season and episode numbers must not be negative: "
                    + season + "/" + episode);
        }
        return new EpisodeKey(season, episode);
    }

    /**
     * Parse a store key. Anything that is not two non-negative integers joined by
     * an underscore yields empty.
     */
    public static Optional<EpisodeKey> parse(String storeKey) {
        if (storeKey == null) {
            return Optional.empty();
        }
        Matcher matcher = STORE_KEY_PATTERN.matcher(storeKey);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        try {
            return Optional.of(new EpisodeKey(Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))));
        } catch (NumberFormatException e) {
            // digits overflowing an int
            return Optional.empty();
        }
    }

    public String toStoreKey() {
        return season + "_" + episode;
    }

    public int getSeason() {
        return season;
    }

    public int getEpisode() {
        return episode;
    }

    /**
     * Season 0 holds specials, which never count toward show progress.
     */
    public boolean isSpecial() {
        return season <= 0;
    }

    @Override
    public int compareTo(EpisodeKey other) {
        int bySeason = Integer.compare(season, other.season);
        return bySeason != 0 ? bySeason : Integer.compare(episode, other.episode);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EpisodeKey)) return false;
        EpisodeKey that = (EpisodeKey) o;
        return season == that.season && episode == that.episode;
    }

    @Override
    public int hashCode() {
        return Objects.hash(season, episode);
    }

    @Override
    public String toString() {
        return "S" + season + "E" + episode;
    }
}
