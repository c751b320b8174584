package com.bbthechange.watchtracker.model;

import java.util.Objects;

/**
 * Partial update to the metadata cached on a tracking document.
 *
 * Null fields are left untouched. The next episode is only changed when
 * {@link #getNextEpisodeStatus()} is set. lastUpdated is always stamped by the
 * write itself and is not part of the patch.
 */
public final class MetadataPatch {

    private static final MetadataPatch EMPTY = new Builder().build();

    private final String tvShowName;
    private final String posterPath;
    private final Integer totalEpisodes;
    private final Integer avgRuntime;
    private final String nextEpisodeStatus;
    private final NextEpisode nextEpisode;

    private MetadataPatch(Builder builder) {
        this.tvShowName = builder.tvShowName;
        this.posterPath = builder.posterPath;
        this.totalEpisodes = builder.totalEpisodes;
        this.avgRuntime = builder.avgRuntime;
        this.nextEpisodeStatus = builder.nextEpisodeStatus;
        this.nextEpisode = builder.nextEpisode;
    }

    public static MetadataPatch none() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTvShowName() {
        return tvShowName;
    }

    public String getPosterPath() {
        return posterPath;
    }

    public Integer getTotalEpisodes() {
        return totalEpisodes;
    }

    public Integer getAvgRuntime() {
        return avgRuntime;
    }

    public String getNextEpisodeStatus() {
        return nextEpisodeStatus;
    }

    public NextEpisode getNextEpisode() {
        return nextEpisode;
    }

    public boolean touchesNextEpisode() {
        return nextEpisodeStatus != null;
    }

    /**
     * Apply to a copy of the given metadata, stamping lastUpdated.
     */
    public EpisodeTrackingMetadata applyTo(EpisodeTrackingMetadata current, long lastUpdated) {
        EpisodeTrackingMetadata next = current != null ? current.copy() : new EpisodeTrackingMetadata();
        if (tvShowName != null) {
            next.setTvShowName(tvShowName);
        }
        if (posterPath != null) {
            next.setPosterPath(posterPath);
        }
        if (totalEpisodes != null) {
            next.setTotalEpisodes(totalEpisodes);
        }
        if (avgRuntime != null) {
            next.setAvgRuntime(avgRuntime);
        }
        if (nextEpisodeStatus != null) {
            next.setNextEpisodeStatus(nextEpisodeStatus);
            next.setNextEpisode(EpisodeTrackingMetadata.NEXT_AVAILABLE.equals(nextEpisodeStatus) ? nextEpisode : null);
        }
        next.setLastUpdated(lastUpdated);
        return next;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MetadataPatch)) return false;
        MetadataPatch that = (MetadataPatch) o;
        return Objects.equals(tvShowName, that.tvShowName)
                && Objects.equals(posterPath, that.posterPath)
                && Objects.equals(totalEpisodes, that.totalEpisodes)
                && Objects.equals(avgRuntime, that.avgRuntime)
                && Objects.equals(nextEpisodeStatus, that.nextEpisodeStatus)
                && Objects.equals(nextEpisode, that.nextEpisode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(tvShowName, posterPath, totalEpisodes, avgRuntime, nextEpisodeStatus, nextEpisode);
    }

    public static final class Builder {
        private String tvShowName;
        private String posterPath;
        private Integer totalEpisodes;
        private Integer avgRuntime;
        private String nextEpisodeStatus;
        private NextEpisode nextEpisode;

        private Builder() {
        }

        public Builder tvShowName(String tvShowName) {
            this.tvShowName = tvShowName;
            return this;
        }

        public Builder posterPath(String posterPath) {
            this.posterPath = posterPath;
            return this;
        }

        public Builder totalEpisodes(Integer totalEpisodes) {
            this.totalEpisodes = totalEpisodes;
            return this;
        }

        public Builder avgRuntime(Integer avgRuntime) {
            this.avgRuntime = avgRuntime;
            return this;
        }

        /**
         * Record a resolved next episode, or caught up when null.
         */
        public Builder nextEpisode(NextEpisode next) {
            this.nextEpisode = next;
            this.nextEpisodeStatus = next != null
                    ? EpisodeTrackingMetadata.NEXT_AVAILABLE
                    : EpisodeTrackingMetadata.NEXT_CAUGHT_UP;
            return this;
        }

        /**
         * Forget the cached next episode so it is recomputed on the next read.
         */
        public Builder resetNextEpisode() {
            this.nextEpisode = null;
            this.nextEpisodeStatus = EpisodeTrackingMetadata.NEXT_UNKNOWN;
            return this;
        }

        public MetadataPatch build() {
            return new MetadataPatch(this);
        }
    }
}
