package com.bbthechange.watchtracker.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class ShowTrackingTest {

    private static WatchedEpisode watched(int season, int episode, long watchedAt) {
        return new WatchedEpisode(season * 100 + episode, 1399, season, episode, watchedAt, "Ep " + episode, null);
    }

    private static ShowTracking trackingOf(WatchedEpisode... episodes) {
        Map<EpisodeKey, WatchedEpisode> map = new HashMap<>();
        for (WatchedEpisode episode : episodes) {
            map.put(episode.toKey(), episode);
        }
        return new ShowTracking(1399, map, new EpisodeTrackingMetadata("Game of Thrones", "/got.jpg", 1L));
    }

    @Nested
    @DisplayName("derived values")
    class DerivedValues {

        @Test
        void counts_ExcludeSpecialsFromRegularCount() {
            ShowTracking tracking = trackingOf(watched(0, 1, 10), watched(1, 1, 20), watched(1, 2, 30), watched(2, 1, 40));

            assertThat(tracking.regularWatchedCount()).isEqualTo(3);
            assertThat(tracking.watchedCountInSeason(1)).isEqualTo(2);
            assertThat(tracking.watchedCountInSeason(0)).isEqualTo(1);
            assertThat(tracking.maxWatchedSeason()).isEqualTo(2);
        }

        @Test
        void lastWatchedKey_PicksLatestWatchedAtIgnoringSpecials() {
            ShowTracking tracking = trackingOf(watched(1, 5, 500), watched(2, 1, 100), watched(0, 2, 900));

            assertThat(tracking.lastWatchedKey()).isEqualTo(EpisodeKey.of(1, 5));
            assertThat(tracking.lastWatched().getEpisodeNumber()).isEqualTo(5);
        }

        @Test
        void emptyTracking_HasNoLastWatchedAndDefaultsToSeasonOne() {
            ShowTracking tracking = ShowTracking.empty(1399, null);

            assertThat(tracking.lastWatchedKey()).isNull();
            assertThat(tracking.hasRegularWatched()).isFalse();
            assertThat(tracking.maxWatchedSeason()).isEqualTo(1);
            assertThat(tracking.getMetadata().getNextEpisodeStatus()).isEqualTo(EpisodeTrackingMetadata.NEXT_UNKNOWN);
        }
    }

    @Nested
    @DisplayName("copy-on-write")
    class CopyOnWrite {

        @Test
        @DisplayName("marking the same episode twice does not change the map size")
        void withEpisodes_SameKeyTwice_IsIdempotent() {
            ShowTracking base = trackingOf(watched(1, 1, 10));
            WatchedEpisode s2e5 = watched(2, 5, 50);

            ShowTracking once = base.withEpisodes(Map.of(s2e5.toKey(), s2e5));
            ShowTracking twice = once.withEpisodes(Map.of(s2e5.toKey(), s2e5));

            assertThat(twice.getEpisodes()).hasSize(2);
            assertThat(twice).isEqualTo(once);
            assertThat(base.getEpisodes()).hasSize(1);
        }

        @Test
        void withoutEpisode_RemovesOnlyThatKey() {
            ShowTracking base = trackingOf(watched(1, 1, 10), watched(1, 2, 20), watched(1, 3, 30));

            ShowTracking result = base.withoutEpisode(EpisodeKey.of(1, 2));

            assertThat(result.watchedKeys()).containsExactly(EpisodeKey.of(1, 1), EpisodeKey.of(1, 3));
        }

        @Test
        void withoutEpisode_MissingKey_ReturnsSameInstance() {
            ShowTracking base = trackingOf(watched(1, 1, 10));

            assertThat(base.withoutEpisode(EpisodeKey.of(4, 4))).isSameAs(base);
        }

        @Test
        void getMetadata_ReturnsDefensiveCopy() {
            ShowTracking tracking = trackingOf(watched(1, 1, 10));

            tracking.getMetadata().setTvShowName("changed");

            assertThat(tracking.getMetadata().getTvShowName()).isEqualTo("Game of Thrones");
        }
    }

    @Test
    void fingerprint_IsOrderedStoreKeys() {
        ShowTracking tracking = trackingOf(watched(2, 1, 1), watched(1, 10, 1), watched(1, 2, 1));

        assertThat(tracking.fingerprint()).isEqualTo("1_2,1_10,2_1");
    }
}
