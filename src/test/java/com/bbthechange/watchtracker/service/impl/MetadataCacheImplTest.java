package com.bbthechange.watchtracker.service.impl;

import com.bbthechange.watchtracker.client.TmdbClient;
import com.bbthechange.watchtracker.config.TrackingProperties;
import com.bbthechange.watchtracker.dto.metadata.CachedMetadata;
import com.bbthechange.watchtracker.dto.metadata.EpisodeMetadata;
import com.bbthechange.watchtracker.dto.metadata.ShowMetadata;
import com.bbthechange.watchtracker.dto.tmdb.TmdbEpisodeResponse;
import com.bbthechange.watchtracker.dto.tmdb.TmdbSeasonDetailsResponse;
import com.bbthechange.watchtracker.dto.tmdb.TmdbShowDetailsResponse;
import com.bbthechange.watchtracker.exception.MetadataUnavailableException;
import com.bbthechange.watchtracker.exception.TmdbException;
import com.bbthechange.watchtracker.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MetadataCacheImplTest {

    @Mock
    private TmdbClient tmdbClient;

    private final Deque<Runnable> queuedFetches = new ArrayDeque<>();
    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private MetadataCacheImpl cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-15T12:00:00Z"));
        meterRegistry = new SimpleMeterRegistry();
        TrackingProperties properties = new TrackingProperties();
        properties.setMetadataStaleness(Duration.ofMinutes(30));
        cache = new MetadataCacheImpl(tmdbClient, properties, queuedFetches::add, clock, meterRegistry);
    }

    private void runQueuedFetches() {
        while (!queuedFetches.isEmpty()) {
            queuedFetches.poll().run();
        }
    }

    private static TmdbShowDetailsResponse showDetails(String name) {
        return TmdbShowDetailsResponse.builder()
                .id(1399)
                .name(name)
                .posterPath("/got.jpg")
                .numberOfEpisodes(73)
                .episodeRunTime(List.of(60, 55))
                .seasons(List.of(
                        new TmdbShowDetailsResponse.TmdbSeasonSummary(0, "Specials", 14, "2010-12-05"),
                        new TmdbShowDetailsResponse.TmdbSeasonSummary(1, "Season 1", 10, "2011-04-17"),
                        new TmdbShowDetailsResponse.TmdbSeasonSummary(9, "Season 9", null, "not-a-date")))
                .build();
    }

    private double counter(String result) {
        return meterRegistry.counter("metadata_cache_requests_total", "result", result).count();
    }

    @Nested
    @DisplayName("getShowMetadata")
    class GetShowMetadata {

        @Test
        @DisplayName("maps TMDB details into show metadata")
        void miss_FetchesAndMaps() {
            when(tmdbClient.getShowDetails(1399)).thenReturn(showDetails("Game of Thrones"));

            CompletableFuture<CachedMetadata<ShowMetadata>> future = cache.getShowMetadata(1399);
            runQueuedFetches();

            CachedMetadata<ShowMetadata> result = future.join();
            assertThat(result.getSource()).isEqualTo(CachedMetadata.Source.FETCHED);
            ShowMetadata show = result.getValue();
            assertThat(show.getName()).isEqualTo("Game of Thrones");
            assertThat(show.getTotalEpisodes()).isEqualTo(73);
            assertThat(show.getAvgRuntime()).isEqualTo(58);
            assertThat(show.getSeasons()).hasSize(3);
            assertThat(show.getSeasons().get(1).getAirDate()).isEqualTo(LocalDate.of(2011, 4, 17));
            assertThat(show.getSeasons().get(2).getAirDate()).isNull();
            assertThat(show.getSeasons().get(2).getEpisodeCount()).isZero();
            assertThat(counter("miss")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("concurrent reads of the same show share one fetch")
        void concurrentReads_ShareOneFetch() {
            when(tmdbClient.getShowDetails(1399)).thenReturn(showDetails("Game of Thrones"));

            CompletableFuture<CachedMetadata<ShowMetadata>> first = cache.getShowMetadata(1399);
            CompletableFuture<CachedMetadata<ShowMetadata>> second = cache.getShowMetadata(1399);

            assertThat(queuedFetches).hasSize(1);
            assertThat(second).isSameAs(first);

            runQueuedFetches();

            assertThat(second.join().getValue().getName()).isEqualTo("Game of Thrones");
            verify(tmdbClient, times(1)).getShowDetails(1399);
        }

        @Test
        void withinStalenessWindow_ServesHitWithoutFetching() {
            when(tmdbClient.getShowDetails(1399)).thenReturn(showDetails("Game of Thrones"));
            cache.getShowMetadata(1399);
            runQueuedFetches();

            clock.advance(Duration.ofMinutes(29));
            CachedMetadata<ShowMetadata> result = cache.getShowMetadata(1399).join();

            assertThat(result.getSource()).isEqualTo(CachedMetadata.Source.HIT);
            assertThat(queuedFetches).isEmpty();
            verify(tmdbClient, times(1)).getShowDetails(1399);
            assertThat(counter("hit")).isEqualTo(1.0);
        }

        @Test
        void pastStalenessWindow_Refetches() {
            when(tmdbClient.getShowDetails(1399))
                    .thenReturn(showDetails("Game of Thrones"))
                    .thenReturn(showDetails("GoT"));
            cache.getShowMetadata(1399);
            runQueuedFetches();

            clock.advance(Duration.ofMinutes(31));
            CompletableFuture<CachedMetadata<ShowMetadata>> refreshed = cache.getShowMetadata(1399);
            runQueuedFetches();

            assertThat(refreshed.join().getValue().getName()).isEqualTo("GoT");
            assertThat(refreshed.join().getSource()).isEqualTo(CachedMetadata.Source.FETCHED);
        }

        @Test
        @DisplayName("failed re-fetch serves the previous value flagged stale")
        void failedRefetch_ServesStaleValue() {
            when(tmdbClient.getShowDetails(1399))
                    .thenReturn(showDetails("Game of Thrones"))
                    .thenThrow(TmdbException.serviceUnavailable(1399, null, null));
            cache.getShowMetadata(1399);
            runQueuedFetches();

            clock.advance(Duration.ofHours(2));
            CompletableFuture<CachedMetadata<ShowMetadata>> future = cache.getShowMetadata(1399);
            runQueuedFetches();

            CachedMetadata<ShowMetadata> result = future.join();
            assertThat(result.isStale()).isTrue();
            assertThat(result.getValue().getName()).isEqualTo("Game of Thrones");
            assertThat(counter("stale")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("failed fetch with nothing cached fails as unavailable")
        void failedFetchWithoutValue_FailsUnavailable() {
            when(tmdbClient.getShowDetails(1399)).thenThrow(TmdbException.serviceUnavailable(1399, null, null));

            CompletableFuture<CachedMetadata<ShowMetadata>> future = cache.getShowMetadata(1399);
            runQueuedFetches();

            assertThatThrownBy(future::join)
                    .isInstanceOf(CompletionException.class)
                    .hasCauseInstanceOf(MetadataUnavailableException.class);
            assertThat(counter("unavailable")).isEqualTo(1.0);
        }

        @Test
        void failedFetch_AllowsNextReadToRetry() {
            when(tmdbClient.getShowDetails(1399))
                    .thenThrow(TmdbException.serviceUnavailable(1399, null, null))
                    .thenReturn(showDetails("Game of Thrones"));
            cache.getShowMetadata(1399);
            runQueuedFetches();

            CompletableFuture<CachedMetadata<ShowMetadata>> retry = cache.getShowMetadata(1399);
            runQueuedFetches();

            assertThat(retry.join().getValue().getName()).isEqualTo("Game of Thrones");
        }
    }

    @Nested
    @DisplayName("getSeasonEpisodes")
    class GetSeasonEpisodes {

        @Test
        void mapsEpisodesAndSkipsUnnumbered() {
            TmdbSeasonDetailsResponse season = TmdbSeasonDetailsResponse.builder()
                    .seasonNumber(1)
                    .episodes(List.of(
                            TmdbEpisodeResponse.builder().id(1).episodeNumber(1).name("Winter Is Coming").airDate("2011-04-17").build(),
                            TmdbEpisodeResponse.builder().id(2).episodeNumber(null).name("Broken").build(),
                            TmdbEpisodeResponse.builder().id(3).seasonNumber(1).episodeNumber(2).name("The Kingsroad").airDate("").build()))
                    .build();
            when(tmdbClient.getSeasonDetails(1399, 1)).thenReturn(season);

            CompletableFuture<CachedMetadata<List<EpisodeMetadata>>> future = cache.getSeasonEpisodes(1399, 1);
            runQueuedFetches();

            List<EpisodeMetadata> episodes = future.join().getValue();
            assertThat(episodes).extracting(EpisodeMetadata::getEpisodeNumber).containsExactly(1, 2);
            assertThat(episodes.get(0).getSeasonNumber()).isEqualTo(1);
            assertThat(episodes.get(1).getAirDate()).isNull();
        }

        @Test
        void invalidateShow_DropsShowAndSeasons() {
            when(tmdbClient.getShowDetails(1399)).thenReturn(showDetails("Game of Thrones"));
            when(tmdbClient.getSeasonDetails(1399, 1))
                    .thenReturn(TmdbSeasonDetailsResponse.builder().seasonNumber(1).episodes(List.of()).build());
            cache.getShowMetadata(1399);
            cache.getSeasonEpisodes(1399, 1);
            runQueuedFetches();

            cache.invalidateShow(1399);
            cache.getShowMetadata(1399);
            cache.getSeasonEpisodes(1399, 1);

            assertThat(queuedFetches).hasSize(2);
        }
    }

    @Test
    void averageRuntime_IgnoresInvalidValuesAndFallsBack() {
        assertThat(cache.averageRuntime(List.of(42, 44))).isEqualTo(43);
        assertThat(cache.averageRuntime(Arrays.asList(30, null, 0, -5))).isEqualTo(30);
        assertThat(cache.averageRuntime(List.of())).isEqualTo(45);
        assertThat(cache.averageRuntime(null)).isEqualTo(45);
    }
}
