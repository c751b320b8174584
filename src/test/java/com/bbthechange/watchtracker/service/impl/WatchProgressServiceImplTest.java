package com.bbthechange.watchtracker.service.impl;

import com.bbthechange.watchtracker.config.TrackingProperties;
import com.bbthechange.watchtracker.dto.progress.InProgressShow;
import com.bbthechange.watchtracker.dto.progress.InProgressShowsResponse;
import com.bbthechange.watchtracker.dto.tracking.ShowTrackingResponse;
import com.bbthechange.watchtracker.dto.tracking.WriteResultResponse;
import com.bbthechange.watchtracker.exception.RepositoryException;
import com.bbthechange.watchtracker.exception.TrackingWriteException;
import com.bbthechange.watchtracker.exception.UnauthorizedException;
import com.bbthechange.watchtracker.exception.ValidationException;
import com.bbthechange.watchtracker.model.EpisodeKey;
import com.bbthechange.watchtracker.model.EpisodeTrackingMetadata;
import com.bbthechange.watchtracker.model.MetadataPatch;
import com.bbthechange.watchtracker.model.NextEpisode;
import com.bbthechange.watchtracker.model.ShowTracking;
import com.bbthechange.watchtracker.model.WatchedEpisode;
import com.bbthechange.watchtracker.service.TrackingStoreClient;
import com.bbthechange.watchtracker.service.WatchProgressEnrichmentService;
import com.bbthechange.watchtracker.sync.TrackingMutation;
import com.bbthechange.watchtracker.sync.TrackingSyncFactory;
import com.bbthechange.watchtracker.sync.UserContext;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WatchProgressServiceImplTest {

    private static final UserContext USER = UserContext.authenticated("user-1");
    private static final Integer SHOW_ID = 1399;

    @Mock
    private TrackingStoreClient store;

    @Mock
    private TrackingMutationFactory mutationFactory;

    @Mock
    private WatchProgressEnrichmentService enrichmentService;

    private WatchProgressServiceImpl service;

    @BeforeEach
    void setUp() {
        TrackingProperties properties = new TrackingProperties();
        Clock clock = Clock.fixed(Instant.parse("2024-06-15T12:00:00Z"), ZoneOffset.UTC);
        TrackingSyncFactory syncFactory = new TrackingSyncFactory(store, Runnable::run, properties, clock,
                new SimpleMeterRegistry());
        service = new WatchProgressServiceImpl(store, syncFactory, mutationFactory, enrichmentService,
                Runnable::run, properties, clock);
    }

    private static ShowTracking tracked() {
        return new ShowTracking(SHOW_ID,
                Map.of(EpisodeKey.of(1, 1), new WatchedEpisode(101, SHOW_ID, 1, 1, 10L, "Winter Is Coming", null)),
                new EpisodeTrackingMetadata("Game of Thrones", "/got.jpg", 10L));
    }

    @Nested
    @DisplayName("reads")
    class Reads {

        @Test
        void getInProgressShows_Guest_ReturnsEmptyWithoutStoreCall() {
            InProgressShowsResponse response = service.getInProgressShows(UserContext.guest(), true);

            assertThat(response.getShows()).isEmpty();
            verifyNoInteractions(store, enrichmentService);
        }

        @Test
        void getInProgressShows_NotEnriched_UsesDocumentRows() {
            // Given
            Map<Integer, ShowTracking> shows = Map.of(SHOW_ID, tracked());
            InProgressShow row = InProgressShow.builder().tvShowId(SHOW_ID).build();
            when(store.fetchAll("user-1")).thenReturn(shows);
            when(enrichmentService.buildFromCache(shows)).thenReturn(List.of(row));

            // When
            InProgressShowsResponse response = service.getInProgressShows(USER, false);

            // Then
            assertThat(response.getShows()).containsExactly(row);
            assertThat(response.isEnriching()).isFalse();
            verify(enrichmentService, never()).enrich(any(), anyMap());
        }

        @Test
        void getInProgressShows_Enriched_WaitsForCatalogRows() {
            Map<Integer, ShowTracking> shows = Map.of(SHOW_ID, tracked());
            InProgressShow row = InProgressShow.builder().tvShowId(SHOW_ID)
                    .metadataStatus(InProgressShow.MetadataStatus.FRESH).build();
            when(store.fetchAll("user-1")).thenReturn(shows);
            when(enrichmentService.enrich("user-1", shows)).thenReturn(CompletableFuture.completedFuture(List.of(row)));

            InProgressShowsResponse response = service.getInProgressShows(USER, true);

            assertThat(response.getShows()).containsExactly(row);
        }

        @Test
        void getShowTracking_NotTracked_ReturnsEmptyResponse() {
            when(store.fetchOne("user-1", SHOW_ID)).thenReturn(Optional.empty());

            ShowTrackingResponse response = service.getShowTracking(USER, SHOW_ID);

            assertThat(response.getShowId()).isEqualTo(SHOW_ID);
            assertThat(response.getEpisodes()).isEmpty();
            assertThat(response.isProgressAvailable()).isFalse();
        }

        @Test
        @DisplayName("episodes are returned even when catalog data is unavailable")
        void getShowTracking_CatalogUnavailable_ReturnsEpisodes() {
            ShowTracking tracking = tracked();
            when(store.fetchOne("user-1", SHOW_ID)).thenReturn(Optional.of(tracking));
            when(enrichmentService.isInProgress(tracking)).thenReturn(true);
            when(enrichmentService.enrichShow("user-1", tracking)).thenReturn(CompletableFuture.completedFuture(
                    InProgressShow.builder().tvShowId(SHOW_ID).metadataStatus(InProgressShow.MetadataStatus.UNAVAILABLE).build()));

            ShowTrackingResponse response = service.getShowTracking(USER, SHOW_ID);

            assertThat(response.getTvShowName()).isEqualTo("Game of Thrones");
            assertThat(response.getEpisodes()).hasSize(1);
            assertThat(response.isProgressAvailable()).isFalse();
        }

        @Test
        void getShowTracking_InvalidShowId_Throws() {
            assertThatThrownBy(() -> service.getShowTracking(USER, 0))
                    .isInstanceOf(ValidationException.class);
        }
    }

    @Nested
    @DisplayName("writes")
    class Writes {

        @Test
        void markEpisodeWatched_Guest_ThrowsUnauthorized() {
            assertThatThrownBy(() -> service.markEpisodeWatched(UserContext.guest(), SHOW_ID, 1, 1, null))
                    .isInstanceOf(UnauthorizedException.class);
            verifyNoInteractions(store, mutationFactory);
        }

        @Test
        void markEpisodeWatched_EpisodeZero_ThrowsValidation() {
            assertThatThrownBy(() -> service.markEpisodeWatched(USER, SHOW_ID, 1, 0, null))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Episode number");
        }

        @Test
        @DisplayName("a committed write reports the written keys and the next episode")
        void markEpisodeWatched_Committed_ReturnsResult() {
            // Given
            EpisodeKey key = EpisodeKey.of(1, 2);
            NextEpisode next = NextEpisode.exact(1, 3, "Lord Snow", "2011-05-01");
            TrackingMutation mutation = TrackingMutation.upsert(SHOW_ID,
                    Map.of(key, new WatchedEpisode(102, SHOW_ID, 1, 2, 20L, "The Kingsroad", null)),
                    MetadataPatch.builder().nextEpisode(next).build());
            ShowTracking current = tracked();
            when(store.fetchOne("user-1", SHOW_ID)).thenReturn(Optional.of(current));
            when(mutationFactory.markWatched(current, SHOW_ID, key, null)).thenReturn(mutation);

            // When
            WriteResultResponse result = service.markEpisodeWatched(USER, SHOW_ID, 1, 2, null);

            // Then
            assertThat(result.getEpisodeKeys()).containsExactly("1_2");
            assertThat(result.getWatchedCount()).isEqualTo(2);
            assertThat(result.getNextEpisode()).isEqualTo(next);
            assertThat(result.getLastUpdated()).isEqualTo(Instant.parse("2024-06-15T12:00:00Z").toEpochMilli());
            verify(store).upsertEpisodes(eq("user-1"), eq(SHOW_ID), eq(mutation.getUpserts()), eq(mutation.getPatch()));
        }

        @Test
        void markEpisodeWatched_StoreFails_ThrowsWriteException() {
            EpisodeKey key = EpisodeKey.of(1, 2);
            TrackingMutation mutation = TrackingMutation.upsert(SHOW_ID,
                    Map.of(key, new WatchedEpisode(102, SHOW_ID, 1, 2, 20L, null, null)), MetadataPatch.none());
            when(store.fetchOne("user-1", SHOW_ID)).thenReturn(Optional.empty());
            when(mutationFactory.markWatched(null, SHOW_ID, key, null)).thenReturn(mutation);
            doThrow(new RepositoryException("Failed to update tracking"))
                    .when(store).upsertEpisodes(any(), any(), anyMap(), any());

            assertThatThrownBy(() -> service.markEpisodeWatched(USER, SHOW_ID, 1, 2, null))
                    .isInstanceOf(TrackingWriteException.class)
                    .hasMessageContaining("Failed to update tracking");
        }

        @Test
        void markEpisodeUnwatched_DeletesEpisode() {
            EpisodeKey key = EpisodeKey.of(1, 2);
            when(mutationFactory.markUnwatched(SHOW_ID, key)).thenReturn(TrackingMutation.remove(SHOW_ID, key));

            service.markEpisodeUnwatched(USER, SHOW_ID, 1, 2);

            verify(store).deleteEpisode("user-1", SHOW_ID, key);
            verify(store, never()).upsertEpisodes(any(), any(), anyMap(), any());
        }

        @Test
        void markSeasonWatched_SeasonZero_ThrowsValidation() {
            assertThatThrownBy(() -> service.markSeasonWatched(USER, SHOW_ID, 0, null))
                    .isInstanceOf(ValidationException.class);
            verifyNoInteractions(store);
        }

        @Test
        void clearShow_DeletesDocument() {
            when(mutationFactory.clearShow(SHOW_ID)).thenReturn(TrackingMutation.clearShow(SHOW_ID));

            service.clearShow(USER, SHOW_ID);

            verify(store).deleteAllForShow("user-1", SHOW_ID);
        }
    }
}
