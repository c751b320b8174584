package com.bbthechange.watchtracker.client;

import com.bbthechange.watchtracker.dto.tmdb.TmdbSeasonDetailsResponse;
import com.bbthechange.watchtracker.dto.tmdb.TmdbShowDetailsResponse;
import com.bbthechange.watchtracker.exception.TmdbException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TmdbClientTest {

    @Mock
    private HttpClient httpClient;

    @Mock
    private HttpResponse<String> httpResponse;

    private TmdbClient tmdbClient;

    @BeforeEach
    void setUp() {
        tmdbClient = new TmdbClient(httpClient, new ObjectMapper(), "https://api.themoviedb.org/3", "test-key");
    }

    @Nested
    @DisplayName("getShowDetails")
    class GetShowDetailsTests {

        @Test
        @DisplayName("should map show details including seasons")
        void getShowDetails_ValidShow_MapsResponse() throws Exception {
            // Given
            String json = """
                {
                  "id": 1399,
                  "name": "Game of Thrones",
                  "poster_path": "/got.jpg",
                  "number_of_episodes": 73,
                  "episode_run_time": [60, 55],
                  "seasons": [
                    {"season_number": 0, "name": "Specials", "episode_count": 14, "air_date": "2010-12-05"},
                    {"season_number": 1, "name": "Season 1", "episode_count": 10, "air_date": "2011-04-17"}
                  ],
                  "unknown_field": true
                }
                """;
            when(httpClient.send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString()))).thenReturn(httpResponse);
            when(httpResponse.statusCode()).thenReturn(200);
            when(httpResponse.body()).thenReturn(json);

            // When
            TmdbShowDetailsResponse result = tmdbClient.getShowDetails(1399);

            // Then
            assertThat(result.getName()).isEqualTo("Game of Thrones");
            assertThat(result.getNumberOfEpisodes()).isEqualTo(73);
            assertThat(result.getEpisodeRunTime()).containsExactly(60, 55);
            assertThat(result.getSeasons()).hasSize(2);
            assertThat(result.getSeasons().get(1).getEpisodeCount()).isEqualTo(10);
        }

        @Test
        @DisplayName("should send the api key as a query parameter")
        void getShowDetails_SendsApiKey() throws Exception {
            // Given
            when(httpClient.send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString()))).thenReturn(httpResponse);
            when(httpResponse.statusCode()).thenReturn(200);
            when(httpResponse.body()).thenReturn("{\"id\": 1}");

            // When
            tmdbClient.getShowDetails(1);

            // Then
            ArgumentCaptor<HttpRequest> captor = ArgumentCaptor.forClass(HttpRequest.class);
            verify(httpClient).send(captor.capture(), eq(HttpResponse.BodyHandlers.ofString()));
            assertThat(captor.getValue().uri().toString())
                    .isEqualTo("https://api.themoviedb.org/3/tv/1?api_key=test-key");
        }

        @Test
        @DisplayName("should throw SHOW_NOT_FOUND on 404 without retrying")
        void getShowDetails_NotFound_ThrowsShowNotFound() throws Exception {
            // Given
            when(httpClient.send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString()))).thenReturn(httpResponse);
            when(httpResponse.statusCode()).thenReturn(404);

            // When/Then
            assertThatThrownBy(() -> tmdbClient.getShowDetails(999))
                    .isInstanceOf(TmdbException.class)
                    .satisfies(e -> assertThat(((TmdbException) e).getErrorType())
                            .isEqualTo(TmdbException.ErrorType.SHOW_NOT_FOUND));
            verify(httpClient, times(1)).send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString()));
        }

        @Test
        @DisplayName("should map server errors to SERVICE_UNAVAILABLE")
        void getShowDetails_ServerError_ThrowsServiceUnavailable() throws Exception {
            // Given
            when(httpClient.send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString()))).thenReturn(httpResponse);
            when(httpResponse.statusCode()).thenReturn(500);

            // When/Then
            assertThatThrownBy(() -> tmdbClient.getShowDetails(1399))
                    .isInstanceOf(TmdbException.class)
                    .satisfies(e -> assertThat(((TmdbException) e).getErrorType())
                            .isEqualTo(TmdbException.ErrorType.SERVICE_UNAVAILABLE));
        }

        @Test
        @DisplayName("should map IO failures to SERVICE_UNAVAILABLE")
        void getShowDetails_IoFailure_ThrowsServiceUnavailable() throws Exception {
            // Given
            when(httpClient.send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString()))).thenThrow(new IOException("connection reset"));

            // When/Then
            assertThatThrownBy(() -> tmdbClient.getShowDetails(1399))
                    .isInstanceOf(TmdbException.class)
                    .hasCauseInstanceOf(IOException.class);
        }
    }

    @Nested
    @DisplayName("rate limiting")
    class RateLimitTests {

        @Test
        @DisplayName("should retry on 429 and succeed")
        @SuppressWarnings("unchecked")
        void getSeasonDetails_RateLimitThenSuccess_RetriesAndSucceeds() throws Exception {
            // Given
            HttpResponse<String> rateLimitResponse = mock(HttpResponse.class);
            when(rateLimitResponse.statusCode()).thenReturn(429);

            HttpResponse<String> successResponse = mock(HttpResponse.class);
            when(successResponse.statusCode()).thenReturn(200);
            when(successResponse.body()).thenReturn("""
                {"id": 3624, "season_number": 1, "episodes": [
                  {"id": 63056, "season_number": 1, "episode_number": 1, "name": "Winter Is Coming", "air_date": "2011-04-17", "runtime": 62}
                ]}
                """);

            when(httpClient.send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString())))
                    .thenReturn(rateLimitResponse)
                    .thenReturn(successResponse);

            TmdbClient spyClient = spy(tmdbClient);
            doNothing().when(spyClient).sleep(anyLong());

            // When
            TmdbSeasonDetailsResponse result = spyClient.getSeasonDetails(1399, 1);

            // Then
            assertThat(result.getEpisodes()).hasSize(1);
            assertThat(result.getEpisodes().get(0).getName()).isEqualTo("Winter Is Coming");
            verify(httpClient, times(2)).send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString()));
            verify(spyClient).sleep(2000L);
        }

        @Test
        @DisplayName("should give up after max retries")
        void getSeasonDetails_RateLimitExhausted_ThrowsServiceUnavailable() throws Exception {
            // Given
            when(httpClient.send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString()))).thenReturn(httpResponse);
            when(httpResponse.statusCode()).thenReturn(429);

            TmdbClient spyClient = spy(tmdbClient);
            doNothing().when(spyClient).sleep(anyLong());

            // When/Then
            assertThatThrownBy(() -> spyClient.getSeasonDetails(1399, 1))
                    .isInstanceOf(TmdbException.class)
                    .satisfies(e -> {
                        TmdbException ex = (TmdbException) e;
                        assertThat(ex.getErrorType()).isEqualTo(TmdbException.ErrorType.SERVICE_UNAVAILABLE);
                        assertThat(ex.getSeasonNumber()).isEqualTo(1);
                    });
            verify(httpClient, times(3)).send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString()));
            verify(spyClient).sleep(2000L);
            verify(spyClient).sleep(3000L);
        }

        @Test
        @DisplayName("should throw SEASON_NOT_FOUND on 404")
        void getSeasonDetails_NotFound_ThrowsSeasonNotFound() throws Exception {
            when(httpClient.send(any(HttpRequest.class), eq(HttpResponse.BodyHandlers.ofString()))).thenReturn(httpResponse);
            when(httpResponse.statusCode()).thenReturn(404);

            assertThatThrownBy(() -> tmdbClient.getSeasonDetails(1399, 9))
                    .isInstanceOf(TmdbException.class)
                    .satisfies(e -> assertThat(((TmdbException) e).getErrorType())
                            .isEqualTo(TmdbException.ErrorType.SEASON_NOT_FOUND));
        }
    }
}
