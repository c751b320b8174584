package com.bbthechange.watchtracker.client;

import com.bbthechange.watchtracker.dto.tmdb.TmdbSeasonDetailsResponse;
import com.bbthechange.watchtracker.dto.tmdb.TmdbShowDetailsResponse;
import com.bbthechange.watchtracker.exception.TmdbException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Client for the TMDB v3 API.
 * Fetches show and season details, retrying when TMDB rate limits us.
 */
@Component
public class TmdbClient {

    private static final Logger logger = LoggerFactory.getLogger(TmdbClient.class);

    private static final String TMDB_BASE_URL = "https://api.themoviedb.org/3";
    private static final String USER_AGENT = "WatchTracker/1.0";
    private static final int MAX_RETRIES = 3;
    private static final long[] RETRY_DELAYS_MS = {2000, 3000, 4500}; // Exponential backoff

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;

    @Autowired
    public TmdbClient(
            ObjectMapper objectMapper,
            @Value("${tmdb.base-url:" + TMDB_BASE_URL + "}") String baseUrl,
            @Value("${tmdb.api-key:}") String apiKey) {
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        if (apiKey.isEmpty()) {
            logger.warn("tmdb.api-key is not set; catalog lookups will fail and progress will show raw counts only");
        }
    }

    /**
     * Constructor for testing with custom HttpClient.
     */
    TmdbClient(HttpClient httpClient, ObjectMapper objectMapper, String baseUrl, String apiKey) {
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
    }

    /**
     * Fetch show details: episode count, runtimes and the season list.
     *
     * @param showId TMDB show ID
     * @throws TmdbException SHOW_NOT_FOUND on 404, SERVICE_UNAVAILABLE otherwise
     */
    public TmdbShowDetailsResponse getShowDetails(Integer showId) {
        logger.debug("Fetching TMDB details for show {}", showId);
        String url = baseUrl + "/tv/" + showId + "?api_key=" + encodedKey();
        return fetchWithRetry(url, TmdbShowDetailsResponse.class, showId, null,
                () -> TmdbException.showNotFound(showId));
    }

    /**
     * Fetch one season with its episode list.
     *
     * @throws TmdbException SEASON_NOT_FOUND on 404, SERVICE_UNAVAILABLE otherwise
     */
    public TmdbSeasonDetailsResponse getSeasonDetails(Integer showId, Integer seasonNumber) {
        logger.debug("Fetching TMDB season {} for show {}", seasonNumber, showId);
        String url = baseUrl + "/tv/" + showId + "/season/" + seasonNumber + "?api_key=" + encodedKey();
        return fetchWithRetry(url, TmdbSeasonDetailsResponse.class, showId, seasonNumber,
                () -> TmdbException.seasonNotFound(showId, seasonNumber));
    }

    /**
     * GET with retry on HTTP 429. Not-found is never retried.
     */
    private <T> T fetchWithRetry(String url, Class<T> responseType, Integer showId, Integer seasonNumber,
                                 Supplier<TmdbException> notFound) {
        int attempt = 0;
        Exception lastException = null;

        while (attempt < MAX_RETRIES) {
            try {
                return fetch(url, responseType, notFound);
            } catch (TmdbException e) {
                throw e;
            } catch (RateLimitException e) {
                attempt++;
                lastException = e;

                if (attempt < MAX_RETRIES) {
                    long delayMs = RETRY_DELAYS_MS[attempt - 1];
                    logger.warn("Rate limited by TMDB (attempt {}/{}). Retrying in {}ms",
                            attempt, MAX_RETRIES, delayMs);
                    sleep(delayMs);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw TmdbException.serviceUnavailable(showId, seasonNumber, e);
            } catch (Exception e) {
                throw TmdbException.serviceUnavailable(showId, seasonNumber, e);
            }
        }

        logger.error("TMDB still rate limiting after {} attempts for show {} season {}",
                MAX_RETRIES, showId, seasonNumber);
        throw TmdbException.serviceUnavailable(showId, seasonNumber, lastException);
    }

    private <T> T fetch(String url, Class<T> responseType, Supplier<TmdbException> notFound) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("User-Agent", USER_AGENT)
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(30))
                .GET()
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());

        int statusCode = response.statusCode();
        logger.debug("TMDB API response status: {} for path: {}", statusCode, redact(url));

        if (statusCode == 404) {
            throw notFound.get();
        }

        if (statusCode == 429) {
            throw new RateLimitException("Rate limited by TMDB");
        }

        if (statusCode < 200 || statusCode >= 300) {
            throw new RuntimeException("TMDB API returned status " + statusCode);
        }

        return objectMapper.readValue(response.body(), responseType);
    }

    private String encodedKey() {
        return URLEncoder.encode(apiKey, StandardCharsets.UTF_8);
    }

    private static String redact(String url) {
        int query = url.indexOf('?');
        return query >= 0 ? url.substring(0, query) : url;
    }

    /**
     * Sleep for the specified duration.
     * Package-private for testing.
     */
    void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for retry", e);
        }
    }

    /**
     * Internal exception for rate limiting that triggers retry.
     */
    private static class RateLimitException extends RuntimeException {
        RateLimitException(String message) {
            super(message);
        }
    }
}
