package com.bbthechange.watchtracker.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception thrown when TMDB API operations fail.
 * Maps to HTTP 404 (not found) or 503 (service unavailable) based on error type.
 */
public class TmdbException extends RuntimeException {

    private final ErrorType errorType;
    private final Integer showId;
    private final Integer seasonNumber;

    public enum ErrorType {
        /**
         * Show not found on TMDB (HTTP 404).
         */
        SHOW_NOT_FOUND(HttpStatus.NOT_FOUND),

        /**
         * Season not found for the show (HTTP 404).
         */
        SEASON_NOT_FOUND(HttpStatus.NOT_FOUND),

        /**
         * TMDB unreachable, erroring or still rate limiting after retries (HTTP 503).
         */
        SERVICE_UNAVAILABLE(HttpStatus.SERVICE_UNAVAILABLE);

        private final HttpStatus httpStatus;

        ErrorType(HttpStatus httpStatus) {
            this.httpStatus = httpStatus;
        }

        public HttpStatus getHttpStatus() {
            return httpStatus;
        }
    }

    public TmdbException(ErrorType errorType, Integer showId, Integer seasonNumber, String message) {
        super(message);
        this.errorType = errorType;
        this.showId = showId;
        this.seasonNumber = seasonNumber;
    }

    public TmdbException(ErrorType errorType, Integer showId, Integer seasonNumber, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
        this.showId = showId;
        this.seasonNumber = seasonNumber;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public Integer getShowId() {
        return showId;
    }

    public Integer getSeasonNumber() {
        return seasonNumber;
    }

    public HttpStatus getHttpStatus() {
        return errorType.getHttpStatus();
    }

    public static TmdbException showNotFound(Integer showId) {
        return new TmdbException(ErrorType.SHOW_NOT_FOUND, showId, null,
                "TMDB show not found: " + showId);
    }

    public static TmdbException seasonNotFound(Integer showId, Integer seasonNumber) {
        return new TmdbException(ErrorType.SEASON_NOT_FOUND, showId, seasonNumber,
                "TMDB season not found: show " + showId + " season " + seasonNumber);
    }

    public static TmdbException serviceUnavailable(Integer showId, Integer seasonNumber, Throwable cause) {
        return new TmdbException(ErrorType.SERVICE_UNAVAILABLE, showId, seasonNumber,
                "TMDB API is unavailable. Please try again later.", cause);
    }
}
