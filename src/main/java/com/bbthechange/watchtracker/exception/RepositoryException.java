package com.bbthechange.watchtracker.exception;

/**
 * Thrown when a tracking-table operation fails.
 * Wraps the underlying DynamoDB exception with the operation that was attempted.
 */
public class RepositoryException extends RuntimeException {

    public RepositoryException(String message) {
        super(message);
    }

    public RepositoryException(String message, Throwable cause) {
        super(message, cause);
    }
}
