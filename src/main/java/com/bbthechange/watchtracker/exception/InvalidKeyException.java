package com.bbthechange.watchtracker.exception;

/**
 * Thrown when a user ID, show ID or episode key cannot be turned into a valid table key.
 */
public class InvalidKeyException extends RuntimeException {

    public InvalidKeyException(String message) {
        super(message);
    }
}
