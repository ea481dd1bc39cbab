package com.clarifi.backend.exceptions;

/**
 * Raised when the storage layer cannot serve a dashboard read. Never retried by the core.
 */
public class DataUnavailableException extends RuntimeException {

    public DataUnavailableException(String message) {
        super(message);
    }

    public DataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
