package com.nextride.backend.exception;

/**
 * Raised when a feed group cannot be retrieved: network failure, timeout,
 * non-success status or an empty body.
 */
public class FeedFetchException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public FeedFetchException(String message) {
        super(message);
    }

    public FeedFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
