package com.unifiedcalendar.backend.feed;

/**
 * The structured feed could not be fetched.
 */
public class FeedException extends RuntimeException {

    public FeedException(String message) {
        super(message);
    }

    public FeedException(String message, Throwable cause) {
        super(message, cause);
    }
}
