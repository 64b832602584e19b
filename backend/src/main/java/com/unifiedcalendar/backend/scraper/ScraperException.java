package com.unifiedcalendar.backend.scraper;

/**
 * A page could not be opened or read. Treated as the source being unavailable.
 */
public class ScraperException extends RuntimeException {

    public ScraperException(String message) {
        super(message);
    }

    public ScraperException(String message, Throwable cause) {
        super(message, cause);
    }
}
