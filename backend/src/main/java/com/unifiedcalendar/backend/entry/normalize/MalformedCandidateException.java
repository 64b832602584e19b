package com.unifiedcalendar.backend.entry.normalize;

/**
 * A single raw candidate that cannot become an entry. The surrounding batch carries on.
 */
public class MalformedCandidateException extends RuntimeException {

    public MalformedCandidateException(String message) {
        super(message);
    }
}
