package com.unifiedcalendar.backend.classifier;

/**
 * Thrown when the inference oracle is not configured or not ready.
 * Never leaves the classifier.
 */
public class OracleUnavailableException extends RuntimeException {

    public OracleUnavailableException(String message) {
        super(message);
    }

    public OracleUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
