package com.unifiedcalendar.backend.scan;

/**
 * Base class for scan requests the caller has to be told about.
 */
public class ScanException extends RuntimeException {

    public ScanException(String message) {
        super(message);
    }
}
