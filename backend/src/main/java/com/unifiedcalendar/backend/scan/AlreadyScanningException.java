package com.unifiedcalendar.backend.scan;

public class AlreadyScanningException extends ScanException {

    public AlreadyScanningException() {
        super("Scan already in progress");
    }
}
