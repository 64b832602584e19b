package com.unifiedcalendar.backend.scan;

public class NoAccountsException extends ScanException {

    public NoAccountsException() {
        super("No accounts configured");
    }
}
