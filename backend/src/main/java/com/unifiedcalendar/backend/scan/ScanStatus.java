package com.unifiedcalendar.backend.scan;

public enum ScanStatus {
    IDLE,
    SCANNING,
    // Advisory only; the running scan keeps going
    PAUSED,
    CANCELLED,
    ERROR,
    COMPLETE
}
