package com.unifiedcalendar.backend.scan;

public enum ScanPhase {
    STARTING,
    CALENDAR,
    EMAIL,
    ANALYZING,
    COMPLETE
}
