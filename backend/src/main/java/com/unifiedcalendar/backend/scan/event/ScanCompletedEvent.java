package com.unifiedcalendar.backend.scan.event;

import lombok.Value;

@Value
public class ScanCompletedEvent {
    // e.g. "Found 12 entries from 2 account(s)"
    String summary;
    int entries;
    int accounts;
    int conflictingPairs;
}
