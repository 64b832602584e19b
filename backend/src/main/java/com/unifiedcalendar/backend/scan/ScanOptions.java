package com.unifiedcalendar.backend.scan;

import lombok.Value;

@Value
public class ScanOptions {
    // Emails older than the start of the day this many days ago are ignored
    int lookbackDays;
}
