package com.unifiedcalendar.backend.scan.event;

import com.unifiedcalendar.backend.entry.entity.CalendarEntry;
import lombok.Value;

/**
 * Published after each entry is persisted, for incremental rendering.
 */
@Value
public class NewEntryEvent {
    CalendarEntry entry;
}
