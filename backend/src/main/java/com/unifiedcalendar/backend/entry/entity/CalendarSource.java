package com.unifiedcalendar.backend.entry.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@EqualsAndHashCode(callSuper = false)
public final class CalendarSource extends EntrySource {
    private String feedName;
    // UID from a structured feed; null for scraped events
    private String externalEventId;
    private String location;
    private String rsvpState;

    @Override
    public SourceKind getKind() {
        return SourceKind.CALENDAR;
    }
}
