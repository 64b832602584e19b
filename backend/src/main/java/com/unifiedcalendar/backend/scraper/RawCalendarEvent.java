package com.unifiedcalendar.backend.scraper;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One event read from the visible calendar view, before normalization.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawCalendarEvent {
    private String title;
    private LocalDateTime start;
    private LocalDateTime end;
    private boolean allDay;
    private String location;
    private String rsvpState;

    // Key used to merge the two scraped periods
    public String dedupeKey() {
        return title + "|" + start;
    }
}
