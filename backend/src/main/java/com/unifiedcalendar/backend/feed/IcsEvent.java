package com.unifiedcalendar.backend.feed;

import java.time.LocalDateTime;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A VEVENT after unfolding, unescaping and date parsing. Times are in the scan zone.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IcsEvent {
    private String uid;
    private String summary;
    private String location;
    // Raw STATUS value, e.g. CONFIRMED or TENTATIVE
    private String status;
    private LocalDateTime start;
    private LocalDateTime end;
    private boolean allDay;
}
