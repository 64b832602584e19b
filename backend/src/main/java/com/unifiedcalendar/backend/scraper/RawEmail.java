package com.unifiedcalendar.backend.scraper;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the mail list view. {@code timestampText} is whatever the page shows,
 * e.g. "3:45 PM", "Yesterday" or "Jan 25".
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RawEmail {
    private String id;
    private String threadId;
    private String subject;
    private String from;
    private String timestampText;
    private String snippet;
}
