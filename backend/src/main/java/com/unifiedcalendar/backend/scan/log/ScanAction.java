package com.unifiedcalendar.backend.scan.log;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum ScanAction {
    CALENDAR_SCRAPED,
    CALENDAR_ERROR,
    FEED_FETCHED,
    EMAILS_SCANNED,
    EMAIL_ERROR,
    CANDIDATE_SKIPPED,
    ACCOUNT_ADDED,
    SCAN_COMPLETE,
    SCAN_ERROR;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
