package com.unifiedcalendar.backend.account;

/**
 * Where an account's confirmed calendar entries come from.
 */
public enum AccountProvider {
    CALENDAR_WEB_UI,
    STRUCTURED_FEED
}
