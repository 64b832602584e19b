package com.unifiedcalendar.backend.account;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public enum AccountPlatform {
    GOOGLE("https://calendar.google.com/calendar/u/%d/r/week", "https://mail.google.com/mail/u/%d/#all", true),
    OUTLOOK("https://outlook.live.com/calendar/", null, false);

    private final String calendarUrlTemplate;
    private final String mailUrlTemplate;
    private final boolean supportsEmailScan;

    public String calendarUrl(int accountIndex) {
        return String.format(calendarUrlTemplate, accountIndex);
    }

    public String mailUrl(int accountIndex) {
        if (mailUrlTemplate == null) {
            throw new IllegalStateException(name() + " has no mail view");
        }
        return String.format(mailUrlTemplate, accountIndex);
    }
}
