package com.unifiedcalendar.backend.scraper;

import com.unifiedcalendar.backend.account.Account;

public interface CalendarScraper {

    /**
     * Opens the calendar web UI for the account's session selector.
     *
     * @throws ScraperException if the page cannot be opened
     */
    CalendarView open(Account account);
}
