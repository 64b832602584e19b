package com.unifiedcalendar.backend.scraper;

import java.util.List;

/**
 * An open calendar page for one account. Closing it releases the browser.
 */
public interface CalendarView extends AutoCloseable {

    /**
     * @return events in the currently visible period; may be empty while the page is still rendering
     */
    List<RawCalendarEvent> scrapeVisibleEvents();

    /**
     * Moves the view forward one period (a week for the week view).
     *
     * @throws ScraperException if the navigation control cannot be found
     */
    void navigateNextPeriod();

    @Override
    void close();
}
