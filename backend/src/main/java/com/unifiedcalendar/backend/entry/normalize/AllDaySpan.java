package com.unifiedcalendar.backend.entry.normalize;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import lombok.Value;

/**
 * Start and end of an all-day entry: midnight of the first day to 23:59:59 of the last.
 */
@Value
public class AllDaySpan {

    private static final LocalTime LAST_SECOND = LocalTime.of(23, 59, 59);

    LocalDateTime start;
    LocalDateTime end;

    public static AllDaySpan of(LocalDate day) {
        return of(day, day);
    }

    /**
     * @param lastDay inclusive; a null or earlier last day collapses to a single day
     */
    public static AllDaySpan of(LocalDate firstDay, LocalDate lastDay) {
        LocalDate last = lastDay == null || lastDay.isBefore(firstDay) ? firstDay : lastDay;
        return new AllDaySpan(firstDay.atStartOfDay(), last.atTime(LAST_SECOND));
    }
}
