package com.unifiedcalendar.backend.scraper.web;

import com.unifiedcalendar.backend.scraper.RawCalendarEvent;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads Outlook on the web event descriptions, e.g.
 * <pre>
 * Design review, 2:00 PM to 3:00 PM, Wednesday, January 28, 2026, Busy
 * </pre>
 * The title always comes first.
 */
public class OutlookCalendarLabelParser {

    private static final List<String> WEEKDAYS = List.of(
            "Monday", "Tuesday", "Wednesday", "Thursday", "Friday", "Saturday", "Sunday");
    private static final String MONTHS = "January|February|March|April|May|June|July|August|September|October"
            + "|November|December";

    private static final Pattern TIME_RANGE = Pattern.compile(
            "^(" + LabelTimes.TIME + ")\\s+to\\s+(" + LabelTimes.TIME + ")$");
    private static final Pattern MONTH_DAY = Pattern.compile("^(" + MONTHS + ")\\s+(\\d{1,2})$");
    private static final Pattern MONTH_DAY_ANYWHERE = Pattern.compile("(" + MONTHS + ")\\s+(\\d{1,2})");
    private static final Pattern YEAR = Pattern.compile("^(\\d{4})");

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("MMMM d yyyy", Locale.ENGLISH);

    /**
     * @param today used when the description carries no date (events in today's column)
     * @return the event, or null for cancelled or unreadable descriptions
     */
    public RawCalendarEvent parse(String description, LocalDate today) {
        if (description == null || description.toLowerCase(Locale.ROOT).startsWith("canceled:")) {
            return null;
        }
        String[] parts = description.split(", ");
        if (parts.length < 4) {
            return null;
        }
        String title = parts[0].trim();
        if (title.isEmpty()) {
            return null;
        }

        int timeIndex = -1;
        LocalTime from = null;
        LocalTime to = null;
        for (int i = 1; i < parts.length; i++) {
            Matcher range = TIME_RANGE.matcher(parts[i].trim());
            if (range.matches()) {
                from = LabelTimes.parse(range.group(1));
                to = LabelTimes.parse(range.group(2));
                timeIndex = i;
                break;
            }
        }

        LocalDate date = findDate(parts, timeIndex);
        if (date == null) {
            date = today;
        }

        boolean allDay = description.toLowerCase(Locale.ROOT).contains("all day") || from == null || to == null;
        LocalDateTime start;
        LocalDateTime end;
        if (allDay) {
            start = date.atStartOfDay();
            end = date.atStartOfDay();
        } else {
            start = date.atTime(from);
            end = date.atTime(to);
            if (end.isBefore(start)) {
                end = end.plusDays(1);
            }
        }

        return RawCalendarEvent.builder()
                .title(title)
                .start(start)
                .end(end)
                .allDay(allDay)
                .location("")
                .rsvpState(rsvpState(description))
                .build();
    }

    private static LocalDate findDate(String[] parts, int timeIndex) {
        // "Wednesday, January 28, 2026"
        for (int i = Math.max(1, timeIndex + 1); i + 2 < parts.length; i++) {
            if (WEEKDAYS.contains(parts[i].trim())) {
                Matcher monthDay = MONTH_DAY.matcher(parts[i + 1].trim());
                Matcher year = YEAR.matcher(parts[i + 2].trim());
                if (monthDay.matches() && year.find()) {
                    return toDate(monthDay.group(1), monthDay.group(2), year.group(1));
                }
            }
        }
        for (int i = 1; i + 1 < parts.length; i++) {
            Matcher monthDay = MONTH_DAY_ANYWHERE.matcher(parts[i]);
            Matcher year = YEAR.matcher(parts[i + 1].trim());
            if (monthDay.find() && year.find()) {
                return toDate(monthDay.group(1), monthDay.group(2), year.group(1));
            }
        }
        return null;
    }

    private static LocalDate toDate(String month, String day, String year) {
        try {
            return LocalDate.parse(month + " " + day + " " + year, DATE_FORMAT);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static String rsvpState(String description) {
        if (description.contains("Tentative")) {
            return "tentative";
        } else if (description.contains("Busy")) {
            return "accepted";
        } else if (description.contains("Free")) {
            return "free";
        }
        return "";
    }
}
