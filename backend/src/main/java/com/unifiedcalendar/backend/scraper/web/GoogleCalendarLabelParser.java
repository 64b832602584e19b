package com.unifiedcalendar.backend.scraper.web;

import com.unifiedcalendar.backend.scraper.RawCalendarEvent;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads Google Calendar event chip labels, e.g.
 * <pre>
 * 10:00 to 10:45, Standup, Jane Doe, Accepted, Location: Room 4, 26 January 2026
 * All day, Offsite, Jane Doe, 31 January – 1 February 2026
 * </pre>
 */
public class GoogleCalendarLabelParser {

    private static final String MONTHS = "January|February|March|April|May|June|July|August|September|October"
            + "|November|December";

    private static final Pattern YEAR = Pattern.compile("\\d{4}");
    private static final Pattern TIME_RANGE = Pattern.compile(
            "^(" + LabelTimes.TIME + ")\\s+(?:to|–|-)\\s+(" + LabelTimes.TIME + ")$");
    private static final Pattern DATE_PART = Pattern.compile("\\d{1,2}\\s+(?:" + MONTHS + ")\\s+\\d{4}");
    private static final Pattern MULTI_DAY = Pattern.compile(
            "^(\\d{1,2})(?:\\s+(" + MONTHS + "))?\\s+(?:–|-|to)\\s+(\\d{1,2})\\s+(" + MONTHS + ")\\s+(\\d{4})");
    private static final Pattern SINGLE_DAY = Pattern.compile("(\\d{1,2})\\s+(" + MONTHS + ")\\s+(\\d{4})");

    private static final DateTimeFormatter DAY_FORMAT = DateTimeFormatter.ofPattern("d MMMM yyyy", Locale.ENGLISH);

    private static final List<String> METADATA_PREFIXES = List.of(
            "Needs RSVP", "Accepted", "Declined", "Tentative", "No location", "Location:", "All day");

    /**
     * The chip text repeats the title and time after the label; keep everything up to the first year.
     */
    public String labelPortion(String chipText) {
        String text = chipText == null ? "" : chipText.trim();
        Matcher year = YEAR.matcher(text);
        return year.find() ? text.substring(0, year.end()) : text;
    }

    /**
     * @param owner calendar owner's display name, which the label lists like any other attendee
     * @return the event, or null if the label is not an event label
     */
    public RawCalendarEvent parse(String label, String owner) {
        if (label == null) {
            return null;
        }
        String[] parts = label.split(", ");
        if (parts.length < 3) {
            return null;
        }

        String dateStr = findDatePart(parts);
        if (dateStr.isEmpty()) {
            return null;
        }
        LocalDate[] days = parseDays(dateStr);
        if (days == null) {
            return null;
        }

        boolean allDay = parts[0].trim().equals("All day");
        LocalDateTime start;
        LocalDateTime end;
        if (allDay) {
            start = days[0].atStartOfDay();
            end = days[1].atStartOfDay();
        } else {
            Matcher range = TIME_RANGE.matcher(parts[0].trim());
            if (!range.matches()) {
                return null;
            }
            LocalTime from = LabelTimes.parse(range.group(1));
            LocalTime to = LabelTimes.parse(range.group(2));
            if (from == null || to == null) {
                return null;
            }
            start = days[0].atTime(from);
            end = days[0].atTime(to);
            if (end.isBefore(start)) {
                end = end.plusDays(1);
            }
        }

        String title = extractTitle(parts, dateStr, owner);
        if (title.isEmpty()) {
            return null;
        }

        return RawCalendarEvent.builder()
                .title(title)
                .start(start)
                .end(end)
                .allDay(allDay)
                .location(extractLocation(parts))
                .rsvpState(rsvpState(label))
                .build();
    }

    private static String findDatePart(String[] parts) {
        for (int i = parts.length - 1; i >= 0; i--) {
            String p = parts[i].trim();
            if (DATE_PART.matcher(p).find()) {
                return p;
            }
        }
        return "";
    }

    /**
     * @return first and last day, or null if unreadable
     */
    private static LocalDate[] parseDays(String dateStr) {
        try {
            Matcher multi = MULTI_DAY.matcher(dateStr);
            if (multi.find()) {
                String firstMonth = multi.group(2) != null ? multi.group(2) : multi.group(4);
                LocalDate last = LocalDate.parse(multi.group(3) + " " + multi.group(4) + " " + multi.group(5), DAY_FORMAT);
                LocalDate first = LocalDate.parse(multi.group(1) + " " + firstMonth + " " + multi.group(5), DAY_FORMAT);
                // "31 December – 2 January 2027"
                if (first.isAfter(last)) {
                    first = first.minusYears(1);
                }
                return new LocalDate[]{first, last};
            }
            Matcher single = SINGLE_DAY.matcher(dateStr);
            if (single.find()) {
                LocalDate day = LocalDate.parse(single.group(1) + " " + single.group(2) + " " + single.group(3), DAY_FORMAT);
                return new LocalDate[]{day, day};
            }
        } catch (DateTimeParseException e) {
            return null;
        }
        return null;
    }

    private static String extractTitle(String[] parts, String dateStr, String owner) {
        List<String> titleParts = new ArrayList<>();
        for (int i = 1; i < parts.length; i++) {
            String p = parts[i].trim();
            if (p.equals(dateStr)) {
                break;
            }
            if (isMetadata(p) || (owner != null && !owner.isBlank() && p.equals(owner.trim()))) {
                continue;
            }
            titleParts.add(p);
        }
        return String.join(", ", titleParts).trim();
    }

    private static boolean isMetadata(String part) {
        for (String prefix : METADATA_PREFIXES) {
            if (part.startsWith(prefix)) {
                return true;
            }
        }
        return false;
    }

    private static String extractLocation(String[] parts) {
        for (String part : parts) {
            String p = part.trim();
            if (p.startsWith("Location:")) {
                return p.substring("Location:".length()).trim();
            }
        }
        return "";
    }

    static String rsvpState(String label) {
        if (label.contains("Needs RSVP")) {
            return "needs_rsvp";
        } else if (label.contains("Accepted")) {
            return "accepted";
        } else if (label.contains("Declined")) {
            return "declined";
        } else if (label.contains("Tentative")) {
            return "tentative";
        }
        return "";
    }
}
