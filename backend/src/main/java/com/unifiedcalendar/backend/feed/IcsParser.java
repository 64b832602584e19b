package com.unifiedcalendar.backend.feed;

import com.unifiedcalendar.backend.config.ScanConfig;
import com.unifiedcalendar.backend.entry.normalize.AllDaySpan;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Parser for the iCalendar subset served by private calendar feeds: top-level VEVENT
 * blocks, folded lines, DATE and DATE-TIME values (local or UTC) and escaped text.
 * Parameters such as TZID are ignored; local values are read in the scan zone.
 */
@Component
@Slf4j
public class IcsParser {

    private static final Pattern DATE_ONLY = Pattern.compile("\\d{8}");
    private static final Pattern DATE_TIME = Pattern.compile("\\d{8}T\\d{6}Z?");
    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter DATE_TIME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss");

    private static final String BEGIN_EVENT = "BEGIN:VEVENT";
    private static final String END_EVENT = "END:VEVENT";

    private final Clock clock;
    private final ScanConfig scanConfig;

    public IcsParser(Clock clock, ScanConfig scanConfig) {
        this.clock = clock;
        this.scanConfig = scanConfig;
    }

    public List<IcsEvent> parse(String icsText) {
        List<IcsEvent> events = new ArrayList<>();
        if (icsText == null || icsText.isBlank()) {
            return events;
        }

        LocalDateTime cutoff = LocalDateTime.now(clock).minusDays(scanConfig.getStaleFeedDays());
        int dropped = 0;

        for (Map<String, String> properties : extractEvents(unfold(icsText))) {
            try {
                IcsEvent event = toEvent(properties);
                if (event == null) {
                    dropped++;
                } else if (event.getEnd().isBefore(cutoff)) {
                    log.debug("Skipping stale feed event '{}' ending {}", event.getSummary(), event.getEnd());
                } else {
                    events.add(event);
                }
            } catch (DateTimeException e) {
                dropped++;
                log.warn("Skipping feed event with unreadable dates {}: {}", properties.get("UID"), e.getMessage());
            }
        }

        if (dropped > 0) {
            log.debug("Dropped {} malformed feed events", dropped);
        }
        return events;
    }

    /**
     * Joins continuation lines (leading space or tab) onto the previous logical line.
     */
    static List<String> unfold(String icsText) {
        List<String> lines = new ArrayList<>();
        for (String physical : icsText.split("\\r?\\n")) {
            if ((physical.startsWith(" ") || physical.startsWith("\t")) && !lines.isEmpty()) {
                int last = lines.size() - 1;
                lines.set(last, lines.get(last) + physical.substring(1));
            } else {
                lines.add(physical);
            }
        }
        return lines;
    }

    /**
     * Property maps of top-level VEVENT blocks. Nested components such as VALARM are skipped.
     */
    static List<Map<String, String>> extractEvents(List<String> lines) {
        List<Map<String, String>> events = new ArrayList<>();
        Map<String, String> current = null;
        int nested = 0;

        for (String raw : lines) {
            String line = raw.stripTrailing();
            if (current == null) {
                if (line.equalsIgnoreCase(BEGIN_EVENT)) {
                    current = new HashMap<>();
                    nested = 0;
                }
                continue;
            }

            String upper = line.toUpperCase(Locale.ROOT);
            if (nested == 0 && upper.equals(END_EVENT)) {
                events.add(current);
                current = null;
            } else if (upper.startsWith("BEGIN:")) {
                nested++;
            } else if (upper.startsWith("END:")) {
                nested = Math.max(0, nested - 1);
            } else if (nested == 0) {
                putProperty(current, line);
            }
        }
        return events;
    }

    private static void putProperty(Map<String, String> properties, String line) {
        int colon = line.indexOf(':');
        if (colon <= 0) {
            return;
        }
        String key = line.substring(0, colon);
        int semicolon = key.indexOf(';');
        if (semicolon != -1) {
            key = key.substring(0, semicolon);
        }
        properties.put(key.toUpperCase(Locale.ROOT), line.substring(colon + 1));
    }

    private IcsEvent toEvent(Map<String, String> properties) {
        String dtStart = properties.get("DTSTART");
        if (dtStart == null || dtStart.isBlank()) {
            return null;
        }

        String summary = properties.get("SUMMARY");
        IcsEvent.IcsEventBuilder builder = IcsEvent.builder()
                .uid(properties.get("UID"))
                .summary(summary == null || summary.isBlank() ? "Untitled Event" : unescape(summary))
                .location(unescapeOrNull(properties.get("LOCATION")))
                .status(properties.get("STATUS"));

        String dtEnd = properties.get("DTEND");
        String startValue = dtStart.trim();

        if (DATE_ONLY.matcher(startValue).matches()) {
            LocalDate firstDay = LocalDate.parse(startValue, DATE_FORMAT);
            LocalDate lastDay = firstDay;
            if (dtEnd != null && !dtEnd.isBlank()) {
                lastDay = parseDateTime(dtEnd).toLocalDate();
                // A DTEND one day after DTSTART is the usual single-day form
                if (lastDay.equals(firstDay.plusDays(1))) {
                    lastDay = firstDay;
                }
            }
            AllDaySpan span = AllDaySpan.of(firstDay, lastDay);
            return builder.start(span.getStart()).end(span.getEnd()).allDay(true).build();
        }

        LocalDateTime start = parseDateTime(startValue);
        LocalDateTime end = dtEnd == null || dtEnd.isBlank() ? start.plusHours(1) : parseDateTime(dtEnd);
        return builder.start(start).end(end).allDay(false).build();
    }

    /**
     * Reads {@code YYYYMMDD}, {@code YYYYMMDDTHHMMSS} or the same with a trailing {@code Z}
     * (UTC, converted into the scan zone).
     */
    LocalDateTime parseDateTime(String value) {
        String text = value.trim();
        if (DATE_ONLY.matcher(text).matches()) {
            return LocalDate.parse(text, DATE_FORMAT).atStartOfDay();
        }
        if (!DATE_TIME.matcher(text).matches()) {
            throw new DateTimeException("Unsupported date value: " + value);
        }
        if (text.endsWith("Z")) {
            LocalDateTime utc = LocalDateTime.parse(text.substring(0, text.length() - 1), DATE_TIME_FORMAT);
            return utc.atOffset(ZoneOffset.UTC).atZoneSameInstant(clock.getZone()).toLocalDateTime();
        }
        return LocalDateTime.parse(text, DATE_TIME_FORMAT);
    }

    /**
     * Single pass over the text so that an escaped backslash is never re-read as an escape.
     */
    static String unescape(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                switch (next) {
                    case 'n', 'N' -> {
                        out.append('\n');
                        i++;
                        continue;
                    }
                    case ',', ';', '\\' -> {
                        out.append(next);
                        i++;
                        continue;
                    }
                    default -> {
                    }
                }
            }
            out.append(c);
        }
        return out.toString();
    }

    private static String unescapeOrNull(String text) {
        return text == null ? null : unescape(text);
    }
}
