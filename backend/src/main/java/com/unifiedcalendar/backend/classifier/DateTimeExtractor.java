package com.unifiedcalendar.backend.classifier;

import com.unifiedcalendar.backend.classifier.ExtractedDateTime.DateCandidate;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;

/**
 * Pulls the first literal date (or date range) and clock time out of free text.
 * Dates without a year take the current year and roll forward one year when
 * that would place them before the email was sent.
 */
public class DateTimeExtractor {

    private final int currentYear;
    private final LocalDate referenceDate;

    /**
     * @param currentYear   year assumed when the text names none
     * @param referenceDate date the email was sent; null disables the roll-forward
     */
    public DateTimeExtractor(int currentYear, LocalDate referenceDate) {
        this.currentYear = currentYear;
        this.referenceDate = referenceDate;
    }

    public ExtractedDateTime extract(String text) {
        ExtractedDateTime.ExtractedDateTimeBuilder builder = ExtractedDateTime.builder();
        if (text == null || text.isBlank()) {
            return builder.build();
        }

        if (!extractDateRange(text, builder)) {
            extractSingleDates(text, builder);
        }
        extractTime(text, builder);
        return builder.build();
    }

    private boolean extractDateRange(String text, ExtractedDateTime.ExtractedDateTimeBuilder builder) {
        Matcher m = DateTimePatterns.MONTH_DAY_RANGE.matcher(text);
        while (m.find()) {
            String endMonth = m.group(3) != null ? m.group(3) : m.group(1);
            if (applyRange(builder, m.group(), m.group(1), m.group(2), endMonth, m.group(4), m.group(5))) {
                return true;
            }
        }

        m = DateTimePatterns.DAY_MONTH_PAIR_RANGE.matcher(text);
        while (m.find()) {
            if (applyRange(builder, m.group(), m.group(2), m.group(1), m.group(4), m.group(3), m.group(5))) {
                return true;
            }
        }

        m = DateTimePatterns.DAY_MONTH_RANGE.matcher(text);
        while (m.find()) {
            if (applyRange(builder, m.group(), m.group(3), m.group(1), m.group(3), m.group(2), m.group(4))) {
                return true;
            }
        }
        return false;
    }

    private boolean applyRange(ExtractedDateTime.ExtractedDateTimeBuilder builder, String span,
                               String startMonth, String startDay, String endMonth, String endDay, String year) {
        LocalDate start = resolve(startMonth, startDay, year);
        if (start == null) {
            return false;
        }
        LocalDate end;
        try {
            end = LocalDate.of(start.getYear(), DateTimePatterns.monthNumber(endMonth), Integer.parseInt(endDay));
        } catch (DateTimeException e) {
            return false;
        }
        if (end.isBefore(start)) {
            end = end.plusYears(1);
        }
        builder.date(start).dateSpan(span.trim());
        if (!end.equals(start)) {
            builder.endDate(end);
        }
        return true;
    }

    private void extractSingleDates(String text, ExtractedDateTime.ExtractedDateTimeBuilder builder) {
        // position -> candidate, so both forms interleave in reading order
        Map<Integer, DateCandidate> byPosition = new TreeMap<>();

        Matcher m = DateTimePatterns.MONTH_DAY.matcher(text);
        while (m.find()) {
            LocalDate date = resolve(m.group(1), m.group(2), m.group(3));
            if (date != null) {
                byPosition.put(m.start(), new DateCandidate(m.group().trim(), date));
            }
        }
        m = DateTimePatterns.DAY_MONTH.matcher(text);
        while (m.find()) {
            LocalDate date = resolve(m.group(2), m.group(1), m.group(3));
            if (date != null) {
                byPosition.putIfAbsent(m.start(), new DateCandidate(m.group().trim(), date));
            }
        }
        if (byPosition.isEmpty()) {
            return;
        }

        Map<LocalDate, DateCandidate> distinct = new LinkedHashMap<>();
        for (DateCandidate candidate : byPosition.values()) {
            distinct.putIfAbsent(candidate.getDate(), candidate);
        }
        List<DateCandidate> ordered = new ArrayList<>(distinct.values());
        DateCandidate first = ordered.get(0);
        builder.date(first.getDate()).dateSpan(first.getSpan());
        for (int i = 1; i < ordered.size(); i++) {
            builder.alternative(ordered.get(i));
        }
    }

    private void extractTime(String text, ExtractedDateTime.ExtractedDateTimeBuilder builder) {
        Matcher range = DateTimePatterns.TIME_RANGE.matcher(text);
        while (range.find()) {
            boolean hasColon = range.group(2) != null || range.group(5) != null;
            boolean hasMeridiem = range.group(3) != null || range.group(6) != null;
            if (!hasColon && !hasMeridiem) {
                continue;
            }
            int startMinute = minuteOf(range.group(2));
            int endMinute = minuteOf(range.group(5));
            String endAmPm = range.group(6);
            String startAmPm = range.group(3) != null ? range.group(3) : endAmPm;

            LocalTime end = DateTimePatterns.toTime(Integer.parseInt(range.group(4)), endMinute, endAmPm);
            LocalTime start = DateTimePatterns.toTime(Integer.parseInt(range.group(1)), startMinute, startAmPm);
            if (start != null && end != null && range.group(3) == null && start.isAfter(end) && "p".equalsIgnoreCase(endAmPm)) {
                // "11-1pm" starts in the morning
                start = DateTimePatterns.toTime(Integer.parseInt(range.group(1)), startMinute, "a");
            }
            if (start == null || end == null) {
                continue;
            }
            builder.time(start).timeSpan(range.group().trim());
            if (startMinute % 5 != 0 || endMinute % 5 != 0) {
                builder.fabricatedTime(true);
            }
            long minutes = Duration.between(start, end).toMinutes();
            if (minutes > 0) {
                builder.durationMinutes((int) minutes);
            }
            return;
        }

        Matcher hm = DateTimePatterns.TIME_HM.matcher(text);
        Matcher h = DateTimePatterns.TIME_H.matcher(text);
        int hmStart = -1;
        LocalTime hmTime = null;
        int hmMinute = 0;
        String hmSpan = null;
        while (hm.find()) {
            int minute = Integer.parseInt(hm.group(2));
            LocalTime t = DateTimePatterns.toTime(Integer.parseInt(hm.group(1)), minute, hm.group(3));
            if (t != null) {
                hmStart = hm.start();
                hmTime = t;
                hmMinute = minute;
                hmSpan = hm.group().trim();
                break;
            }
        }
        int hStart = -1;
        LocalTime hTime = null;
        String hSpan = null;
        while (h.find()) {
            LocalTime t = DateTimePatterns.toTime(Integer.parseInt(h.group(1)), 0, h.group(2));
            if (t != null) {
                hStart = h.start();
                hTime = t;
                hSpan = h.group().trim();
                break;
            }
        }

        if (hmTime != null && (hTime == null || hmStart <= hStart)) {
            builder.time(hmTime).timeSpan(hmSpan);
            if (hmMinute % 5 != 0) {
                builder.fabricatedTime(true);
            }
        } else if (hTime != null) {
            builder.time(hTime).timeSpan(hSpan);
        }
    }

    private LocalDate resolve(String month, String day, String year) {
        try {
            int monthNumber = DateTimePatterns.monthNumber(month);
            int dayNumber = Integer.parseInt(day);
            if (year != null) {
                return LocalDate.of(Integer.parseInt(year), monthNumber, dayNumber);
            }
            LocalDate date = LocalDate.of(currentYear, monthNumber, dayNumber);
            if (referenceDate != null && date.isBefore(referenceDate)) {
                date = date.plusYears(1);
            }
            return date;
        } catch (DateTimeException e) {
            return null;
        }
    }

    private static int minuteOf(String group) {
        return group == null ? 0 : Integer.parseInt(group);
    }
}
