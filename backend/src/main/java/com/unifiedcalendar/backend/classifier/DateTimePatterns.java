package com.unifiedcalendar.backend.classifier;

import java.time.LocalTime;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Literal date and time forms accepted from email text. Anything these
 * patterns do not match is never placed on the calendar.
 */
final class DateTimePatterns {

    private static final String MONTH =
            "(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
                    + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)\\.?";
    private static final String DAY = "(\\d{1,2})(?:st|nd|rd|th)?";
    private static final String YEAR = "(?:,?\\s+(\\d{4}))?";
    private static final String DATE_RANGE_SEP = "\\s*(?:-|–|—|to|through|until|till)\\s*";
    // A range end followed by ":" or am/pm is a clock time, not a day
    private static final String NOT_A_TIME = "(?!\\s*(?::|[ap]\\.?m\\b))";

    private static final String AMPM = "(?:\\s*([ap])\\.?m\\b\\.?)?";

    /** "January 8", "Jan 8th, 2026" */
    static final Pattern MONTH_DAY = Pattern.compile(
            "\\b" + MONTH + "\\s+" + DAY + NOT_A_TIME + YEAR + "\\b", Pattern.CASE_INSENSITIVE);

    /** "8 January", "8th of Jan 2026" */
    static final Pattern DAY_MONTH = Pattern.compile(
            "\\b" + DAY + "\\s+(?:of\\s+)?" + MONTH + YEAR + "\\b", Pattern.CASE_INSENSITIVE);

    /** "Jan 8 - 11", "January 8 to January 11, 2026" */
    static final Pattern MONTH_DAY_RANGE = Pattern.compile(
            "\\b" + MONTH + "\\s+" + DAY + DATE_RANGE_SEP + "(?:" + MONTH + "\\s+)?" + DAY + NOT_A_TIME + YEAR + "\\b",
            Pattern.CASE_INSENSITIVE);

    /** "8 Jan - 11 Jan 2026" */
    static final Pattern DAY_MONTH_PAIR_RANGE = Pattern.compile(
            "\\b" + DAY + "\\s+" + MONTH + DATE_RANGE_SEP + DAY + "\\s+" + MONTH + YEAR + "\\b",
            Pattern.CASE_INSENSITIVE);

    /** "8-11 January" */
    static final Pattern DAY_MONTH_RANGE = Pattern.compile(
            "\\b" + DAY + DATE_RANGE_SEP + DAY + "\\s+(?:of\\s+)?" + MONTH + YEAR + "\\b",
            Pattern.CASE_INSENSITIVE);

    /** "10:30", "10:30am", "10:30 p.m." */
    static final Pattern TIME_HM = Pattern.compile(
            "\\b(\\d{1,2}):(\\d{2})(?!\\d)" + AMPM, Pattern.CASE_INSENSITIVE);

    /** "10am", "3 pm" */
    static final Pattern TIME_H = Pattern.compile(
            "\\b(\\d{1,2})\\s*([ap])\\.?m\\b\\.?", Pattern.CASE_INSENSITIVE);

    /** "10:00 - 11:30", "10-11am", "2pm to 3:30pm" */
    static final Pattern TIME_RANGE = Pattern.compile(
            "\\b(\\d{1,2})(?::(\\d{2}))?(?!\\d)" + AMPM
                    + "\\s*(?:-|–|—|to|until|till)\\s*"
                    + "(\\d{1,2})(?::(\\d{2}))?(?!\\d)" + AMPM,
            Pattern.CASE_INSENSITIVE);

    private DateTimePatterns() {
    }

    static boolean containsDate(String text) {
        return text != null && (MONTH_DAY.matcher(text).find() || DAY_MONTH.matcher(text).find());
    }

    static boolean containsTime(String text) {
        return text != null && (TIME_HM.matcher(text).find() || TIME_H.matcher(text).find());
    }

    /**
     * @return month number 1-12 for a matched month token
     */
    static int monthNumber(String token) {
        String prefix = token.toLowerCase(Locale.ROOT).substring(0, 3);
        return switch (prefix) {
            case "jan" -> 1;
            case "feb" -> 2;
            case "mar" -> 3;
            case "apr" -> 4;
            case "may" -> 5;
            case "jun" -> 6;
            case "jul" -> 7;
            case "aug" -> 8;
            case "sep" -> 9;
            case "oct" -> 10;
            case "nov" -> 11;
            case "dec" -> 12;
            default -> throw new IllegalArgumentException("Not a month: " + token);
        };
    }

    /**
     * Builds a clock time from matched groups, or null if the values are out of range.
     *
     * @param ampm "a", "p" or null for a 24-hour value
     */
    static LocalTime toTime(int hour, int minute, String ampm) {
        if (minute < 0 || minute > 59) {
            return null;
        }
        if (ampm == null) {
            return hour >= 0 && hour <= 23 ? LocalTime.of(hour, minute) : null;
        }
        if (hour < 1 || hour > 12) {
            return null;
        }
        boolean pm = ampm.equalsIgnoreCase("p");
        int h24 = hour % 12 + (pm ? 12 : 0);
        return LocalTime.of(h24, minute);
    }
}
