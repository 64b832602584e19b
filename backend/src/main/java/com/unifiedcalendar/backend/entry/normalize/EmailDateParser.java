package com.unifiedcalendar.backend.entry.normalize;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Reads the timestamp text shown in a mail list row ("3:45 PM", "Yesterday",
 * "Jan 25", "9/20/22") relative to the scan clock.
 */
@Component
public class EmailDateParser {

    private static final Pattern TIME_ONLY = Pattern.compile("^(\\d{1,2}):(\\d{2})\\s*(AM|PM)?$",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern MONTH_DAY = Pattern.compile(
            "^(Jan|Feb|Mar|Apr|May|Jun|Jul|Aug|Sep|Oct|Nov|Dec)[a-z]*\\.?\\s+(\\d{1,2})$", Pattern.CASE_INSENSITIVE);
    private static final Pattern NUMERIC_DATE = Pattern.compile("^(\\d{1,2})/(\\d{1,2})/(\\d{2}|\\d{4})$");

    private static final String[] MONTHS = {
            "jan", "feb", "mar", "apr", "may", "jun", "jul", "aug", "sep", "oct", "nov", "dec"
    };

    private final Clock clock;

    public EmailDateParser(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return the parsed instant in the clock's zone, or null when the text is not a known form
     */
    public LocalDateTime parse(String timestampText) {
        if (timestampText == null || timestampText.isBlank()) {
            return null;
        }
        String text = timestampText.trim();
        LocalDateTime now = LocalDateTime.now(clock);

        try {
            Matcher time = TIME_ONLY.matcher(text);
            if (time.matches()) {
                int hours = Integer.parseInt(time.group(1));
                int minutes = Integer.parseInt(time.group(2));
                String ampm = time.group(3);
                if (ampm != null) {
                    if (hours < 1 || hours > 12) {
                        return null;
                    }
                    hours = hours % 12 + (ampm.equalsIgnoreCase("PM") ? 12 : 0);
                }
                return now.toLocalDate().atTime(LocalTime.of(hours, minutes));
            }

            String lower = text.toLowerCase(Locale.ROOT);
            if (lower.equals("today")) {
                return now;
            }
            if (lower.equals("yesterday")) {
                return now.minusDays(1);
            }

            Matcher monthDay = MONTH_DAY.matcher(text);
            if (monthDay.matches()) {
                int month = monthIndex(monthDay.group(1)) + 1;
                int day = Integer.parseInt(monthDay.group(2));
                LocalDate date = LocalDate.of(now.getYear(), month, day);
                // A future month-day belongs to last year
                if (date.isAfter(now.toLocalDate())) {
                    date = date.minusYears(1);
                }
                return date.atStartOfDay();
            }

            Matcher numeric = NUMERIC_DATE.matcher(text);
            if (numeric.matches()) {
                int month = Integer.parseInt(numeric.group(1));
                int day = Integer.parseInt(numeric.group(2));
                int year = Integer.parseInt(numeric.group(3));
                if (year < 100) {
                    year += year > 50 ? 1900 : 2000;
                }
                return LocalDate.of(year, month, day).atStartOfDay();
            }
        } catch (DateTimeException e) {
            return null;
        }
        return null;
    }

    /**
     * Start of the day {@code lookbackDays} before today; older emails are ignored.
     */
    public LocalDateTime lookbackCutoff(int lookbackDays) {
        return LocalDate.now(clock).minusDays(lookbackDays).atStartOfDay();
    }

    private static int monthIndex(String token) {
        String prefix = token.substring(0, 3).toLowerCase(Locale.ROOT);
        for (int i = 0; i < MONTHS.length; i++) {
            if (MONTHS[i].equals(prefix)) {
                return i;
            }
        }
        throw new DateTimeException("Unknown month " + token);
    }
}
