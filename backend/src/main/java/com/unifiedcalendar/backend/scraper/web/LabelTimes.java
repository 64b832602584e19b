package com.unifiedcalendar.backend.scraper.web;

import java.time.LocalTime;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Clock times as calendar pages print them: "14:30", "2:30 PM", "2pm".
 */
final class LabelTimes {

    static final String TIME = "\\d{1,2}(?::\\d{2})?\\s*(?:[AaPp]\\.?[Mm]\\.?)?";

    private static final Pattern PARTS = Pattern.compile("(\\d{1,2})(?::(\\d{2}))?\\s*([AaPp])?\\.?(?:[Mm]\\.?)?");

    private LabelTimes() {
    }

    /**
     * @return the time, or null if the text is not a valid clock time
     */
    static LocalTime parse(String text) {
        Matcher m = PARTS.matcher(text.trim());
        if (!m.matches()) {
            return null;
        }
        int hours = Integer.parseInt(m.group(1));
        int minutes = m.group(2) == null ? 0 : Integer.parseInt(m.group(2));
        String meridiem = m.group(3);
        if (minutes > 59) {
            return null;
        }
        if (meridiem != null) {
            if (hours < 1 || hours > 12) {
                return null;
            }
            hours = hours % 12 + (meridiem.toLowerCase(Locale.ROOT).equals("p") ? 12 : 0);
        } else if (hours > 23) {
            return null;
        }
        return LocalTime.of(hours, minutes);
    }
}
