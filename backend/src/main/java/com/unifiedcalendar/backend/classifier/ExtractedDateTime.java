package com.unifiedcalendar.backend.classifier;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

/**
 * Date and time literally present in an email, with the spans they were read from.
 */
@Value
@Builder(toBuilder = true)
public class ExtractedDateTime {

    LocalDate date;
    LocalDate endDate;
    LocalTime time;
    Integer durationMinutes;
    String dateSpan;
    String timeSpan;

    /** A clock time whose minutes are not on a five minute boundary. */
    boolean fabricatedTime;

    /** Other single dates found in the text, in order of appearance. */
    @Singular
    List<DateCandidate> alternatives;

    public boolean hasDate() {
        return date != null;
    }

    @Value
    public static class DateCandidate {
        String span;
        LocalDate date;
    }
}
