package com.unifiedcalendar.backend.classifier;

import java.time.LocalDate;
import java.time.LocalTime;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DateTimeExtractorTest {

    private final DateTimeExtractor extractor = new DateTimeExtractor(2026, LocalDate.of(2026, 1, 5));

    @Test
    void month_day_with_time() {
        var result = extractor.extract("Interview on January 8 at 10:30am");

        assertThat(result.getDate()).isEqualTo(LocalDate.of(2026, 1, 8));
        assertThat(result.getDateSpan()).isEqualTo("January 8");
        assertThat(result.getTime()).isEqualTo(LocalTime.of(10, 30));
        assertThat(result.getTimeSpan()).isEqualTo("10:30am");
        assertThat(result.isFabricatedTime()).isFalse();
        assertThat(result.getDurationMinutes()).isNull();
    }

    @Test
    void day_month_with_explicit_year() {
        var result = extractor.extract("Board review 3rd of March 2027, 2pm");

        assertThat(result.getDate()).isEqualTo(LocalDate.of(2027, 3, 3));
        assertThat(result.getTime()).isEqualTo(LocalTime.of(14, 0));
    }

    @Test
    void month_range_gives_end_date() {
        var result = extractor.extract("Offsite Jan 8 - 11");

        assertThat(result.getDate()).isEqualTo(LocalDate.of(2026, 1, 8));
        assertThat(result.getEndDate()).isEqualTo(LocalDate.of(2026, 1, 11));
        assertThat(result.getTime()).isNull();
    }

    @Test
    void day_range_before_month() {
        var result = extractor.extract("Conference 8-11 January");

        assertThat(result.getDate()).isEqualTo(LocalDate.of(2026, 1, 8));
        assertThat(result.getEndDate()).isEqualTo(LocalDate.of(2026, 1, 11));
    }

    @Test
    void range_crossing_new_year_ends_next_year() {
        var december = new DateTimeExtractor(2026, LocalDate.of(2026, 12, 1));

        var result = december.extract("Holiday Dec 30 - Jan 2");

        assertThat(result.getDate()).isEqualTo(LocalDate.of(2026, 12, 30));
        assertThat(result.getEndDate()).isEqualTo(LocalDate.of(2027, 1, 2));
    }

    @Test
    void date_before_reference_rolls_to_next_year() {
        var december = new DateTimeExtractor(2026, LocalDate.of(2026, 12, 20));

        var result = december.extract("Kickoff on January 8");

        assertThat(result.getDate()).isEqualTo(LocalDate.of(2027, 1, 8));
    }

    @Test
    void time_range_gives_duration() {
        var result = extractor.extract("Workshop January 9, 10:00 - 11:30");

        assertThat(result.getTime()).isEqualTo(LocalTime.of(10, 0));
        assertThat(result.getDurationMinutes()).isEqualTo(90);
    }

    @Test
    void start_of_range_borrows_meridiem_from_end() {
        var result = extractor.extract("Lunch 11-1pm on March 3");

        assertThat(result.getTime()).isEqualTo(LocalTime.of(11, 0));
        assertThat(result.getDurationMinutes()).isEqualTo(120);
    }

    @Test
    void odd_minute_marks_time_as_fabricated() {
        var result = extractor.extract("Call on January 8 at 10:32");

        assertThat(result.getTime()).isEqualTo(LocalTime.of(10, 32));
        assertThat(result.isFabricatedTime()).isTrue();
    }

    @Test
    void later_dates_are_kept_as_alternatives() {
        var result = extractor.extract("Meeting on January 8\nOriginally planned for January 12, now confirmed");

        assertThat(result.getDate()).isEqualTo(LocalDate.of(2026, 1, 8));
        assertThat(result.getAlternatives())
                .extracting(ExtractedDateTime.DateCandidate::getSpan)
                .containsExactly("January 12");
    }

    @Test
    void impossible_date_is_ignored() {
        var result = extractor.extract("Party on February 30");

        assertThat(result.hasDate()).isFalse();
    }

    @Test
    void text_without_dates_has_no_date() {
        var result = extractor.extract("Let's catch up sometime soon");

        assertThat(result.hasDate()).isFalse();
        assertThat(result.getTime()).isNull();
    }
}
