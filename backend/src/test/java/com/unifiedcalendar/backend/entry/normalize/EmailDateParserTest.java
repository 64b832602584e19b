package com.unifiedcalendar.backend.entry.normalize;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EmailDateParserTest {

    // Wednesday 14 January 2026, 15:00 local
    private final EmailDateParser parser =
            new EmailDateParser(Clock.fixed(Instant.parse("2026-01-14T15:00:00Z"), ZoneId.of("UTC")));

    @Test
    void time_only_means_today() {
        assertThat(parser.parse("3:45 PM")).isEqualTo(LocalDateTime.of(2026, 1, 14, 15, 45));
        assertThat(parser.parse("12:10 am")).isEqualTo(LocalDateTime.of(2026, 1, 14, 0, 10));
        assertThat(parser.parse("09:30")).isEqualTo(LocalDateTime.of(2026, 1, 14, 9, 30));
    }

    @Test
    void relative_words() {
        assertThat(parser.parse("Yesterday")).isEqualTo(LocalDateTime.of(2026, 1, 13, 15, 0));
        assertThat(parser.parse("today")).isEqualTo(LocalDateTime.of(2026, 1, 14, 15, 0));
    }

    @Test
    void month_day_is_the_most_recent_past_occurrence() {
        assertThat(parser.parse("Jan 10")).isEqualTo(LocalDateTime.of(2026, 1, 10, 0, 0));
        assertThat(parser.parse("Dec 25")).isEqualTo(LocalDateTime.of(2025, 12, 25, 0, 0));
    }

    @Test
    void numeric_dates_with_short_and_long_years() {
        assertThat(parser.parse("9/20/22")).isEqualTo(LocalDateTime.of(2022, 9, 20, 0, 0));
        assertThat(parser.parse("9/20/99")).isEqualTo(LocalDateTime.of(1999, 9, 20, 0, 0));
        assertThat(parser.parse("9/20/2022")).isEqualTo(LocalDateTime.of(2022, 9, 20, 0, 0));
    }

    @Test
    void unknown_or_impossible_text_is_null() {
        assertThat(parser.parse("sometime")).isNull();
        assertThat(parser.parse("13:45 PM")).isNull();
        assertThat(parser.parse("2/31/22")).isNull();
        assertThat(parser.parse("  ")).isNull();
    }

    @Test
    void lookback_cutoff_is_start_of_day() {
        assertThat(parser.lookbackCutoff(14)).isEqualTo(LocalDateTime.of(2025, 12, 31, 0, 0));
    }
}
