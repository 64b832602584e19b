package com.unifiedcalendar.backend.entry.normalize;

import com.unifiedcalendar.backend.classifier.ClassificationTier;
import com.unifiedcalendar.backend.classifier.Confidence;
import com.unifiedcalendar.backend.classifier.MeetingClassification;
import com.unifiedcalendar.backend.entry.entity.CalendarSource;
import com.unifiedcalendar.backend.entry.entity.EmailSource;
import com.unifiedcalendar.backend.entry.entity.EntryStatus;
import com.unifiedcalendar.backend.entry.entity.SourceKind;
import com.unifiedcalendar.backend.feed.IcsEvent;
import com.unifiedcalendar.backend.scraper.RawCalendarEvent;
import com.unifiedcalendar.backend.scraper.RawEmail;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntryNormalizerTest {

    private final EntryNormalizer normalizer = new EntryNormalizer();

    private static MeetingClassification.MeetingClassificationBuilder meeting() {
        return MeetingClassification.builder()
                .meeting(true)
                .title("Design review")
                .date(LocalDate.of(2026, 1, 8))
                .confidence(Confidence.HIGH)
                .tier(ClassificationTier.HEURISTIC)
                .score(6)
                .signals(List.of("scheduling:meeting"))
                .dateSpan("January 8");
    }

    private static RawEmail email(String id) {
        return RawEmail.builder()
                .id(id)
                .threadId("thread-" + id)
                .subject("Design review January 8 10am")
                .from("pat@example.com")
                .timestampText("9:15 AM")
                .snippet("Room 2")
                .build();
    }

    @Test
    void feed_event_is_confirmed_and_keyed_by_uid() {
        var event = IcsEvent.builder()
                .uid("uid-1@example.com")
                .summary("Planning")
                .location("Room 1")
                .start(LocalDateTime.of(2026, 1, 10, 9, 0))
                .end(LocalDateTime.of(2026, 1, 10, 10, 0))
                .build();

        var entry = normalizer.fromFeedEvent("account-1", "Work", event);
        event.setSummary("Planning v2");
        var renamed = normalizer.fromFeedEvent("account-1", "Work", event);

        assertThat(entry.getStatus()).isEqualTo(EntryStatus.CONFIRMED);
        assertThat(entry.getSourceKind()).isEqualTo(SourceKind.CALENDAR);
        assertThat(entry.getId()).isEqualTo(EntryIdentity.entryId("account-1", SourceKind.CALENDAR, "uid-1@example.com"));
        assertThat(renamed.getId()).isEqualTo(entry.getId());
        assertThat(renamed.getTitle()).isEqualTo("Planning v2");
        assertThat(((CalendarSource) entry.getSource()).getExternalEventId()).isEqualTo("uid-1@example.com");
    }

    @Test
    void same_event_in_another_account_gets_another_id() {
        var event = IcsEvent.builder()
                .uid("shared")
                .summary("All hands")
                .start(LocalDateTime.of(2026, 1, 10, 9, 0))
                .end(LocalDateTime.of(2026, 1, 10, 10, 0))
                .build();

        var first = normalizer.fromFeedEvent("account-1", "Work", event);
        var second = normalizer.fromFeedEvent("account-2", "Work", event);

        assertThat(first.getId()).isNotEqualTo(second.getId());
    }

    @Test
    void scraped_all_day_event_is_widened_to_whole_days() {
        var raw = RawCalendarEvent.builder()
                .title("Conference")
                .start(LocalDateTime.of(2026, 1, 8, 0, 0))
                .end(LocalDateTime.of(2026, 1, 9, 0, 0))
                .allDay(true)
                .rsvpState("accepted")
                .build();

        var entry = normalizer.fromScrapedEvent("account-1", "Google Calendar", raw);

        assertThat(entry.getAllDay()).isTrue();
        assertThat(entry.getStartTime()).isEqualTo(LocalDateTime.of(2026, 1, 8, 0, 0));
        assertThat(entry.getEndTime()).isEqualTo(LocalDateTime.of(2026, 1, 9, 23, 59, 59));
        assertThat(entry.getId()).isEqualTo(EntryIdentity.entryId("account-1", SourceKind.CALENDAR,
                EntryIdentity.titleAndStart("Conference", LocalDateTime.of(2026, 1, 8, 0, 0))));
        assertThat(((CalendarSource) entry.getSource()).getRsvpState()).isEqualTo("accepted");
    }

    @Test
    void scraped_event_ending_before_start_is_malformed() {
        var raw = RawCalendarEvent.builder()
                .title("Broken")
                .start(LocalDateTime.of(2026, 1, 8, 10, 0))
                .end(LocalDateTime.of(2026, 1, 8, 9, 0))
                .build();

        assertThatThrownBy(() -> normalizer.fromScrapedEvent("account-1", "Google Calendar", raw))
                .isInstanceOf(MalformedCandidateException.class);
    }

    @Test
    void scraped_event_without_title_is_malformed() {
        var raw = RawCalendarEvent.builder().start(LocalDateTime.of(2026, 1, 8, 10, 0)).build();

        assertThatThrownBy(() -> normalizer.fromScrapedEvent("account-1", "Google Calendar", raw))
                .isInstanceOf(MalformedCandidateException.class);
    }

    @Test
    void timed_email_meeting_becomes_tentative_entry_with_evidence() {
        var classification = meeting().time(LocalTime.of(10, 0)).durationMinutes(45).timeSpan("10am").build();
        var sent = LocalDateTime.of(2026, 1, 5, 9, 15);

        var entry = normalizer.fromEmail("account-1", email("m-1"), sent, classification);

        assertThat(entry.getStatus()).isEqualTo(EntryStatus.TENTATIVE);
        assertThat(entry.getSourceKind()).isEqualTo(SourceKind.EMAIL);
        assertThat(entry.getAllDay()).isFalse();
        assertThat(entry.getStartTime()).isEqualTo(LocalDateTime.of(2026, 1, 8, 10, 0));
        assertThat(entry.getEndTime()).isEqualTo(LocalDateTime.of(2026, 1, 8, 10, 45));
        assertThat(entry.getId()).isEqualTo(EntryIdentity.entryId("account-1", SourceKind.EMAIL, "m-1"));

        var source = (EmailSource) entry.getSource();
        assertThat(source.getEmailTime()).isEqualTo(sent);
        assertThat(source.getClassifierEvidence().getDateSpan()).isEqualTo("January 8");
        assertThat(source.getClassifierEvidence().getTimeSpan()).isEqualTo("10am");
        assertThat(source.getClassifierEvidence().getScore()).isEqualTo(6);
    }

    @Test
    void multi_day_email_meeting_is_all_day() {
        var classification = meeting().endDate(LocalDate.of(2026, 1, 11)).time(LocalTime.of(9, 0)).build();

        var entry = normalizer.fromEmail("account-1", email("m-2"), LocalDateTime.of(2026, 1, 5, 9, 0), classification);

        assertThat(entry.getAllDay()).isTrue();
        assertThat(entry.getStartTime()).isEqualTo(LocalDateTime.of(2026, 1, 8, 0, 0));
        assertThat(entry.getEndTime()).isEqualTo(LocalDateTime.of(2026, 1, 11, 23, 59, 59));
    }

    @Test
    void rejected_classification_cannot_be_normalized() {
        var rejected = MeetingClassification.rejected(1, List.of(), "score 1 below threshold");

        assertThatThrownBy(() -> normalizer.fromEmail("account-1", email("m-3"), null, rejected))
                .isInstanceOf(MalformedCandidateException.class);
    }

    @Test
    void email_key_falls_back_to_thread_then_subject() {
        var sent = LocalDateTime.of(2026, 1, 5, 9, 0);
        var threadOnly = RawEmail.builder().threadId("t-9").subject("Lunch").build();
        var bare = RawEmail.builder().subject("Lunch").from("a@example.com").build();

        assertThat(EntryNormalizer.emailNaturalKey(threadOnly, sent)).isEqualTo("t-9");
        assertThat(EntryNormalizer.emailNaturalKey(bare, sent)).isEqualTo("Lunch|a@example.com|2026-01-05T09:00");
    }

    @Test
    void feed_status_is_kept_on_the_source() {
        var event = IcsEvent.builder()
                .uid("offsite")
                .summary("Offsite")
                .status("TENTATIVE")
                .start(LocalDateTime.of(2026, 1, 12, 9, 0))
                .end(LocalDateTime.of(2026, 1, 12, 17, 0))
                .build();

        var entry = normalizer.fromFeedEvent("account-1", "Work", event);

        assertThat(((CalendarSource) entry.getSource()).getRsvpState()).isEqualTo("tentative");
        assertThat(entry.getStatus()).isEqualTo(EntryStatus.CONFIRMED);
    }
}
