package com.unifiedcalendar.backend.entry;

import com.unifiedcalendar.backend.classifier.ClassificationTier;
import com.unifiedcalendar.backend.classifier.Confidence;
import com.unifiedcalendar.backend.entry.entity.CalendarEntry;
import com.unifiedcalendar.backend.entry.entity.CalendarSource;
import com.unifiedcalendar.backend.entry.entity.ClassifierEvidence;
import com.unifiedcalendar.backend.entry.entity.EmailSource;
import com.unifiedcalendar.backend.entry.entity.EntrySource;
import com.unifiedcalendar.backend.entry.entity.EntryStatus;
import com.unifiedcalendar.backend.entry.entity.SourceKind;
import com.unifiedcalendar.backend.entry.normalize.EntryIdentity;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class CalendarEntryRepositoryTest {

    @Autowired
    private CalendarEntryRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    private static CalendarEntry entry(String accountId, String key, String start, EntrySource source) {
        LocalDateTime begin = LocalDateTime.parse(start);
        return CalendarEntry.builder()
                .id(EntryIdentity.entryId(accountId, source.getKind(), key))
                .accountId(accountId)
                .title(key)
                .startTime(begin)
                .endTime(begin.plusHours(1))
                .status(source.getKind() == SourceKind.EMAIL ? EntryStatus.TENTATIVE : EntryStatus.CONFIRMED)
                .source(source)
                .build();
    }

    private static CalendarSource calendar() {
        return CalendarSource.builder().feedName("Work").location("Room 4").rsvpState("accepted").build();
    }

    private static EmailSource email() {
        return EmailSource.builder()
                .subject("Interview with Dana")
                .snippet("Zoom link inside")
                .threadId("t-1")
                .emailTime(LocalDateTime.parse("2026-01-05T08:40"))
                .classifierEvidence(ClassifierEvidence.builder()
                        .tier(ClassificationTier.HEURISTIC)
                        .confidence(Confidence.HIGH)
                        .score(7)
                        .signals(List.of("scheduling:interview", "with-person"))
                        .dateSpan("January 8")
                        .timeSpan("10:30am")
                        .build())
                .build();
    }

    @Test
    void source_variant_survives_a_round_trip_through_the_database() {
        var saved = repository.save(entry("account-1", "interview", "2026-01-08T10:30", email()));
        entityManager.flush();
        entityManager.clear();

        var loaded = repository.findById(saved.getId()).orElseThrow();

        assertThat(loaded.getSourceKind()).isEqualTo(SourceKind.EMAIL);
        assertThat(loaded.getSource()).isInstanceOf(EmailSource.class);
        var source = (EmailSource) loaded.getSource();
        assertThat(source.getClassifierEvidence().getTimeSpan()).isEqualTo("10:30am");
        assertThat(source.getEmailTime()).isEqualTo(LocalDateTime.parse("2026-01-05T08:40"));
    }

    @Test
    void saving_the_same_identity_overwrites() {
        repository.save(entry("account-1", "standup", "2026-01-08T10:00", calendar()));
        var again = entry("account-1", "standup", "2026-01-08T10:00", calendar());
        again.setTitle("Standup (moved room)");
        repository.save(again);
        entityManager.flush();

        assertThat(repository.count()).isEqualTo(1);
        assertThat(repository.findAll().get(0).getTitle()).isEqualTo("Standup (moved room)");
    }

    @Test
    void delete_by_account_and_kind_leaves_other_rows() {
        repository.save(entry("account-1", "standup", "2026-01-08T10:00", calendar()));
        repository.save(entry("account-1", "interview", "2026-01-08T10:30", email()));
        repository.save(entry("account-2", "standup", "2026-01-08T10:00", calendar()));
        entityManager.flush();

        long deleted = repository.deleteByAccountIdAndSourceKind("account-1", SourceKind.CALENDAR);

        assertThat(deleted).isEqualTo(1);
        assertThat(repository.countByAccountIdAndSourceKind("account-1", SourceKind.EMAIL)).isEqualTo(1);
        assertThat(repository.countByAccountIdAndSourceKind("account-2", SourceKind.CALENDAR)).isEqualTo(1);
    }

    @Test
    void range_query_is_sorted_by_start() {
        repository.save(entry("account-1", "late", "2026-01-09T15:00", calendar()));
        repository.save(entry("account-1", "early", "2026-01-08T08:00", calendar()));
        repository.save(entry("account-1", "outside", "2026-02-01T08:00", calendar()));
        entityManager.flush();

        var inRange = repository.findByStartTimeBetweenOrderByStartTimeAsc(
                LocalDateTime.parse("2026-01-08T00:00"), LocalDateTime.parse("2026-01-10T00:00"));

        assertThat(inRange).extracting(CalendarEntry::getTitle).containsExactly("early", "late");
    }

    @Test
    void conflict_list_keeps_its_order() {
        var entry = entry("account-1", "offsite", "2026-01-08T00:00", calendar());
        entry.setConflicts(new ArrayList<>(List.of("cal-b", "cal-a", "email-c")));
        repository.save(entry);
        entityManager.flush();
        entityManager.clear();

        var loaded = repository.findById(entry.getId()).orElseThrow();

        assertThat(loaded.getConflicts()).containsExactly("cal-b", "cal-a", "email-c");
    }
}
