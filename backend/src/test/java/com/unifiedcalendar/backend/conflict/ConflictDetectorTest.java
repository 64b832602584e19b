package com.unifiedcalendar.backend.conflict;

import com.unifiedcalendar.backend.entry.entity.CalendarEntry;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ConflictDetectorTest {

    private final ConflictDetector detector = new ConflictDetector();

    private static CalendarEntry entry(String id, String start, String end) {
        return CalendarEntry.builder()
                .id(id)
                .accountId("account-1")
                .title(id)
                .startTime(LocalDateTime.parse(start))
                .endTime(LocalDateTime.parse(end))
                .build();
    }

    @Test
    void overlapping_entries_conflict_with_each_other() {
        var a = entry("a", "2026-01-10T10:00", "2026-01-10T10:45");
        var b = entry("b", "2026-01-10T10:30", "2026-01-10T11:00");

        int pairs = detector.detect(List.of(a, b));

        assertThat(pairs).isEqualTo(1);
        assertThat(a.getConflicts()).containsExactly("b");
        assertThat(b.getConflicts()).containsExactly("a");
    }

    @Test
    void back_to_back_entries_do_not_conflict() {
        var a = entry("a", "2026-01-10T10:00", "2026-01-10T10:45");
        var b = entry("b", "2026-01-10T10:45", "2026-01-10T11:15");

        int pairs = detector.detect(List.of(a, b));

        assertThat(pairs).isZero();
        assertThat(a.getConflicts()).isEmpty();
        assertThat(b.getConflicts()).isEmpty();
    }

    @Test
    void all_day_entry_conflicts_with_timed_entries_that_day() {
        var offsite = entry("offsite", "2026-01-08T00:00:00", "2026-01-11T23:59:59");
        var call = entry("call", "2026-01-09T15:00", "2026-01-09T15:30");
        var later = entry("later", "2026-01-12T09:00", "2026-01-12T10:00");

        detector.detect(List.of(offsite, call, later));

        assertThat(offsite.getConflicts()).containsExactly("call");
        assertThat(call.getConflicts()).containsExactly("offsite");
        assertThat(later.getConflicts()).isEmpty();
    }

    @Test
    void conflict_lists_are_symmetric_and_exclude_disjoint_entries() {
        var entries = new ArrayList<CalendarEntry>();
        entries.add(entry("e1", "2026-01-10T09:00", "2026-01-10T12:00"));
        entries.add(entry("e2", "2026-01-10T09:30", "2026-01-10T10:00"));
        entries.add(entry("e3", "2026-01-10T11:30", "2026-01-10T13:00"));
        entries.add(entry("e4", "2026-01-10T13:00", "2026-01-10T14:00"));
        entries.add(entry("e5", "2026-01-11T09:00", "2026-01-11T09:30"));

        detector.detect(entries);

        for (CalendarEntry a : entries) {
            for (CalendarEntry b : entries) {
                if (a.getConflicts().contains(b.getId())) {
                    assertThat(b.getConflicts()).contains(a.getId());
                }
                boolean disjoint = !a.getEndTime().isAfter(b.getStartTime()) || !b.getEndTime().isAfter(a.getStartTime());
                if (disjoint) {
                    assertThat(a.getConflicts()).doesNotContain(b.getId());
                }
            }
        }
        assertThat(entries.get(0).getConflicts()).containsExactly("e2", "e3");
        assertThat(entries.get(3).getConflicts()).isEmpty();
    }

    @Test
    void rerunning_detection_replaces_stale_conflicts() {
        var a = entry("a", "2026-01-10T10:00", "2026-01-10T11:00");
        var b = entry("b", "2026-01-10T10:30", "2026-01-10T11:30");
        detector.detect(List.of(a, b));

        b.setStartTime(LocalDateTime.parse("2026-01-10T12:00"));
        b.setEndTime(LocalDateTime.parse("2026-01-10T13:00"));
        detector.detect(List.of(a, b));

        assertThat(a.getConflicts()).isEmpty();
        assertThat(b.getConflicts()).isEmpty();
    }
}
