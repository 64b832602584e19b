package com.unifiedcalendar.backend.entry;

import com.unifiedcalendar.backend.entry.entity.CalendarEntry;
import com.unifiedcalendar.backend.entry.entity.SourceKind;
import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface CalendarEntryRepository extends JpaRepository<CalendarEntry, String> {

    List<CalendarEntry> findByStartTimeBetweenOrderByStartTimeAsc(LocalDateTime start, LocalDateTime end);

    List<CalendarEntry> findAllByOrderByStartTimeAsc();

    long countByAccountIdAndSourceKind(String accountId, SourceKind sourceKind);

    // Clear-then-repopulate before each phase
    @Transactional
    long deleteByAccountIdAndSourceKind(String accountId, SourceKind sourceKind);

    @Transactional
    long deleteByAccountId(String accountId);
}
