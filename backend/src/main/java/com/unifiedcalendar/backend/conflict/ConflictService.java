package com.unifiedcalendar.backend.conflict;

import com.unifiedcalendar.backend.entry.CalendarEntryRepository;
import com.unifiedcalendar.backend.entry.entity.CalendarEntry;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Recomputes the conflict lists of every stored entry. Run after anything that
 * removes or re-creates entries, so that no list names an entry which no longer
 * lists it back.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConflictService {

    private final CalendarEntryRepository entryRepository;
    private final ConflictDetector conflictDetector;

    /**
     * @return number of conflicting pairs
     */
    @Transactional
    public int refresh() {
        List<CalendarEntry> entries = entryRepository.findAllByOrderByStartTimeAsc();
        int pairs = conflictDetector.detect(entries);
        entryRepository.saveAll(entries);
        log.info("🔍 Conflict pass over {} entries found {} overlapping pairs", entries.size(), pairs);
        return pairs;
    }
}
