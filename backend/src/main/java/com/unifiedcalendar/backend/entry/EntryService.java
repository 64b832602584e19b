package com.unifiedcalendar.backend.entry;

import com.unifiedcalendar.backend.entry.entity.CalendarEntry;
import java.time.LocalDateTime;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@RequiredArgsConstructor
@Slf4j
public class EntryService {

    private final CalendarEntryRepository entryRepository;

    /**
     * Entries starting inside [start, end], ordered by start
     */
    @Transactional(readOnly = true)
    public List<CalendarEntry> getEntries(LocalDateTime start, LocalDateTime end) {
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("end must not be before start");
        }
        return entryRepository.findByStartTimeBetweenOrderByStartTimeAsc(start, end);
    }

    @Transactional(readOnly = true)
    public List<CalendarEntry> getAllEntries() {
        return entryRepository.findAllByOrderByStartTimeAsc();
    }

    @Transactional
    public long clearAll() {
        long count = entryRepository.count();
        entryRepository.deleteAll();
        log.info("Cleared all {} entries", count);
        return count;
    }

}
