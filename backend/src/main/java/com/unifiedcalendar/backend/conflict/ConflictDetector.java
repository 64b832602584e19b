package com.unifiedcalendar.backend.conflict;

import com.unifiedcalendar.backend.entry.entity.CalendarEntry;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Pairwise overlap check across the whole entry set. Intervals are half-open, so
 * back-to-back entries do not conflict.
 */
@Component
public class ConflictDetector {

    /**
     * Rewrites every entry's conflict list. Existing lists are cleared first so that
     * repeated runs over the same entries give the same result.
     *
     * @return number of conflicting pairs
     */
    public int detect(List<CalendarEntry> entries) {
        for (CalendarEntry entry : entries) {
            if (entry.getConflicts() == null) {
                entry.setConflicts(new ArrayList<>());
            } else {
                entry.getConflicts().clear();
            }
        }

        int pairs = 0;
        for (int i = 0; i < entries.size(); i++) {
            CalendarEntry a = entries.get(i);
            for (int j = i + 1; j < entries.size(); j++) {
                CalendarEntry b = entries.get(j);
                if (overlaps(a, b)) {
                    a.getConflicts().add(b.getId());
                    b.getConflicts().add(a.getId());
                    pairs++;
                }
            }
        }
        return pairs;
    }

    static boolean overlaps(CalendarEntry a, CalendarEntry b) {
        return a.getStartTime().isBefore(b.getEndTime()) && a.getEndTime().isAfter(b.getStartTime());
    }
}
