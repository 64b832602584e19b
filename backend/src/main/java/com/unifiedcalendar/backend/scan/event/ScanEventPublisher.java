package com.unifiedcalendar.backend.scan.event;

import com.unifiedcalendar.backend.entry.entity.CalendarEntry;
import com.unifiedcalendar.backend.scan.ScanState;
import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Outbound scan notifications, published as Spring application events.
 */
@Component
@RequiredArgsConstructor
public class ScanEventPublisher {

    private final ApplicationEventPublisher publisher;
    private final ScanState scanState;

    public void statusChanged() {
        publisher.publishEvent(new ScanStatusChangedEvent(scanState.snapshot()));
    }

    public void newEntry(CalendarEntry entry) {
        publisher.publishEvent(new NewEntryEvent(entry));
    }

    public void completed(int entries, int accounts, int conflictingPairs) {
        String summary = String.format("Found %d entries from %d account(s)", entries, accounts);
        publisher.publishEvent(new ScanCompletedEvent(summary, entries, accounts, conflictingPairs));
    }
}
