package com.unifiedcalendar.backend.scan.event;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

/**
 * Fans scan events out to Server-Sent-Event subscribers.
 */
@Component
@Slf4j
public class ScanEventBroadcaster {

    static final String STATUS_EVENT = "scan-status";
    static final String NEW_ENTRY_EVENT = "new-entry";
    static final String COMPLETE_EVENT = "scan-complete";

    private final List<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(0L);
        emitters.add(emitter);
        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(e -> emitters.remove(emitter));
        log.debug("Event stream subscribed ({} open)", emitters.size());
        return emitter;
    }

    @Async("eventTaskExecutor")
    @EventListener
    public void onStatusChanged(ScanStatusChangedEvent event) {
        send(STATUS_EVENT, event.getStatus());
    }

    @Async("eventTaskExecutor")
    @EventListener
    public void onNewEntry(NewEntryEvent event) {
        send(NEW_ENTRY_EVENT, event.getEntry());
    }

    @EventListener
    public void onScanCompleted(ScanCompletedEvent event) {
        log.info("✅ Scan complete: {} ({} conflicting pairs)", event.getSummary(), event.getConflictingPairs());
        send(COMPLETE_EVENT, event);
    }

    void send(String name, Object payload) {
        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(name).data(payload));
            } catch (IOException | IllegalStateException e) {
                log.debug("Dropping event stream subscriber: {}", e.getMessage());
                emitters.remove(emitter);
            }
        }
    }
}
