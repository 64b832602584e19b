package com.unifiedcalendar.backend.scan;

import com.unifiedcalendar.backend.scan.dto.ScanStatusDTO;
import java.time.Clock;
import java.time.LocalDateTime;
import org.springframework.stereotype.Component;

/**
 * The single process-wide scan state. Every mutator is synchronized and readers
 * only ever see {@link #snapshot()} copies.
 *
 * <p>{@code running} tracks the driver itself, independently of the status shown to
 * observers: a paused or cancelled scan still holds the slot until its driver exits.
 */
@Component
public class ScanState {

    private final Clock clock;

    private ScanStatus status;
    private ScanPhase phase;
    private int current;
    private int total;
    private String currentItem;
    private int accountsTotal;
    private int accountsDone;
    private int entriesSaved;
    private int lookbackDays;
    private LocalDateTime startedAt;
    private LocalDateTime finishedAt;
    private String error;
    private boolean running;

    public ScanState(Clock clock) {
        this.clock = clock;
    }

    /**
     * Claims the scan slot. Leaves the state untouched when a driver is still running.
     */
    public synchronized boolean tryBegin(int accounts, int lookbackDays) {
        if (running) {
            return false;
        }
        this.running = true;
        this.status = ScanStatus.SCANNING;
        this.phase = ScanPhase.STARTING;
        this.current = 0;
        this.total = 0;
        this.currentItem = "";
        this.accountsTotal = accounts;
        this.accountsDone = 0;
        this.entriesSaved = 0;
        this.lookbackDays = lookbackDays;
        this.startedAt = LocalDateTime.now(clock);
        this.finishedAt = null;
        this.error = null;
        return true;
    }

    public synchronized boolean isRunning() {
        return running;
    }

    public synchronized ScanStatus getStatus() {
        return status == null ? ScanStatus.IDLE : status;
    }

    public synchronized void enterPhase(ScanPhase phase, String item) {
        this.phase = phase;
        this.current = 0;
        this.total = 0;
        this.currentItem = item;
    }

    public synchronized void progress(int current, int total, String item) {
        this.current = current;
        this.total = total;
        this.currentItem = item;
    }

    public synchronized void entrySaved() {
        entriesSaved++;
    }

    public synchronized void accountDone() {
        accountsDone++;
    }

    public synchronized int getEntriesSaved() {
        return entriesSaved;
    }

    /**
     * @return false unless a scan was in {@code SCANNING}
     */
    public synchronized boolean pause() {
        if (status != ScanStatus.SCANNING) {
            return false;
        }
        status = ScanStatus.PAUSED;
        return true;
    }

    /**
     * @return false when no driver is running or the scan has already finished
     */
    public synchronized boolean cancel() {
        if (!running || status == ScanStatus.COMPLETE || status == ScanStatus.ERROR) {
            return false;
        }
        status = ScanStatus.CANCELLED;
        return true;
    }

    /**
     * @return false, leaving the state untouched, when the scan was cancelled first
     */
    public synchronized boolean complete() {
        if (status == ScanStatus.CANCELLED) {
            return false;
        }
        status = ScanStatus.COMPLETE;
        phase = ScanPhase.COMPLETE;
        currentItem = "";
        finishedAt = LocalDateTime.now(clock);
        return true;
    }

    public synchronized void cancelled() {
        status = ScanStatus.CANCELLED;
        finishedAt = LocalDateTime.now(clock);
    }

    public synchronized void fail(String message) {
        status = ScanStatus.ERROR;
        error = message;
        finishedAt = LocalDateTime.now(clock);
    }

    /**
     * Releases the scan slot once the driver has exited.
     */
    public synchronized void release() {
        running = false;
    }

    public synchronized ScanStatusDTO snapshot() {
        if (status == null) {
            return ScanStatusDTO.idle();
        }
        return ScanStatusDTO.builder()
                .status(status)
                .phase(phase)
                .current(current)
                .total(total)
                .currentItem(currentItem)
                .accountsTotal(accountsTotal)
                .accountsDone(accountsDone)
                .entriesSaved(entriesSaved)
                .lookbackDays(lookbackDays)
                .startedAt(startedAt)
                .finishedAt(finishedAt)
                .error(error)
                .build();
    }
}
