package com.unifiedcalendar.backend.scan;

/**
 * Cooperative cancellation flag for one scan. Polled between phases and between
 * items; it never interrupts a call already in progress.
 */
public class CancellationToken {

    private volatile boolean cancelled;

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }
}
