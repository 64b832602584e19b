package com.unifiedcalendar.backend.scan;

import com.unifiedcalendar.backend.config.ScanConfig;
import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;
import lombok.extern.slf4j.Slf4j;

/**
 * Fixed-delay retry for best-effort sources (scrapers, feeds, page navigation).
 * No attempt is started once the scan has been cancelled.
 */
@Slf4j
public class RetryPolicy {

    private final int maxAttempts;
    private final Duration delay;

    public RetryPolicy(int maxAttempts, Duration delay) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.delay = delay == null ? Duration.ZERO : delay;
    }

    public static RetryPolicy from(ScanConfig config) {
        return new RetryPolicy(config.getMaxAttempts(), config.getRetryDelay());
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Runs {@code action} until {@code success} accepts its result.
     *
     * @return the accepted result, or empty when every attempt failed or the scan was cancelled
     */
    public <T> Optional<T> execute(String description, CancellationToken token, Supplier<T> action,
                                   Predicate<T> success) {
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            if (token != null && token.isCancelled()) {
                log.debug("{}: cancelled before attempt {}", description, attempt);
                return Optional.empty();
            }
            try {
                T result = action.get();
                if (success.test(result)) {
                    return Optional.ofNullable(result);
                }
                log.debug("{}: attempt {}/{} returned nothing usable", description, attempt, maxAttempts);
            } catch (RuntimeException e) {
                log.warn("{}: attempt {}/{} failed: {}", description, attempt, maxAttempts, e.getMessage());
            }

            if (attempt < maxAttempts && !sleep(delay)) {
                return Optional.empty();
            }
        }
        log.warn("{}: giving up after {} attempts", description, maxAttempts);
        return Optional.empty();
    }

    /**
     * @return false if the thread was interrupted while waiting
     */
    public static boolean sleep(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
