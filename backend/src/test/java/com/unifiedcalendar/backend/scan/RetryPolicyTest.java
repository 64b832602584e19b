package com.unifiedcalendar.backend.scan;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class RetryPolicyTest {

    private final RetryPolicy retry = new RetryPolicy(3, Duration.ZERO);

    @Test
    void returns_first_accepted_result() {
        var calls = new AtomicInteger();

        var result = retry.execute("scrape", new CancellationToken(),
                () -> calls.incrementAndGet() < 2 ? List.<String>of() : List.of("event"),
                list -> !list.isEmpty());

        assertThat(result).contains(List.of("event"));
        assertThat(calls).hasValue(2);
    }

    @Test
    void gives_up_after_max_attempts() {
        var calls = new AtomicInteger();

        var result = retry.execute("scrape", new CancellationToken(), () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("page not rendered");
        }, x -> true);

        assertThat(result).isEmpty();
        assertThat(calls).hasValue(3);
    }

    @Test
    void no_attempt_after_cancellation() {
        var token = new CancellationToken();
        var calls = new AtomicInteger();

        var result = retry.execute("scrape", token, () -> {
            calls.incrementAndGet();
            token.cancel();
            return "";
        }, s -> !s.isEmpty());

        assertThat(result).isEmpty();
        assertThat(calls).hasValue(1);
    }

    @Test
    void at_least_one_attempt_is_made() {
        var single = new RetryPolicy(0, null);

        assertThat(single.getMaxAttempts()).isEqualTo(1);
        assertThat(single.execute("fetch", null, () -> "ok", s -> true)).contains("ok");
    }
}
