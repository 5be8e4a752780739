package io.mnemo.core.time;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class CancellationTokenTest {

    @Test
    void shouldRunCallbacksOnceOnCancel() {
        CancellationToken token = CancellationToken.cancellable(MutableClock.at("2026-01-01T00:00:00Z"));
        AtomicInteger calls = new AtomicInteger();
        token.onCancel(calls::incrementAndGet);

        token.cancel();
        token.cancel();

        assertThat(token.isCancelled()).isTrue();
        assertThat(calls).hasValue(1);
    }

    @Test
    void shouldNotRunUnregisteredCallback() {
        CancellationToken token = CancellationToken.cancellable(MutableClock.at("2026-01-01T00:00:00Z"));
        AtomicInteger calls = new AtomicInteger();
        CancellationToken.Registration registration = token.onCancel(calls::incrementAndGet);
        registration.close();

        token.cancel();

        assertThat(calls).hasValue(0);
    }

    @Test
    void shouldCapRemainingTimeAtDeadline() {
        MutableClock clock = MutableClock.at("2026-01-01T00:00:00Z");
        CancellationToken token = CancellationToken.withDeadline(clock, Duration.ofSeconds(10));

        assertThat(token.remaining(Duration.ofSeconds(60))).isEqualTo(Duration.ofSeconds(10));
        assertThat(token.remaining(Duration.ofSeconds(2))).isEqualTo(Duration.ofSeconds(2));

        clock.advance(Duration.ofSeconds(11));
        assertThat(token.deadlineExpired()).isTrue();
        assertThat(token.remaining(Duration.ofSeconds(2))).isEqualTo(Duration.ZERO);
    }
}
