package io.mnemo.core.budget;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.mnemo.core.time.MutableClock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class BudgetGuardTest {

    @Test
    void shouldBlockWhenProjectedSpendExceedsLimit() {
        MutableClock clock = MutableClock.at("2026-03-01T10:00:00Z");
        BudgetGuard guard = new BudgetGuard(10.0, clock);
        guard.commit(guard.checkAndReserve(9.5), 9.5);

        assertThatThrownBy(() -> guard.checkAndReserve(1.0))
            .isInstanceOf(BudgetBlockedException.class)
            .satisfies(e -> assertThat(((BudgetBlockedException) e).projectedUsd()).isEqualTo(10.5));
        assertThat(guard.state().spentUsd()).isEqualTo(9.5);
    }

    @Test
    void shouldAllowSpendExactlyAtTheLimit() {
        BudgetGuard guard = new BudgetGuard(10.0, MutableClock.at("2026-03-01T10:00:00Z"));
        guard.commit(guard.checkAndReserve(9.5), 9.5);

        BudgetReservation reservation = guard.checkAndReserve(0.5);

        assertThat(reservation.amountUsd()).isEqualTo(0.5);
    }

    @Test
    void shouldCountOutstandingReservationsAgainstTheLimit() {
        BudgetGuard guard = new BudgetGuard(1.0, MutableClock.at("2026-03-01T10:00:00Z"));
        BudgetReservation first = guard.checkAndReserve(0.6);

        assertThatThrownBy(() -> guard.checkAndReserve(0.6)).isInstanceOf(BudgetBlockedException.class);

        guard.release(first);
        assertThat(guard.checkAndReserve(0.6)).isNotNull();
    }

    @Test
    void shouldReplaceReservationWithActualCost() {
        BudgetGuard guard = new BudgetGuard(1.0, MutableClock.at("2026-03-01T10:00:00Z"));
        BudgetReservation reservation = guard.checkAndReserve(0.5);

        guard.commit(reservation, 0.2);

        BudgetState state = guard.state();
        assertThat(state.reservedUsd()).isZero();
        assertThat(state.spentUsd()).isEqualTo(0.2);
    }

    @Test
    void shouldResetExactlyOnceAtUtcMidnight() {
        MutableClock clock = MutableClock.at("2026-03-01T23:59:59Z");
        BudgetGuard guard = new BudgetGuard(10.0, clock);
        guard.commit(guard.checkAndReserve(9.5), 9.5);

        clock.advance(Duration.ofSeconds(1));

        assertThat(guard.checkAndReserve(1.0)).isNotNull();
        BudgetState state = guard.state();
        assertThat(state.windowStartUtc()).isEqualTo(LocalDate.of(2026, 3, 2));
        assertThat(state.spentUsd()).isZero();
        assertThat(state.rolloverCount()).isEqualTo(1);

        clock.advance(Duration.ofHours(12));
        assertThat(guard.state().rolloverCount()).isEqualTo(1);
    }

    @Test
    void shouldTrackWarningThresholdsPerWindow() {
        MutableClock clock = MutableClock.at("2026-03-01T10:00:00Z");
        BudgetGuard guard = new BudgetGuard(10.0, clock);

        guard.commit(guard.checkAndReserve(7.0), 7.0);
        assertThat(guard.thresholdsReached()).containsExactly(70);

        guard.commit(guard.checkAndReserve(2.5), 2.5);
        assertThat(guard.thresholdsReached()).containsExactly(70, 90);
        assertThat(guard.utilizationPercent()).isCloseTo(95.0, within(1e-9));

        clock.advance(Duration.ofDays(1));
        assertThat(guard.thresholdsReached()).isEmpty();
    }

    @Test
    void shouldNeverBlockWhenDisabled() {
        BudgetGuard guard = new BudgetGuard(0.0, MutableClock.at("2026-03-01T10:00:00Z"));

        guard.commit(guard.checkAndReserve(1_000.0), 1_000.0);

        assertThat(guard.enabled()).isFalse();
        assertThat(guard.checkAndReserve(1_000.0)).isNotNull();
        assertThat(guard.utilizationPercent()).isZero();
    }

    @Test
    void shouldNotOverReserveUnderConcurrentCallers() throws Exception {
        BudgetGuard guard = new BudgetGuard(2.0, MutableClock.at("2026-03-01T10:00:00Z"));
        int callers = 24;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger blocked = new AtomicInteger();
        List<BudgetReservation> held = new CopyOnWriteArrayList<>();
        try {
            List<Future<?>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                boolean commits = i % 3 == 0;
                results.add(executor.submit(() -> {
                    start.await();
                    try {
                        BudgetReservation reservation = guard.checkAndReserve(0.25);
                        BudgetState state = guard.state();
                        assertThat(state.spentUsd() + state.reservedUsd()).isLessThanOrEqualTo(2.0);
                        if (commits) {
                            guard.commit(reservation, 0.25);
                        } else {
                            held.add(reservation);
                        }
                    } catch (BudgetBlockedException e) {
                        blocked.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> result : results) {
                result.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        BudgetState state = guard.state();
        assertThat(blocked.get()).isEqualTo(callers - 8);
        assertThat(state.spentUsd() + state.reservedUsd()).isEqualTo(2.0);
        assertThat(state.reservedUsd()).isEqualTo(held.size() * 0.25);
    }
}
