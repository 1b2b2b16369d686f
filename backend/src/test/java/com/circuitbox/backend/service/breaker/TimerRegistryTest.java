package com.circuitbox.backend.service.breaker;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TimerRegistryTest {

    private final BreakerFixture fx = new BreakerFixture();
    private final TimerRegistry timers = fx.timerRegistry;
    private final Instant fireAt = BreakerFixture.START.plusSeconds(30);

    @Test
    void reschedulingReplacesPendingTimer() {
        timers.schedule("c1", fireAt, () -> { });
        BreakerFixture.ScheduledTask first = fx.lastScheduled();

        timers.schedule("c1", fireAt.plusSeconds(5), () -> { });

        verify(first.future()).cancel(false);
        assertThat(timers.activeCount()).isEqualTo(1);
        assertThat(timers.isScheduled("c1")).isTrue();
    }

    @Test
    void firedTimerLeavesRegistry() {
        AtomicInteger runs = new AtomicInteger();
        timers.schedule("c1", fireAt, runs::incrementAndGet);

        fx.lastScheduled().task().run();

        assertThat(runs.get()).isEqualTo(1);
        assertThat(timers.isScheduled("c1")).isFalse();
        assertThat(timers.cancel("c1")).isFalse();
    }

    @Test
    void cancelAllReportsPendingTimers() {
        timers.schedule("c1", fireAt, () -> { });
        timers.schedule("c2", fireAt, () -> { });
        timers.schedule("c3", fireAt, () -> { });
        when(fx.scheduled.get(2).future().isDone()).thenReturn(true);

        assertThat(timers.activeCount()).isEqualTo(2);
        assertThat(timers.cancelAll()).isEqualTo(2);
        assertThat(timers.activeCount()).isZero();
    }

    @Test
    void unknownKeyIsNotScheduled() {
        assertThat(timers.isScheduled("nope")).isFalse();
        assertThat(timers.cancel("nope")).isFalse();
    }
}
