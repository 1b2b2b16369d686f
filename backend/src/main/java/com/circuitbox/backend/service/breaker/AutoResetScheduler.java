package com.circuitbox.backend.service.breaker;

import com.circuitbox.backend.model.Circuit;
import com.circuitbox.backend.service.ScheduledTaskGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Arms the cooldown timer of a tripped circuit. nextResetAt on the circuit mirrors the
 * armed timer: set by {@link #arm}, cleared by {@link #disarm}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AutoResetScheduler {

    private final TimerRegistry timerRegistry;
    private final ScheduledTaskGuard taskGuard;
    private final Clock clock;

    public Instant arm(Circuit circuit, Runnable onFire) {
        Instant resetAt = clock.instant().plus(circuit.getCooldown());
        circuit.setNextResetAt(resetAt);
        String circuitId = circuit.getId();
        timerRegistry.schedule(circuitId, resetAt, () -> taskGuard.run("auto-reset:" + circuitId, onFire));
        log.info("Auto-reset of circuit {} scheduled in {}s", circuitId, circuit.getCooldown().toSeconds());
        return resetAt;
    }

    public boolean disarm(Circuit circuit) {
        circuit.setNextResetAt(null);
        return timerRegistry.cancel(circuit.getId());
    }

    public int disarmAll() {
        return timerRegistry.cancelAll();
    }

    public boolean isArmed(String circuitId) {
        return timerRegistry.isScheduled(circuitId);
    }

    public int armedCount() {
        return timerRegistry.activeCount();
    }
}
