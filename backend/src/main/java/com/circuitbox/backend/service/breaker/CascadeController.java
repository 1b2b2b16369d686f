package com.circuitbox.backend.service.breaker;

import com.circuitbox.backend.dto.CircuitDescriptor;
import com.circuitbox.backend.model.BreakerState;
import com.circuitbox.backend.model.Circuit;
import com.circuitbox.backend.model.CircuitHealth;
import com.circuitbox.backend.model.MasterSwitch;
import com.circuitbox.backend.model.Panel;
import com.circuitbox.backend.model.SystemStatus;
import com.circuitbox.backend.service.MetricsService;
import com.circuitbox.backend.service.audit.AlertService;
import com.circuitbox.backend.service.audit.AuditTrailService;
import com.circuitbox.backend.service.probe.ProbeRunner;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * State machine of the breaker tree. Commands cascade top-down (master to panels to
 * circuits); health is recomputed bottom-up after every mutation. Every public operation
 * runs under the tree lock with the acting user in the {@code actor} MDC key.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class CascadeController {

    static final String MDC_ACTOR = "actor";
    static final String SYSTEM_ACTOR = "system";
    static final String MASTER_TARGET = "masterSwitch";

    private final BreakerTree tree;
    private final HealthClassifier healthClassifier;
    private final TripDetector tripDetector;
    private final LatencyTracker latencyTracker;
    private final AutoResetScheduler autoResetScheduler;
    private final ProbeRunner probeRunner;
    private final AlertService alertService;
    private final AuditTrailService auditTrailService;
    private final MetricsService metricsService;
    private final Clock clock;

    // ---------------------------------------------------------------- master switch

    /**
     * Powers the system up and cascades ON to every panel in display order.
     *
     * @return false when the master switch was already ON
     */
    public boolean masterOn(String actor) {
        String who = actorOrSystem(actor);
        return asActor(who, () -> {
            MasterSwitch master = tree.masterSwitch();
            if (master.isOn()) {
                log.info("Master switch already ON");
                return false;
            }
            Instant now = clock.instant();
            BreakerState previous = master.getState();
            master.setState(BreakerState.ON);
            master.setLastStateChange(now);
            master.setStartTime(now);
            master.setPowerCycles(master.getPowerCycles() + 1);
            master.setLastChangedBy(who);
            master.setEmergencyShutdown(false);
            log.info("🔌 Master switch ON (power cycle {})", master.getPowerCycles());

            for (Panel panel : List.copyOf(tree.panels())) {
                applyPanelState(panel.getId(), BreakerState.ON, who);
            }

            refreshSystemStatus();
            auditTrailService.record(who, "MASTER_ON", MASTER_TARGET, previous, BreakerState.ON);
            return true;
        });
    }

    /**
     * Graceful shutdown: cascades OFF to every panel and banks the session uptime.
     *
     * @return false when the master switch was already OFF
     */
    public boolean masterOff(String actor) {
        String who = actorOrSystem(actor);
        return asActor(who, () -> {
            MasterSwitch master = tree.masterSwitch();
            if (!master.isOn()) {
                log.info("Master switch already OFF");
                return false;
            }
            Instant now = clock.instant();
            bankUptime(master, now);

            for (Panel panel : List.copyOf(tree.panels())) {
                applyPanelState(panel.getId(), BreakerState.OFF, who);
            }

            master.setState(BreakerState.OFF);
            master.setLastStateChange(now);
            master.setLastChangedBy(who);
            refreshSystemStatus();
            log.info("Master switch OFF, uptime {}", master.getUptime());
            auditTrailService.record(who, "MASTER_OFF", MASTER_TARGET, BreakerState.ON, BreakerState.OFF);
            return true;
        });
    }

    /**
     * Trips every panel and circuit at once. No cooldown timers are armed and pending ones
     * are cancelled, so recovery needs a manual reset.
     */
    public void emergencyShutdown(String actor, String reason) {
        String who = actorOrSystem(actor);
        String why = reason != null ? reason : "Manual trigger";
        asActor(who, () -> {
            Instant now = clock.instant();
            int cancelledTimers = 0;
            for (Panel panel : tree.panels()) {
                forceTrip(panel, now);
                for (Circuit circuit : panel.getCircuits()) {
                    if (forceTrip(circuit, now)) {
                        cancelledTimers++;
                    }
                }
                healthClassifier.refresh(panel);
            }

            MasterSwitch master = tree.masterSwitch();
            BreakerState previous = master.getState();
            if (master.isOn()) {
                bankUptime(master, now);
            }
            master.setState(BreakerState.OFF);
            master.setEmergencyShutdown(true);
            master.setLastStateChange(now);
            master.setLastChangedBy(who);
            master.setSystemStatus(SystemStatus.CRITICAL);
            tree.markHealthChecked(now);

            metricsService.recordEmergencyShutdown();
            metricsService.updateTrippedCircuits(trippedCircuitCount());
            log.error("⛔ Emergency shutdown, {} pending auto-resets cancelled", cancelledTimers);
            alertService.critical(SYSTEM_ACTOR, "EMERGENCY SHUTDOWN: " + why);
            auditTrailService.record(who, "EMERGENCY_SHUTDOWN", SYSTEM_ACTOR, previous, why);
            return null;
        });
    }

    // ---------------------------------------------------------------- panels

    public boolean setPanelState(String panelId, BreakerState target, String actor) {
        String who = actorOrSystem(actor);
        return asActor(who, () -> applyPanelState(panelId, target, who));
    }

    /**
     * Trips a panel and all of its circuits and keeps it locked until
     * {@link #resetPanelLockout}. No cooldown timers are armed.
     */
    public boolean lockoutPanel(String panelId, String actor, String reason) {
        String who = actorOrSystem(actor);
        return asActor(who, () -> {
            Panel panel = tree.findPanel(panelId).orElse(null);
            if (panel == null) {
                alertService.warning(SYSTEM_ACTOR, "Panel not found: " + panelId);
                return false;
            }
            if (panel.isLockedOut()) {
                log.info("Panel {} already locked out", panelId);
                return true;
            }
            Instant now = clock.instant();
            panel.setLockedOut(true);
            forceTrip(panel, now);
            panel.getCircuits().forEach(circuit -> forceTrip(circuit, now));
            refreshAfterChange(panel);

            alertService.alert(panelId, "Panel LOCKED OUT: " + (reason != null ? reason : "No reason provided"));
            auditTrailService.record(who, "PANEL_LOCKOUT", panelId, false, true);
            return true;
        });
    }

    /**
     * Clears a lockout, manually resets every circuit of the panel and leaves the panel OFF.
     */
    public boolean resetPanelLockout(String panelId, String actor) {
        String who = actorOrSystem(actor);
        return asActor(who, () -> {
            Panel panel = tree.findPanel(panelId).orElse(null);
            if (panel == null) {
                alertService.warning(SYSTEM_ACTOR, "Panel not found: " + panelId);
                return false;
            }
            boolean wasLockedOut = panel.isLockedOut();
            panel.setLockedOut(false);
            panel.setState(BreakerState.OFF);
            for (Circuit circuit : panel.getCircuits()) {
                manualReset(circuit, who);
            }
            refreshAfterChange(panel);

            alertService.info(panelId, "Panel lockout RESET by " + who);
            auditTrailService.record(who, "PANEL_LOCKOUT_RESET", panelId, wasLockedOut, false);
            return true;
        });
    }

    // ---------------------------------------------------------------- circuits

    public boolean setCircuitState(String circuitId, BreakerState target, String actor) {
        String who = actorOrSystem(actor);
        return asActor(who, () -> applyCircuitState(circuitId, target, who));
    }

    /**
     * Opens a circuit and arms its cooldown timer.
     *
     * @return false when the circuit is unknown or already tripped
     */
    public boolean tripCircuit(String circuitId, String reason) {
        return asActor(SYSTEM_ACTOR, () -> {
            Circuit circuit = tree.findCircuit(circuitId).orElse(null);
            if (circuit == null) {
                alertService.warning(SYSTEM_ACTOR, "Circuit not found: " + circuitId);
                return false;
            }
            if (circuit.isTripped()) {
                log.info("Circuit {} already tripped", circuitId);
                return false;
            }
            trip(circuit, reason);
            return true;
        });
    }

    public boolean resetCircuitBreaker(String circuitId, String actor) {
        String who = actorOrSystem(actor);
        return asActor(who, () -> {
            Circuit circuit = tree.findCircuit(circuitId).orElse(null);
            if (circuit == null) {
                alertService.warning(SYSTEM_ACTOR, "Circuit not found: " + circuitId);
                return false;
            }
            manualReset(circuit, who);
            refreshAfterChange(owningPanel(circuit));
            return true;
        });
    }

    /**
     * Returns a tripped circuit to OFF and, when its panel and the master switch are ON,
     * switches it back on with a fresh probe.
     *
     * @return false when the circuit is unknown or no longer tripped
     */
    public boolean autoReset(String circuitId) {
        return asActor(SYSTEM_ACTOR, () -> {
            Circuit circuit = tree.findCircuit(circuitId).orElse(null);
            if (circuit == null || !circuit.isTripped()) {
                return false;
            }
            autoResetScheduler.disarm(circuit);
            clearTrip(circuit);
            metricsService.recordAutoReset();
            alertService.info(circuitId, "Circuit AUTO-RESET complete");
            auditTrailService.record(SYSTEM_ACTOR, "CIRCUIT_AUTO_RESET", circuitId, BreakerState.TRIPPED, BreakerState.OFF);

            Panel panel = owningPanel(circuit);
            refreshAfterChange(panel);
            if (panel.getState() == BreakerState.ON && !panel.isLockedOut() && tree.masterSwitch().isOn()) {
                applyCircuitState(circuitId, BreakerState.ON, SYSTEM_ACTOR);
            }
            return true;
        });
    }

    /**
     * Counts a failure against a circuit and trips it on reaching its threshold.
     */
    public boolean reportError(String circuitId, String error, Double latencyMs) {
        return asActor(SYSTEM_ACTOR, () -> {
            Circuit circuit = tree.findCircuit(circuitId).orElse(null);
            if (circuit == null) {
                log.warn("Error reported for unknown circuit {}", circuitId);
                return false;
            }
            countError(circuit, error, latencyMs);
            return true;
        });
    }

    public boolean recordRequest(String circuitId, double latencyMs) {
        return asActor(SYSTEM_ACTOR, () -> {
            Circuit circuit = tree.findCircuit(circuitId).orElse(null);
            if (circuit == null) {
                log.warn("Request recorded for unknown circuit {}", circuitId);
                return false;
            }
            latencyTracker.recordRequest(circuit, latencyMs);
            circuit.setHealth(healthClassifier.classify(circuit));
            refreshAfterChange(owningPanel(circuit));
            return true;
        });
    }

    // ---------------------------------------------------------------- transitions

    private boolean applyPanelState(String panelId, BreakerState target, String actor) {
        if (target == BreakerState.TRIPPED) {
            alertService.warning(panelId, "Panels trip only through lockout or emergency shutdown");
            return false;
        }
        Panel panel = tree.findPanel(panelId).orElse(null);
        if (panel == null) {
            alertService.warning(SYSTEM_ACTOR, "Panel not found: " + panelId);
            return false;
        }
        if (panel.isLockedOut()) {
            alertService.warning(panelId, "Panel is locked out - lockout reset required");
            return false;
        }
        if (target == BreakerState.ON && !tree.masterSwitch().isOn()) {
            alertService.warning(panelId, "Cannot power on panel - Master Switch is OFF");
            return false;
        }

        BreakerState previous = panel.getState();
        panel.setState(target);
        log.info("{} Panel {}: {}", target == BreakerState.ON ? "●" : "○", panel.getName(), target);
        for (Circuit circuit : List.copyOf(panel.getCircuits())) {
            applyCircuitState(circuit.getId(), target, actor);
        }

        refreshAfterChange(panel);
        auditTrailService.record(actor, "PANEL_" + target.name(), panelId, previous, target);
        return true;
    }

    private boolean applyCircuitState(String circuitId, BreakerState target, String actor) {
        if (target == BreakerState.TRIPPED) {
            alertService.warning(circuitId, "Use tripCircuit to open a circuit");
            return false;
        }
        Circuit circuit = tree.findCircuit(circuitId).orElse(null);
        if (circuit == null) {
            alertService.warning(SYSTEM_ACTOR, "Circuit not found: " + circuitId);
            return false;
        }
        Panel panel = owningPanel(circuit);
        BreakerState previous = circuit.getState();

        if (target == BreakerState.OFF) {
            // A tripped circuit stays tripped until reset
            if (previous != BreakerState.ON) {
                return true;
            }
            circuit.setState(BreakerState.OFF);
            circuit.setHealth(CircuitHealth.OFFLINE);
            circuit.setLastActivity(clock.instant());
            refreshAfterChange(panel);
            auditTrailService.record(actor, "CIRCUIT_OFF", circuitId, previous, BreakerState.OFF);
            return true;
        }

        if (!tree.masterSwitch().isOn()) {
            alertService.warning(circuitId, "Cannot power on - Master Switch is OFF");
            return false;
        }
        if (panel.getState() != BreakerState.ON || panel.isLockedOut()) {
            alertService.warning(circuitId, "Cannot power on - panel " + panel.getId() + " is not ON");
            return false;
        }
        if (circuit.isTripped()) {
            alertService.warning(circuitId, "Cannot power on - circuit is TRIPPED, reset required");
            return false;
        }
        if (previous == BreakerState.ON) {
            return true;
        }

        circuit.setState(BreakerState.ON);
        circuit.setLastActivity(clock.instant());
        checkHealth(circuit);
        refreshAfterChange(panel);
        auditTrailService.record(actor, "CIRCUIT_ON", circuitId, previous, circuit.getState());
        return true;
    }

    /**
     * Probes a freshly energized circuit. A failed probe counts as an error and leaves the
     * circuit CRITICAL.
     */
    private void checkHealth(Circuit circuit) {
        circuit.setLastCheck(clock.instant());
        if (circuit.getEndpoint() == null || circuit.getEndpoint().isBlank()) {
            circuit.setHealth(healthClassifier.classify(circuit));
            return;
        }
        ProbeRunner.ProbeOutcome outcome = probeRunner.run(CircuitDescriptor.from(circuit));
        if (outcome.success()) {
            circuit.getLatency().setCurrent(outcome.latencyMs());
            CircuitHealth health = healthClassifier.classify(circuit);
            if (health == CircuitHealth.HEALTHY && outcome.latencyMs() > circuit.getLatency().getMaxAllowed()) {
                health = CircuitHealth.DEGRADED;
            }
            circuit.setHealth(health);
            return;
        }
        metricsService.recordProbeFailure();
        countError(circuit, outcome.failure(), (double) outcome.latencyMs());
        circuit.setHealth(CircuitHealth.CRITICAL);
    }

    private void countError(Circuit circuit, String error, Double latencyMs) {
        TripDetector.Outcome outcome = tripDetector.recordError(circuit, error, latencyMs);
        if (outcome == TripDetector.Outcome.THRESHOLD_REACHED) {
            trip(circuit, "Error threshold exceeded (" + circuit.getErrorCount() + "/" + circuit.getTripThreshold() + ")");
            return;
        }
        circuit.setHealth(healthClassifier.classify(circuit));
        refreshAfterChange(owningPanel(circuit));
    }

    private void trip(Circuit circuit, String reason) {
        BreakerState previous = circuit.getState();
        circuit.setState(BreakerState.TRIPPED);
        circuit.setTripCount(circuit.getTripCount() + 1);
        circuit.setLastTripped(clock.instant());
        circuit.setHealth(CircuitHealth.CRITICAL);

        String circuitId = circuit.getId();
        alertService.alert(circuitId, "CIRCUIT TRIPPED: " + (reason != null ? reason : "Unknown"));
        auditTrailService.record(SYSTEM_ACTOR, "CIRCUIT_TRIP", circuitId, previous, BreakerState.TRIPPED);
        metricsService.recordTrip(circuitId);
        int generation = circuit.getTripCount();
        autoResetScheduler.arm(circuit, () -> autoResetIfDue(circuitId, generation));
        refreshAfterChange(owningPanel(circuit));
    }

    /**
     * Timer callback. Acts only while the circuit is still in the trip that armed the timer;
     * every trip bumps tripCount, so a timer left over from an earlier trip is ignored.
     */
    private void autoResetIfDue(String circuitId, int generation) {
        tree.runLocked(() -> {
            boolean current = tree.findCircuit(circuitId)
                    .map(circuit -> circuit.isTripped()
                            && circuit.getNextResetAt() != null
                            && circuit.getTripCount() == generation)
                    .orElse(false);
            if (current) {
                autoReset(circuitId);
            } else {
                log.debug("Stale auto-reset timer for circuit {} ignored", circuitId);
            }
        });
    }

    private void manualReset(Circuit circuit, String actor) {
        BreakerState previous = circuit.getState();
        autoResetScheduler.disarm(circuit);
        clearTrip(circuit);
        metricsService.recordManualReset();
        alertService.info(circuit.getId(), "Circuit MANUALLY RESET");
        auditTrailService.record(actor, "CIRCUIT_MANUAL_RESET", circuit.getId(), previous, BreakerState.OFF);
    }

    private void clearTrip(Circuit circuit) {
        circuit.setState(BreakerState.OFF);
        circuit.setErrorCount(0);
        circuit.setLastReset(clock.instant());
        circuit.setNextResetAt(null);
        circuit.setHealth(CircuitHealth.OFFLINE);
    }

    private void forceTrip(Panel panel, Instant now) {
        panel.setState(BreakerState.TRIPPED);
        panel.setTripCount(panel.getTripCount() + 1);
        panel.setLastTripped(now);
    }

    /**
     * @return true when a pending auto-reset was cancelled
     */
    private boolean forceTrip(Circuit circuit, Instant now) {
        boolean cancelled = autoResetScheduler.disarm(circuit);
        circuit.setState(BreakerState.TRIPPED);
        circuit.setTripCount(circuit.getTripCount() + 1);
        circuit.setLastTripped(now);
        circuit.setHealth(CircuitHealth.CRITICAL);
        return cancelled;
    }

    // ---------------------------------------------------------------- health

    private void refreshAfterChange(Panel panel) {
        healthClassifier.refresh(panel);
        refreshSystemStatus();
    }

    private void refreshSystemStatus() {
        MasterSwitch master = tree.masterSwitch();
        master.setSystemStatus(healthClassifier.classify(master, tree.panels()));
        tree.markHealthChecked(clock.instant());
        metricsService.updateTrippedCircuits(trippedCircuitCount());
    }

    private int trippedCircuitCount() {
        return (int) tree.circuits().filter(Circuit::isTripped).count();
    }

    private Panel owningPanel(Circuit circuit) {
        return tree.findPanelForCircuit(circuit.getId())
                .orElseThrow(() -> new IllegalStateException("Circuit " + circuit.getId() + " has no panel"));
    }

    private void bankUptime(MasterSwitch master, Instant now) {
        if (master.getStartTime() != null) {
            master.setUptime(master.getUptime().plus(Duration.between(master.getStartTime(), now)));
        }
    }

    private <T> T asActor(String actor, Supplier<T> operation) {
        String outer = MDC.get(MDC_ACTOR);
        MDC.put(MDC_ACTOR, actor);
        try {
            return tree.withLock(operation);
        } finally {
            if (outer == null) {
                MDC.remove(MDC_ACTOR);
            } else {
                MDC.put(MDC_ACTOR, outer);
            }
        }
    }

    private static String actorOrSystem(String actor) {
        return actor == null || actor.isBlank() ? SYSTEM_ACTOR : actor;
    }
}
