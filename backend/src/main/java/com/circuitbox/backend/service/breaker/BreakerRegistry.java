package com.circuitbox.backend.service.breaker;

import com.circuitbox.backend.config.CircuitBoxProperties;
import com.circuitbox.backend.dto.BreakerStateSnapshot;
import com.circuitbox.backend.dto.CircuitDescriptor;
import com.circuitbox.backend.dto.CircuitSnapshot;
import com.circuitbox.backend.dto.MasterSwitchSnapshot;
import com.circuitbox.backend.dto.PanelDescriptor;
import com.circuitbox.backend.dto.PanelSnapshot;
import com.circuitbox.backend.model.AuditLogEntry;
import com.circuitbox.backend.model.BreakerState;
import com.circuitbox.backend.model.Circuit;
import com.circuitbox.backend.model.LatencyMetrics;
import com.circuitbox.backend.model.MasterSwitch;
import com.circuitbox.backend.model.Panel;
import com.circuitbox.backend.model.SystemAlert;
import com.circuitbox.backend.service.audit.AlertService;
import com.circuitbox.backend.service.audit.AuditSinkFlusher;
import com.circuitbox.backend.service.audit.AuditTrailService;
import jakarta.annotation.PreDestroy;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point of the control plane. Owns registration and lookups, hands state changes to
 * {@link CascadeController} and only ever returns immutable snapshots of the tree.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BreakerRegistry {

    private final BreakerTree tree;
    private final CascadeController controller;
    private final AutoResetScheduler autoResetScheduler;
    private final AlertService alertService;
    private final AuditTrailService auditTrailService;
    private final AuditSinkFlusher sinkFlusher;
    private final CircuitBoxProperties properties;
    private final Clock clock;

    @Getter
    private final String instanceId = UUID.randomUUID().toString();

    // ---------------------------------------------------------------- registration

    /**
     * Registers an OFF, unlocked panel. Without an explicit position it is appended.
     *
     * @return empty when the id is missing or already registered
     */
    public Optional<PanelSnapshot> addPanel(PanelDescriptor descriptor) {
        return tree.withLock(() -> {
            if (descriptor == null || descriptor.id() == null || descriptor.id().isBlank()) {
                alertService.warning(CascadeController.SYSTEM_ACTOR, "Cannot add panel without an id");
                return Optional.empty();
            }
            if (tree.containsPanel(descriptor.id())) {
                alertService.warning(CascadeController.SYSTEM_ACTOR, "Panel already registered: " + descriptor.id());
                return Optional.empty();
            }
            Panel panel = Panel.builder()
                    .id(descriptor.id())
                    .name(descriptor.name() != null ? descriptor.name() : descriptor.id())
                    .description(descriptor.description())
                    .position(descriptor.position() != null ? descriptor.position() : tree.panelCount() + 1)
                    .maxCircuits(descriptor.maxCircuits() != null
                            ? descriptor.maxCircuits()
                            : properties.getBreaker().getMaxCircuitsPerPanel())
                    .build();
            tree.addPanel(panel);
            log.info("Panel {} registered at position {}", panel.getId(), panel.getPosition());
            auditTrailService.record(CascadeController.SYSTEM_ACTOR, "PANEL_ADDED", panel.getId(), null, panel.getName());
            return Optional.of(PanelSnapshot.from(panel));
        });
    }

    /**
     * Registers an OFF circuit on a panel.
     *
     * @return empty when the panel is unknown or full, or the circuit id is taken anywhere in the tree
     */
    public Optional<CircuitSnapshot> addCircuit(String panelId, CircuitDescriptor descriptor) {
        return tree.withLock(() -> {
            Panel panel = tree.findPanel(panelId).orElse(null);
            if (panel == null) {
                alertService.warning(CascadeController.SYSTEM_ACTOR, "Cannot add circuit - Panel not found: " + panelId);
                return Optional.empty();
            }
            if (descriptor == null || descriptor.id() == null || descriptor.id().isBlank()) {
                alertService.warning(panelId, "Cannot add circuit without an id");
                return Optional.empty();
            }
            if (panel.isAtCapacity()) {
                alertService.warning(panelId, "Panel at max capacity: " + panel.getMaxCircuits());
                return Optional.empty();
            }
            if (tree.containsCircuit(descriptor.id())) {
                alertService.warning(panelId, "Circuit already registered: " + descriptor.id());
                return Optional.empty();
            }

            CircuitBoxProperties.Breaker defaults = properties.getBreaker();
            Instant now = clock.instant();
            Circuit circuit = Circuit.builder()
                    .id(descriptor.id())
                    .name(descriptor.name() != null ? descriptor.name() : descriptor.id())
                    .description(descriptor.description())
                    .category(descriptor.category())
                    .endpoint(descriptor.endpoint())
                    .settings(new LinkedHashMap<>(descriptor.settings()))
                    .tripThreshold(defaults.getTripThreshold())
                    .cooldown(Duration.ofSeconds(defaults.getCooldownSeconds()))
                    .latency(LatencyMetrics.withCeiling(defaults.getMaxLatencyMs()))
                    .lastActivity(now)
                    .lastCheck(now)
                    .createdAt(now)
                    .build();
            tree.addCircuit(panel, circuit);
            log.info("Circuit {} registered on panel {}", circuit.getId(), panelId);
            auditTrailService.record(CascadeController.SYSTEM_ACTOR, "CIRCUIT_ADDED", circuit.getId(), null, panelId);
            return Optional.of(CircuitSnapshot.from(circuit));
        });
    }

    // ---------------------------------------------------------------- control

    public boolean masterOn(String actor) {
        return controller.masterOn(actor);
    }

    public boolean masterOff(String actor) {
        return controller.masterOff(actor);
    }

    public void emergencyShutdown(String actor, String reason) {
        controller.emergencyShutdown(actor, reason);
    }

    public boolean setPanelState(String panelId, BreakerState state, String actor) {
        return controller.setPanelState(panelId, state, actor);
    }

    public boolean lockoutPanel(String panelId, String actor, String reason) {
        return controller.lockoutPanel(panelId, actor, reason);
    }

    public boolean resetPanelLockout(String panelId, String actor) {
        return controller.resetPanelLockout(panelId, actor);
    }

    public boolean setCircuitState(String circuitId, BreakerState state, String actor) {
        return controller.setCircuitState(circuitId, state, actor);
    }

    public boolean tripCircuit(String circuitId, String reason) {
        return controller.tripCircuit(circuitId, reason);
    }

    public boolean resetCircuitBreaker(String circuitId, String actor) {
        return controller.resetCircuitBreaker(circuitId, actor);
    }

    public boolean reportError(String circuitId, String error) {
        return controller.reportError(circuitId, error, null);
    }

    public boolean reportError(String circuitId, String error, Double latencyMs) {
        return controller.reportError(circuitId, error, latencyMs);
    }

    public boolean recordRequest(String circuitId, double latencyMs) {
        return controller.recordRequest(circuitId, latencyMs);
    }

    public boolean acknowledgeAlert(String alertId, String actor) {
        boolean acknowledged = alertService.acknowledge(alertId, actor);
        if (acknowledged) {
            auditTrailService.record(actor, "ALERT_ACKNOWLEDGED", alertId, false, true);
        }
        return acknowledged;
    }

    // ---------------------------------------------------------------- lookups

    public Optional<PanelSnapshot> getPanel(String panelId) {
        return tree.withLock(() -> tree.findPanel(panelId).map(PanelSnapshot::from));
    }

    public Optional<CircuitSnapshot> getCircuit(String circuitId) {
        return tree.withLock(() -> tree.findCircuit(circuitId).map(CircuitSnapshot::from));
    }

    public Optional<PanelSnapshot> getPanelForCircuit(String circuitId) {
        return tree.withLock(() -> tree.findPanelForCircuit(circuitId).map(PanelSnapshot::from));
    }

    public List<PanelSnapshot> getPanels() {
        return tree.withLock(() -> tree.panels().stream().map(PanelSnapshot::from).toList());
    }

    public MasterSwitchSnapshot getMasterSwitch() {
        return tree.withLock(() -> MasterSwitchSnapshot.from(tree.masterSwitch()));
    }

    public boolean isPoweredOn() {
        return tree.withLock(() -> tree.masterSwitch().isOn());
    }

    /**
     * Banked uptime of all past sessions, plus the running session while the master switch is ON.
     */
    public Duration getUptime() {
        return tree.withLock(() -> {
            MasterSwitch master = tree.masterSwitch();
            if (master.isOn() && master.getStartTime() != null) {
                return master.getUptime().plus(Duration.between(master.getStartTime(), clock.instant()));
            }
            return master.getUptime();
        });
    }

    public BreakerStateSnapshot getState() {
        return tree.withLock(() -> {
            MasterSwitch master = tree.masterSwitch();
            return new BreakerStateSnapshot(
                    instanceId,
                    properties.getVersion(),
                    MasterSwitchSnapshot.from(master),
                    tree.panels().stream().map(PanelSnapshot::from).toList(),
                    master.getSystemStatus().toHealth(),
                    alertService.getCriticalAlerts(),
                    alertService.getWarningAlerts(),
                    tree.lastHealthCheck(),
                    clock.instant());
        });
    }

    public List<SystemAlert> getAlerts() {
        return alertService.getAlerts();
    }

    public List<AuditLogEntry> getAuditLog() {
        return auditTrailService.getEntries();
    }

    public int pendingAutoResets() {
        return autoResetScheduler.armedCount();
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Drops the whole tree, every pending timer and both logs.
     */
    public void reset() {
        tree.runLocked(() -> {
            int cancelled = autoResetScheduler.disarmAll();
            tree.clear();
            alertService.clear();
            auditTrailService.clear();
            sinkFlusher.clear();
            log.info("Breaker registry reset, {} pending auto-resets cancelled", cancelled);
        });
    }

    @PreDestroy
    public void shutdown() {
        int cancelled = tree.withLock(autoResetScheduler::disarmAll);
        log.info("Breaker registry shut down, {} pending auto-resets cancelled", cancelled);
    }
}
