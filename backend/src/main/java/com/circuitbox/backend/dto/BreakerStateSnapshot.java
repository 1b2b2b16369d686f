package com.circuitbox.backend.dto;

import com.circuitbox.backend.model.CircuitHealth;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of the whole breaker tree. Nothing in here aliases live state.
 */
public record BreakerStateSnapshot(
        String instanceId,
        String version,
        MasterSwitchSnapshot masterSwitch,
        List<PanelSnapshot> panels,
        CircuitHealth overallHealth,
        int criticalAlerts,
        int warningAlerts,
        Instant lastHealthCheck,
        Instant capturedAt
) {
    public BreakerStateSnapshot {
        panels = List.copyOf(panels);
    }
}
