package com.circuitbox.backend.dto;

import com.circuitbox.backend.model.BreakerState;
import com.circuitbox.backend.model.CircuitHealth;
import com.circuitbox.backend.model.Panel;

import java.time.Instant;
import java.util.List;

public record PanelSnapshot(
        String id,
        String name,
        String description,
        int position,
        int maxCircuits,
        BreakerState state,
        boolean lockedOut,
        int tripCount,
        Instant lastTripped,
        CircuitHealth health,
        int activeCircuits,
        int totalCircuits,
        List<CircuitSnapshot> circuits
) {
    public static PanelSnapshot from(Panel panel) {
        return new PanelSnapshot(
                panel.getId(),
                panel.getName(),
                panel.getDescription(),
                panel.getPosition(),
                panel.getMaxCircuits(),
                panel.getState(),
                panel.isLockedOut(),
                panel.getTripCount(),
                panel.getLastTripped(),
                panel.getHealth(),
                panel.getActiveCircuits(),
                panel.getTotalCircuits(),
                panel.getCircuits().stream().map(CircuitSnapshot::from).toList()
        );
    }
}
