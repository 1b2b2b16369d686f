package com.circuitbox.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Group breaker owning an ordered list of circuits.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Panel {

    private String id;
    private String name;
    private String description;
    private int position;            // Display order, 1-based
    private int maxCircuits;

    @Builder.Default
    private BreakerState state = BreakerState.OFF;
    private boolean lockedOut;       // Cleared only by resetPanelLockout
    private int tripCount;
    private Instant lastTripped;

    @Builder.Default
    private List<Circuit> circuits = new ArrayList<>();

    @Builder.Default
    private CircuitHealth health = CircuitHealth.OFFLINE;
    private int activeCircuits;
    private int totalCircuits;

    public boolean isAtCapacity() {
        return circuits.size() >= maxCircuits;
    }
}
