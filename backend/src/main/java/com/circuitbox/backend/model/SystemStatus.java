package com.circuitbox.backend.model;

public enum SystemStatus {
    OPTIMAL,
    DEGRADED,
    CRITICAL,
    OFFLINE;

    public CircuitHealth toHealth() {
        return switch (this) {
            case OPTIMAL -> CircuitHealth.HEALTHY;
            case DEGRADED -> CircuitHealth.DEGRADED;
            case CRITICAL -> CircuitHealth.CRITICAL;
            case OFFLINE -> CircuitHealth.OFFLINE;
        };
    }
}
