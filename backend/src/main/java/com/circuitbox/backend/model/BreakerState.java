package com.circuitbox.backend.model;

/**
 * Position of a panel or circuit breaker.
 * The master switch only ever uses ON and OFF.
 */
public enum BreakerState {
    ON,         // Energized, may carry traffic
    OFF,        // De-energized, ready to be switched on
    TRIPPED;    // Opened by a fault, lockout or emergency; needs a reset

    public boolean isEnergized() {
        return this == ON;
    }
}
