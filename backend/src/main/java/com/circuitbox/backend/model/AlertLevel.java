package com.circuitbox.backend.model;

public enum AlertLevel {
    INFO,
    WARNING,
    ALERT,
    CRITICAL;

    /**
     * Alerts that count towards the unacknowledged critical tally.
     */
    public boolean isCritical() {
        return this == ALERT || this == CRITICAL;
    }
}
