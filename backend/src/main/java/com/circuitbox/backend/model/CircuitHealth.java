package com.circuitbox.backend.model;

public enum CircuitHealth {
    HEALTHY,
    DEGRADED,
    CRITICAL,
    OFFLINE
}
