package com.circuitbox.backend.model;

/**
 * Kind of subsystem a circuit gates.
 */
public enum CircuitCategory {
    AI_AGENT,
    REPOSITORY,
    INTEGRATION,
    VOICE,
    DEPLOYMENT,
    DATABASE,
    STORAGE,
    AUTH,
    ANALYTICS,
    CUSTOM
}
