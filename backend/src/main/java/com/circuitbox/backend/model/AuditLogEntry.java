package com.circuitbox.backend.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class AuditLogEntry {
    String id;
    Instant timestamp;
    String actor;
    String action;       // e.g. MASTER_ON, CIRCUIT_TRIP
    String target;       // Panel/circuit id or "masterSwitch"
    String previousValue;
    String newValue;
}
