package com.circuitbox.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SystemAlert {
    private String id;
    private AlertLevel level;
    private Instant timestamp;
    private String source;       // Circuit/panel id or "system"
    private String message;
    private boolean acknowledged;
    private String acknowledgedBy;
    private Instant acknowledgedAt;
}
