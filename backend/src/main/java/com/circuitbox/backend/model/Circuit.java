package com.circuitbox.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-subsystem breaker. Owned by exactly one {@link Panel}; the owning panel is
 * resolved through the breaker tree index, never stored here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Circuit {

    private String id;
    private String name;
    private String description;
    private CircuitCategory category;
    private String endpoint;
    @Builder.Default
    private Map<String, Object> settings = new LinkedHashMap<>();

    // Breaker
    @Builder.Default
    private BreakerState state = BreakerState.OFF;
    private int errorCount;          // Errors since the last reset
    private int tripCount;
    private int tripThreshold;
    private Duration cooldown;
    private Instant lastTripped;
    private Instant lastReset;
    private Instant nextResetAt;     // Only while a cooldown timer is armed

    // Health & metrics
    @Builder.Default
    private CircuitHealth health = CircuitHealth.OFFLINE;
    private LatencyMetrics latency;
    private long requestCount;
    private long totalErrors;        // Lifetime error tally, never reset
    private double errorRate;        // Percentage 0-100
    private int load;                // 0-100
    private Instant lastActivity;
    private Instant lastCheck;
    private Instant createdAt;

    public boolean isTripped() {
        return state == BreakerState.TRIPPED;
    }
}
