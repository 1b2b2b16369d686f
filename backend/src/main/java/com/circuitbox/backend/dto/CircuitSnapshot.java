package com.circuitbox.backend.dto;

import com.circuitbox.backend.model.BreakerState;
import com.circuitbox.backend.model.Circuit;
import com.circuitbox.backend.model.CircuitCategory;
import com.circuitbox.backend.model.CircuitHealth;
import com.circuitbox.backend.model.LatencyMetrics;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record CircuitSnapshot(
        String id,
        String name,
        String description,
        CircuitCategory category,
        String endpoint,
        Map<String, Object> settings,
        BreakerState state,
        int errorCount,
        int tripCount,
        int tripThreshold,
        Duration cooldown,
        Instant lastTripped,
        Instant lastReset,
        Instant nextResetAt,
        CircuitHealth health,
        LatencySnapshot latency,
        long requestCount,
        long totalErrors,
        double errorRate,
        int load,
        Instant lastActivity,
        Instant lastCheck,
        Instant createdAt
) {

    public record LatencySnapshot(double current, double p50, double p95, double p99, double maxAllowed) {
        static LatencySnapshot from(LatencyMetrics metrics) {
            return new LatencySnapshot(metrics.getCurrent(), metrics.getP50(), metrics.getP95(),
                    metrics.getP99(), metrics.getMaxAllowed());
        }
    }

    public static CircuitSnapshot from(Circuit circuit) {
        return new CircuitSnapshot(
                circuit.getId(),
                circuit.getName(),
                circuit.getDescription(),
                circuit.getCategory(),
                circuit.getEndpoint(),
                Collections.unmodifiableMap(new LinkedHashMap<>(circuit.getSettings())),
                circuit.getState(),
                circuit.getErrorCount(),
                circuit.getTripCount(),
                circuit.getTripThreshold(),
                circuit.getCooldown(),
                circuit.getLastTripped(),
                circuit.getLastReset(),
                circuit.getNextResetAt(),
                circuit.getHealth(),
                LatencySnapshot.from(circuit.getLatency()),
                circuit.getRequestCount(),
                circuit.getTotalErrors(),
                circuit.getErrorRate(),
                circuit.getLoad(),
                circuit.getLastActivity(),
                circuit.getLastCheck(),
                circuit.getCreatedAt()
        );
    }
}
