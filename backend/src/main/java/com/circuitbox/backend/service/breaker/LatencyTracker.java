package com.circuitbox.backend.service.breaker;

import com.circuitbox.backend.model.Circuit;
import com.circuitbox.backend.model.LatencyMetrics;
import com.circuitbox.backend.service.audit.AlertService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;

/**
 * Constant-time latency estimators. p50 is an exponential moving average, p95 and p99
 * are decaying maxima.
 */
@Component
@RequiredArgsConstructor
public class LatencyTracker {

    static final double P50_DECAY = 0.9;
    static final double P95_DECAY = 0.95;
    static final double P99_DECAY = 0.99;

    private final AlertService alertService;
    private final Clock clock;

    public void recordRequest(Circuit circuit, double latencyMs) {
        circuit.setRequestCount(circuit.getRequestCount() + 1);
        circuit.setLastActivity(clock.instant());

        LatencyMetrics latency = circuit.getLatency();
        latency.setCurrent(latencyMs);
        latency.setP50(latency.getP50() * P50_DECAY + latencyMs * (1 - P50_DECAY));
        latency.setP95(Math.max(latency.getP95() * P95_DECAY, latencyMs));
        latency.setP99(Math.max(latency.getP99() * P99_DECAY, latencyMs));

        if (latency.getP95() > latency.getMaxAllowed()) {
            alertService.warning(circuit.getId(),
                    String.format(Locale.ROOT, "P95 latency exceeds threshold: %.1fms", latency.getP95()));
        }

        TripDetector.updateErrorRate(circuit);
        circuit.setLoad((int) Math.min(100, circuit.getRequestCount() % 100));
    }
}
