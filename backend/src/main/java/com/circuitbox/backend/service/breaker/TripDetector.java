package com.circuitbox.backend.service.breaker;

import com.circuitbox.backend.model.Circuit;
import com.circuitbox.backend.service.audit.AlertService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;

/**
 * Error accounting for a single circuit. Decides whether the trip threshold is reached,
 * the trip itself is performed by {@link CascadeController}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class TripDetector {

    private final AlertService alertService;
    private final Clock clock;

    public enum Outcome {
        BELOW_THRESHOLD,
        THRESHOLD_REACHED,
        ALREADY_TRIPPED
    }

    public Outcome recordError(Circuit circuit, String error, Double latencyMs) {
        circuit.setErrorCount(circuit.getErrorCount() + 1);
        circuit.setTotalErrors(circuit.getTotalErrors() + 1);
        circuit.setLastActivity(clock.instant());
        updateErrorRate(circuit);

        double ceiling = circuit.getLatency().getMaxAllowed();
        if (latencyMs != null && latencyMs > ceiling) {
            alertService.warning(circuit.getId(),
                    String.format(Locale.ROOT, "Latency threshold exceeded: %.0fms > %.0fms", latencyMs, ceiling));
        }

        int errors = circuit.getErrorCount();
        int threshold = circuit.getTripThreshold();
        if (errors < threshold) {
            alertService.warning(circuit.getId(), "Error " + errors + "/" + threshold + ": " + error);
            return Outcome.BELOW_THRESHOLD;
        }
        if (circuit.isTripped()) {
            log.debug("Circuit {} already tripped, error {} counted only", circuit.getId(), errors);
            return Outcome.ALREADY_TRIPPED;
        }
        return Outcome.THRESHOLD_REACHED;
    }

    /**
     * Error rate as a percentage of requests, left unchanged until the first request.
     */
    static void updateErrorRate(Circuit circuit) {
        if (circuit.getRequestCount() > 0) {
            circuit.setErrorRate(Math.min(100.0, (double) circuit.getTotalErrors() / circuit.getRequestCount() * 100.0));
        }
    }
}
