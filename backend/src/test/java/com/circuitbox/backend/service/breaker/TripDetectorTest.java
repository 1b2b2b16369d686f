package com.circuitbox.backend.service.breaker;

import com.circuitbox.backend.model.BreakerState;
import com.circuitbox.backend.model.Circuit;
import com.circuitbox.backend.model.LatencyMetrics;
import com.circuitbox.backend.service.audit.AlertService;
import com.circuitbox.backend.support.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class TripDetectorTest {

    private final AlertService alertService = mock(AlertService.class);
    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"));
    private final TripDetector detector = new TripDetector(alertService, clock);

    @Test
    void warnsBelowThresholdAndSignalsTripAtThreshold() {
        Circuit circuit = circuit(BreakerState.ON);

        for (int i = 1; i < 5; i++) {
            assertThat(detector.recordError(circuit, "timeout", null)).isEqualTo(TripDetector.Outcome.BELOW_THRESHOLD);
        }
        verify(alertService).warning("c1", "Error 4/5: timeout");

        assertThat(detector.recordError(circuit, "timeout", null)).isEqualTo(TripDetector.Outcome.THRESHOLD_REACHED);
        assertThat(circuit.getErrorCount()).isEqualTo(5);
        assertThat(circuit.getLastActivity()).isEqualTo(clock.instant());
    }

    @Test
    void trippedCircuitIsNotSignalledAgain() {
        Circuit circuit = circuit(BreakerState.TRIPPED);
        circuit.setErrorCount(5);

        assertThat(detector.recordError(circuit, "timeout", null)).isEqualTo(TripDetector.Outcome.ALREADY_TRIPPED);
        assertThat(circuit.getErrorCount()).isEqualTo(6);
    }

    @Test
    void errorRateIsShareOfRequests() {
        Circuit circuit = circuit(BreakerState.ON);
        detector.recordError(circuit, "first", null);
        assertThat(circuit.getErrorRate()).isZero();

        circuit.setRequestCount(20);
        detector.recordError(circuit, "second", null);

        assertThat(circuit.getTotalErrors()).isEqualTo(2);
        assertThat(circuit.getErrorRate()).isEqualTo(10.0);
    }

    @Test
    void errorRateIsCappedAtOneHundredPercent() {
        Circuit circuit = circuit(BreakerState.ON);
        circuit.setRequestCount(2);

        detector.recordError(circuit, "a", null);
        detector.recordError(circuit, "b", null);
        detector.recordError(circuit, "c", null);

        assertThat(circuit.getTotalErrors()).isEqualTo(3);
        assertThat(circuit.getErrorRate()).isEqualTo(100.0);
    }

    @Test
    void slowFailureRaisesLatencyWarning() {
        Circuit circuit = circuit(BreakerState.ON);

        detector.recordError(circuit, "slow", 40.0);
        verify(alertService, never()).warning(eq("c1"), startsWith("Latency"));

        detector.recordError(circuit, "slow", 75.0);
        verify(alertService).warning("c1", "Latency threshold exceeded: 75ms > 50ms");
    }

    @Test
    void thresholdFollowsCircuitConfiguration() {
        Circuit circuit = circuit(BreakerState.ON);
        circuit.setTripThreshold(2);

        detector.recordError(circuit, "a", null);
        assertThat(detector.recordError(circuit, "b", null)).isEqualTo(TripDetector.Outcome.THRESHOLD_REACHED);
        verify(alertService).warning("c1", "Error 1/2: a");
    }

    private static Circuit circuit(BreakerState state) {
        return Circuit.builder()
                .id("c1")
                .state(state)
                .tripThreshold(5)
                .latency(LatencyMetrics.withCeiling(50))
                .build();
    }
}
