package com.circuitbox.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Rolling latency estimators for one circuit, in milliseconds.
 * p95 and p99 are decaying maxima, p50 is an exponential moving average.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LatencyMetrics {
    private double current;
    private double p50;
    private double p95;
    private double p99;
    private double maxAllowed;   // Ceiling for a healthy p95

    public static LatencyMetrics withCeiling(double maxAllowed) {
        return LatencyMetrics.builder().maxAllowed(maxAllowed).build();
    }
}
