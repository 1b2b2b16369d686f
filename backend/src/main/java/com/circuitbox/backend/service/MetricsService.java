package com.circuitbox.backend.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicInteger;

@Service
@Slf4j
public class MetricsService {

    private final MeterRegistry meterRegistry;
    private final AtomicInteger trippedCircuits = new AtomicInteger();

    private final Counter tripsCounter;
    private final Counter autoResetsCounter;
    private final Counter manualResetsCounter;
    private final Counter emergencyShutdownsCounter;
    private final Counter probeFailuresCounter;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.tripsCounter = Counter.builder("breaker_trips_total").register(meterRegistry);
        this.autoResetsCounter = Counter.builder("breaker_auto_resets_total").register(meterRegistry);
        this.manualResetsCounter = Counter.builder("breaker_manual_resets_total").register(meterRegistry);
        this.emergencyShutdownsCounter = Counter.builder("breaker_emergency_shutdowns_total").register(meterRegistry);
        this.probeFailuresCounter = Counter.builder("breaker_probe_failures_total").register(meterRegistry);
        Gauge.builder("breaker_tripped_circuits", trippedCircuits, AtomicInteger::get).register(meterRegistry);
    }

    public void recordTrip(String circuitId) {
        tripsCounter.increment();
        Counter.builder("breaker_circuit_trips_total")
                .tag("circuit", circuitId == null ? "unknown" : circuitId)
                .register(meterRegistry)
                .increment();
    }

    public void recordAutoReset() {
        autoResetsCounter.increment();
    }

    public void recordManualReset() {
        manualResetsCounter.increment();
    }

    public void recordEmergencyShutdown() {
        emergencyShutdownsCounter.increment();
    }

    public void recordProbeFailure() {
        probeFailuresCounter.increment();
    }

    public void updateTrippedCircuits(int count) {
        trippedCircuits.set(count);
    }

    public int getTrippedCircuits() {
        return trippedCircuits.get();
    }
}
