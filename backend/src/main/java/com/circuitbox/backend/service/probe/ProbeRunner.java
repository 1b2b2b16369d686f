package com.circuitbox.backend.service.probe;

import com.circuitbox.backend.dto.CircuitDescriptor;
import com.circuitbox.backend.dto.ProbeResult;
import io.github.resilience4j.timelimiter.TimeLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;

/**
 * Runs the {@link HealthProbe} on the probe executor under a time limit and folds every
 * way it can go wrong into a {@link ProbeOutcome}.
 * <p>
 * Callers probe while holding the breaker tree lock, so every probe of a cascade adds up to
 * {@code circuitbox.probe.timeout-ms} of lock hold time. Readers and due auto-resets wait
 * behind it; keep the timeout short.
 */
@Service
@Slf4j
public class ProbeRunner {

    private final HealthProbe healthProbe;
    private final TimeLimiter probeTimeLimiter;
    private final Executor probeExecutor;

    public ProbeRunner(HealthProbe healthProbe,
                       TimeLimiter probeTimeLimiter,
                       @Qualifier("probeExecutor") Executor probeExecutor) {
        this.healthProbe = healthProbe;
        this.probeTimeLimiter = probeTimeLimiter;
        this.probeExecutor = probeExecutor;
    }

    public record ProbeOutcome(boolean success, long latencyMs, String failure) {

        static ProbeOutcome succeeded(long latencyMs) {
            return new ProbeOutcome(true, latencyMs, null);
        }

        static ProbeOutcome failed(String failure, long latencyMs) {
            return new ProbeOutcome(false, latencyMs, failure);
        }
    }

    public ProbeOutcome run(CircuitDescriptor circuit) {
        long started = System.nanoTime();
        try {
            ProbeResult result = probeTimeLimiter.executeFutureSupplier(
                    () -> CompletableFuture.supplyAsync(() -> healthProbe.probe(circuit), probeExecutor));
            if (result == null) {
                return ProbeOutcome.failed("Probe returned no result", elapsedMs(started));
            }
            if (!result.reachable()) {
                return ProbeOutcome.failed("Circuit unreachable", result.latencyMs());
            }
            return ProbeOutcome.succeeded(result.latencyMs());
        } catch (TimeoutException e) {
            log.warn("Health probe timed out for circuit {} after {}", circuit.id(),
                    probeTimeLimiter.getTimeLimiterConfig().getTimeoutDuration());
            return ProbeOutcome.failed("Probe timed out", elapsedMs(started));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ProbeOutcome.failed("Probe interrupted", elapsedMs(started));
        } catch (Exception e) {
            log.warn("Health probe failed for circuit {}: {}", circuit.id(), e.getMessage());
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ProbeOutcome.failed("Probe failed: " + message, elapsedMs(started));
        }
    }

    private long elapsedMs(long startedNanos) {
        return (System.nanoTime() - startedNanos) / 1_000_000;
    }
}
