package com.circuitbox.backend.service.probe;

import com.circuitbox.backend.dto.CircuitDescriptor;
import com.circuitbox.backend.dto.ProbeResult;

/**
 * Checks whether the subsystem behind a circuit is reachable. Called once every time
 * a circuit is switched on. Implementations may throw
 * {@link com.circuitbox.backend.exception.ProbeException}; any failure counts as an
 * error against the circuit.
 */
public interface HealthProbe {

    ProbeResult probe(CircuitDescriptor circuit);
}
