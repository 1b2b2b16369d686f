package com.circuitbox.backend.service.breaker;

import com.circuitbox.backend.model.BreakerState;
import com.circuitbox.backend.model.Circuit;
import com.circuitbox.backend.model.CircuitHealth;
import com.circuitbox.backend.model.LatencyMetrics;
import com.circuitbox.backend.model.MasterSwitch;
import com.circuitbox.backend.model.Panel;
import com.circuitbox.backend.model.SystemStatus;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Derives health bottom-up: circuit from its state and live metrics, panel from its
 * circuits, system status from the panels.
 */
@Component
public class HealthClassifier {

    static final double CRITICAL_ERROR_RATE = 10.0;
    static final double DEGRADED_ERROR_RATE = 5.0;

    public CircuitHealth classify(Circuit circuit) {
        if (circuit.getState() == BreakerState.TRIPPED) {
            return CircuitHealth.CRITICAL;
        }
        if (circuit.getState() == BreakerState.OFF) {
            return CircuitHealth.OFFLINE;
        }
        LatencyMetrics latency = circuit.getLatency();
        double errorRate = circuit.getErrorRate();
        if (errorRate > CRITICAL_ERROR_RATE || latency.getP95() > latency.getMaxAllowed() * 2) {
            return CircuitHealth.CRITICAL;
        }
        if (errorRate > DEGRADED_ERROR_RATE || latency.getP95() > latency.getMaxAllowed()) {
            return CircuitHealth.DEGRADED;
        }
        return CircuitHealth.HEALTHY;
    }

    /**
     * Recomputes active/total counts and health of a panel from its circuits.
     */
    public void refresh(Panel panel) {
        List<Circuit> circuits = panel.getCircuits();
        int active = (int) circuits.stream().filter(c -> c.getState() == BreakerState.ON).count();
        int healthy = (int) circuits.stream().filter(c -> c.getHealth() == CircuitHealth.HEALTHY).count();
        boolean anyCritical = circuits.stream().anyMatch(c -> c.getHealth() == CircuitHealth.CRITICAL);

        panel.setActiveCircuits(active);
        panel.setTotalCircuits(circuits.size());

        if (panel.getState() != BreakerState.ON || panel.isLockedOut()) {
            panel.setHealth(CircuitHealth.OFFLINE);
        } else if (anyCritical) {
            panel.setHealth(CircuitHealth.CRITICAL);
        } else if (healthy < active) {
            panel.setHealth(CircuitHealth.DEGRADED);
        } else {
            panel.setHealth(CircuitHealth.HEALTHY);
        }
    }

    public SystemStatus classify(MasterSwitch masterSwitch, List<Panel> panels) {
        if (!masterSwitch.isOn()) {
            return SystemStatus.OFFLINE;
        }
        long panelsOn = panels.stream().filter(p -> p.getState() == BreakerState.ON).count();
        long panelsHealthy = panels.stream().filter(p -> p.getHealth() == CircuitHealth.HEALTHY).count();
        boolean anyCritical = panels.stream().anyMatch(p -> p.getHealth() == CircuitHealth.CRITICAL);

        if (masterSwitch.isEmergencyShutdown() || anyCritical) {
            return SystemStatus.CRITICAL;
        }
        if (panelsHealthy < panelsOn) {
            return SystemStatus.DEGRADED;
        }
        return SystemStatus.OPTIMAL;
    }
}
