package com.circuitbox.backend.config;

import com.circuitbox.backend.dto.CircuitDescriptor;
import com.circuitbox.backend.dto.PanelDescriptor;
import com.circuitbox.backend.service.breaker.BreakerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Registers the panels and circuits declared under {@code circuitbox.bootstrap} on startup
 * and optionally powers the master switch on.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TopologyInitializer implements CommandLineRunner {

    private final BreakerRegistry breakerRegistry;
    private final CircuitBoxProperties properties;

    @Override
    public void run(String... args) {
        CircuitBoxProperties.Bootstrap bootstrap = properties.getBootstrap();
        if (!bootstrap.isEnabled()) {
            log.info("Topology bootstrap disabled");
            return;
        }
        int panels = 0;
        int circuits = 0;
        for (CircuitBoxProperties.PanelDefinition panel : bootstrap.getPanels()) {
            PanelDescriptor descriptor = new PanelDescriptor(panel.getId(), panel.getName(),
                    panel.getDescription(), panel.getPosition(), panel.getMaxCircuits());
            if (breakerRegistry.addPanel(descriptor).isEmpty()) {
                log.warn("Skipping circuits of panel {}, registration rejected", panel.getId());
                continue;
            }
            panels++;
            for (CircuitBoxProperties.CircuitDefinition circuit : panel.getCircuits()) {
                CircuitDescriptor circuitDescriptor = new CircuitDescriptor(circuit.getId(), circuit.getName(),
                        circuit.getDescription(), circuit.getCategory(), circuit.getEndpoint(), circuit.getSettings());
                if (breakerRegistry.addCircuit(panel.getId(), circuitDescriptor).isPresent()) {
                    circuits++;
                }
            }
        }
        log.info("✅ Topology bootstrapped: {} panels, {} circuits", panels, circuits);

        if (bootstrap.isPowerOn()) {
            breakerRegistry.masterOn("system");
        }
    }
}
