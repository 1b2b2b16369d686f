package com.circuitbox.backend.service.breaker;

import com.circuitbox.backend.model.Circuit;
import com.circuitbox.backend.model.MasterSwitch;
import com.circuitbox.backend.model.Panel;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * Owns the master switch, the panels in display order and an index from circuit id
 * to owning panel id. All access goes through {@link #withLock}; the accessors below
 * assume the caller already holds the lock.
 */
@Component
public class BreakerTree {

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Panel> panels = new ArrayList<>();
    private final Map<String, Panel> panelsById = new HashMap<>();
    private final Map<String, String> panelIdByCircuit = new HashMap<>();
    private MasterSwitch masterSwitch = MasterSwitch.builder().build();
    private Instant lastHealthCheck;

    public <T> T withLock(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(Runnable action) {
        withLock(() -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread() {
        return lock.isHeldByCurrentThread();
    }

    public MasterSwitch masterSwitch() {
        return masterSwitch;
    }

    public Instant lastHealthCheck() {
        return lastHealthCheck;
    }

    void markHealthChecked(Instant at) {
        lastHealthCheck = at;
    }

    public List<Panel> panels() {
        return Collections.unmodifiableList(panels);
    }

    public Stream<Circuit> circuits() {
        return panels.stream().flatMap(panel -> panel.getCircuits().stream());
    }

    public Optional<Panel> findPanel(String panelId) {
        return Optional.ofNullable(panelId).map(panelsById::get);
    }

    public Optional<Panel> findPanelForCircuit(String circuitId) {
        return Optional.ofNullable(circuitId).map(panelIdByCircuit::get).map(panelsById::get);
    }

    public Optional<Circuit> findCircuit(String circuitId) {
        return findPanelForCircuit(circuitId).flatMap(panel -> panel.getCircuits().stream()
                .filter(circuit -> circuit.getId().equals(circuitId))
                .findFirst());
    }

    public boolean containsPanel(String panelId) {
        return panelsById.containsKey(panelId);
    }

    public boolean containsCircuit(String circuitId) {
        return panelIdByCircuit.containsKey(circuitId);
    }

    public int panelCount() {
        return panels.size();
    }

    /**
     * Inserts after every panel with the same or a lower position, so equal positions keep
     * registration order.
     */
    void addPanel(Panel panel) {
        panels.add(panel);
        panels.sort(Comparator.comparingInt(Panel::getPosition));
        panelsById.put(panel.getId(), panel);
    }

    void addCircuit(Panel panel, Circuit circuit) {
        panel.getCircuits().add(circuit);
        panel.setTotalCircuits(panel.getCircuits().size());
        panelIdByCircuit.put(circuit.getId(), panel.getId());
    }

    void clear() {
        panels.clear();
        panelsById.clear();
        panelIdByCircuit.clear();
        masterSwitch = MasterSwitch.builder().build();
        lastHealthCheck = null;
    }
}
