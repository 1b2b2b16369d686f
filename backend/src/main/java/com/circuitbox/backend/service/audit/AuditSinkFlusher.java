package com.circuitbox.backend.service.audit;

import com.circuitbox.backend.config.CircuitBoxProperties;
import com.circuitbox.backend.model.AuditLogEntry;
import com.circuitbox.backend.model.SystemAlert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Queues audit entries and alerts for the registered {@link AuditSink}s and hands
 * them over in batches. Nothing is queued while no sink is registered.
 */
@Service
@Slf4j
public class AuditSinkFlusher {

    private final ObjectProvider<AuditSink> sinks;
    private final int maxPending;
    private final ArrayDeque<AuditLogEntry> pendingEntries = new ArrayDeque<>();
    private final ArrayDeque<SystemAlert> pendingAlerts = new ArrayDeque<>();
    private long dropped;

    public AuditSinkFlusher(ObjectProvider<AuditSink> sinks, CircuitBoxProperties properties) {
        this.sinks = sinks;
        this.maxPending = properties.getAudit().getCapacity();
    }

    public synchronized void offer(AuditLogEntry entry) {
        if (!hasSinks()) {
            return;
        }
        pendingEntries.addLast(entry);
        if (pendingEntries.size() > maxPending) {
            pendingEntries.removeFirst();
            dropped++;
        }
    }

    public synchronized void offer(SystemAlert alert) {
        if (!hasSinks()) {
            return;
        }
        pendingAlerts.addLast(alert.toBuilder().build());
        if (pendingAlerts.size() > maxPending) {
            pendingAlerts.removeFirst();
            dropped++;
        }
    }

    @Scheduled(fixedDelayString = "${circuitbox.audit.flush-interval-ms:5000}")
    public void flush() {
        List<AuditLogEntry> entries;
        List<SystemAlert> alerts;
        synchronized (this) {
            if (pendingEntries.isEmpty() && pendingAlerts.isEmpty()) {
                return;
            }
            entries = new ArrayList<>(pendingEntries);
            alerts = new ArrayList<>(pendingAlerts);
            pendingEntries.clear();
            pendingAlerts.clear();
            if (dropped > 0) {
                log.warn("Audit sink backlog overflowed, {} records were dropped before flush", dropped);
                dropped = 0;
            }
        }
        sinks.orderedStream().forEach(sink -> {
            try {
                sink.flush(List.copyOf(entries), List.copyOf(alerts));
            } catch (Exception e) {
                log.warn("Audit sink {} failed to flush {} entries and {} alerts: {}",
                        sink.getClass().getSimpleName(), entries.size(), alerts.size(), e.getMessage());
            }
        });
    }

    public synchronized int pendingCount() {
        return pendingEntries.size() + pendingAlerts.size();
    }

    public synchronized void clear() {
        pendingEntries.clear();
        pendingAlerts.clear();
        dropped = 0;
    }

    private boolean hasSinks() {
        return sinks.orderedStream().findAny().isPresent();
    }
}
