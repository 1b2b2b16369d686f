package com.circuitbox.backend.service.audit;

import com.circuitbox.backend.config.CircuitBoxProperties;
import com.circuitbox.backend.model.AuditLogEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Append-only record of every control-plane mutation, capped at the configured capacity.
 */
@Service
@Slf4j
public class AuditTrailService {

    private final Clock clock;
    private final AuditSinkFlusher sinkFlusher;
    private final BoundedLog<AuditLogEntry> entries;

    public AuditTrailService(Clock clock, AuditSinkFlusher sinkFlusher, CircuitBoxProperties properties) {
        this.clock = clock;
        this.sinkFlusher = sinkFlusher;
        this.entries = new BoundedLog<>(properties.getAudit().getCapacity());
    }

    public AuditLogEntry record(String actor, String action, String target, Object previousValue, Object newValue) {
        AuditLogEntry entry = AuditLogEntry.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(clock.instant())
                .actor(actor != null ? actor : "system")
                .action(action)
                .target(target)
                .previousValue(previousValue == null ? null : Objects.toString(previousValue))
                .newValue(newValue == null ? null : Objects.toString(newValue))
                .build();
        synchronized (this) {
            entries.append(entry);
        }
        sinkFlusher.offer(entry);
        log.debug("Audit {} {} by {}: {} -> {}", entry.getAction(), entry.getTarget(), entry.getActor(),
                entry.getPreviousValue(), entry.getNewValue());
        return entry;
    }

    /**
     * @return entries, newest first
     */
    public synchronized List<AuditLogEntry> getEntries() {
        return entries.newestFirst();
    }

    public synchronized int size() {
        return entries.size();
    }

    public synchronized void clear() {
        entries.clear();
    }
}
