package com.circuitbox.backend.service.audit;

import com.circuitbox.backend.model.AuditLogEntry;
import com.circuitbox.backend.model.SystemAlert;

import java.util.List;

/**
 * Durable storage for audit history. Receives batches, oldest first.
 * Without a sink, history lives only in the bounded in-memory buffers.
 */
public interface AuditSink {

    void flush(List<AuditLogEntry> entries, List<SystemAlert> alerts);
}
