package com.circuitbox.backend.service.audit;

import com.circuitbox.backend.model.AuditLogEntry;
import com.circuitbox.backend.model.SystemAlert;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Writes flushed audit history as JSON lines to the {@code circuitbox.audit} logger,
 * so a log shipper can persist it.
 */
@Component
@ConditionalOnProperty(prefix = "circuitbox.audit", name = "log-sink-enabled", havingValue = "true")
public class JsonLogAuditSink implements AuditSink {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("circuitbox.audit");

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    public void flush(List<AuditLogEntry> entries, List<SystemAlert> alerts) {
        for (AuditLogEntry entry : entries) {
            AUDIT_LOG.info(toJson("audit", entry));
        }
        for (SystemAlert alert : alerts) {
            AUDIT_LOG.info(toJson("alert", alert));
        }
    }

    String toJson(String kind, Object record) {
        try {
            return objectMapper.writeValueAsString(new JsonRecord(kind, record));
        } catch (JsonProcessingException e) {
            AUDIT_LOG.warn("Failed to serialize {} record: {}", kind, e.getMessage());
            return "{\"kind\":\"" + kind + "\",\"error\":\"serialization\"}";
        }
    }

    record JsonRecord(String kind, Object payload) {}
}
