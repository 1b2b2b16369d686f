package com.circuitbox.backend.service.audit;

import com.circuitbox.backend.config.CircuitBoxProperties;
import com.circuitbox.backend.model.AlertLevel;
import com.circuitbox.backend.model.AuditLogEntry;
import com.circuitbox.backend.model.SystemAlert;
import com.circuitbox.backend.support.TestProviders;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AuditSinkFlusherTest {

    private final CircuitBoxProperties properties = new CircuitBoxProperties();

    @Test
    void queuesNothingWithoutSinks() {
        AuditSinkFlusher flusher = new AuditSinkFlusher(TestProviders.providerOf(), properties);

        flusher.offer(entry("MASTER_ON"));

        assertThat(flusher.pendingCount()).isZero();
    }

    @Test
    void flushesBatchesToEverySinkAndSurvivesFailures() {
        List<String> flushed = new ArrayList<>();
        AuditSink failing = (entries, alerts) -> {
            throw new IllegalStateException("disk full");
        };
        AuditSink recording = (entries, alerts) -> {
            entries.forEach(e -> flushed.add(e.getAction()));
            alerts.forEach(a -> flushed.add(a.getMessage()));
        };
        AuditSinkFlusher flusher = new AuditSinkFlusher(TestProviders.providerOf(failing, recording), properties);

        flusher.offer(entry("MASTER_ON"));
        flusher.offer(SystemAlert.builder().id("a1").level(AlertLevel.INFO).message("hello").build());
        assertThat(flusher.pendingCount()).isEqualTo(2);

        flusher.flush();

        assertThat(flushed).containsExactly("MASTER_ON", "hello");
        assertThat(flusher.pendingCount()).isZero();
    }

    @Test
    void backlogIsBounded() {
        properties.getAudit().setCapacity(2);
        AuditSink sink = (entries, alerts) -> { };
        AuditSinkFlusher flusher = new AuditSinkFlusher(TestProviders.providerOf(sink), properties);

        flusher.offer(entry("A"));
        flusher.offer(entry("B"));
        flusher.offer(entry("C"));

        assertThat(flusher.pendingCount()).isEqualTo(2);
    }

    @Test
    void jsonSinkWritesKindAndPayload() {
        JsonLogAuditSink sink = new JsonLogAuditSink();

        String json = sink.toJson("audit", entry("MASTER_ON"));

        assertThat(json)
                .contains("\"kind\":\"audit\"")
                .contains("\"action\":\"MASTER_ON\"")
                .contains("\"timestamp\":\"2026-03-01T08:00:00Z\"");
    }

    private static AuditLogEntry entry(String action) {
        return AuditLogEntry.builder()
                .id(action)
                .timestamp(Instant.parse("2026-03-01T08:00:00Z"))
                .actor("ops")
                .action(action)
                .target("masterSwitch")
                .build();
    }
}
