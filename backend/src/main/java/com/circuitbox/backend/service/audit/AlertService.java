package com.circuitbox.backend.service.audit;

import com.circuitbox.backend.config.CircuitBoxProperties;
import com.circuitbox.backend.model.AlertLevel;
import com.circuitbox.backend.model.SystemAlert;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Bounded alert buffer with live unacknowledged counts. Every alert is also written
 * to the application log and forwarded to the registered notification channels.
 */
@Service
@Slf4j
public class AlertService {

    private final Clock clock;
    private final ObjectProvider<NotificationChannel> channels;
    private final AuditSinkFlusher sinkFlusher;
    private final BoundedLog<SystemAlert> alerts;

    private int criticalAlerts;
    private int warningAlerts;

    public AlertService(Clock clock,
                        ObjectProvider<NotificationChannel> channels,
                        AuditSinkFlusher sinkFlusher,
                        CircuitBoxProperties properties) {
        this.clock = clock;
        this.channels = channels;
        this.sinkFlusher = sinkFlusher;
        this.alerts = new BoundedLog<>(properties.getAudit().getAlertCapacity());
    }

    public SystemAlert raise(AlertLevel level, String source, String message) {
        SystemAlert alert = SystemAlert.builder()
                .id(UUID.randomUUID().toString())
                .level(level)
                .timestamp(clock.instant())
                .source(source)
                .message(message)
                .acknowledged(false)
                .build();
        synchronized (this) {
            SystemAlert evicted = alerts.append(alert);
            adjustCounters(alert, 1);
            if (evicted != null && !evicted.isAcknowledged()) {
                adjustCounters(evicted, -1);
            }
        }
        writeLog(alert);
        sinkFlusher.offer(alert);
        publish(alert);
        return alert.toBuilder().build();
    }

    public SystemAlert info(String source, String message) {
        return raise(AlertLevel.INFO, source, message);
    }

    public SystemAlert warning(String source, String message) {
        return raise(AlertLevel.WARNING, source, message);
    }

    public SystemAlert alert(String source, String message) {
        return raise(AlertLevel.ALERT, source, message);
    }

    public SystemAlert critical(String source, String message) {
        return raise(AlertLevel.CRITICAL, source, message);
    }

    /**
     * Marks an alert acknowledged. Unknown or already acknowledged ids are left untouched.
     *
     * @return true when this call acknowledged the alert
     */
    public synchronized boolean acknowledge(String alertId, String actor) {
        SystemAlert alert = alerts.find(a -> a.getId().equals(alertId)).orElse(null);
        if (alert == null || alert.isAcknowledged()) {
            return false;
        }
        alert.setAcknowledged(true);
        alert.setAcknowledgedBy(actor);
        alert.setAcknowledgedAt(clock.instant());
        recount();
        return true;
    }

    /**
     * @return copies of the buffered alerts, newest first
     */
    public synchronized List<SystemAlert> getAlerts() {
        return alerts.stream().map(alert -> alert.toBuilder().build()).toList();
    }

    public synchronized int getCriticalAlerts() {
        return criticalAlerts;
    }

    public synchronized int getWarningAlerts() {
        return warningAlerts;
    }

    public synchronized void clear() {
        alerts.clear();
        criticalAlerts = 0;
        warningAlerts = 0;
    }

    private void recount() {
        criticalAlerts = (int) alerts.stream().filter(a -> a.getLevel().isCritical() && !a.isAcknowledged()).count();
        warningAlerts = (int) alerts.stream().filter(a -> a.getLevel() == AlertLevel.WARNING && !a.isAcknowledged()).count();
    }

    private void adjustCounters(SystemAlert alert, int delta) {
        if (alert.getLevel().isCritical()) {
            criticalAlerts += delta;
        } else if (alert.getLevel() == AlertLevel.WARNING) {
            warningAlerts += delta;
        }
    }

    private void writeLog(SystemAlert alert) {
        switch (alert.getLevel()) {
            case INFO -> log.info("[INFO] {} - {}", alert.getSource(), alert.getMessage());
            case WARNING -> log.warn("[WARNING] {} - {}", alert.getSource(), alert.getMessage());
            case ALERT -> log.error("[ALERT] {} - {}", alert.getSource(), alert.getMessage());
            case CRITICAL -> log.error("⛔ [CRITICAL] {} - {}", alert.getSource(), alert.getMessage());
        }
    }

    private void publish(SystemAlert alert) {
        channels.orderedStream().forEach(channel -> {
            try {
                channel.publish(alert.toBuilder().build());
            } catch (Exception e) {
                log.warn("Notification channel {} failed for alert {}: {}",
                        channel.getClass().getSimpleName(), alert.getId(), e.getMessage());
            }
        });
    }
}
