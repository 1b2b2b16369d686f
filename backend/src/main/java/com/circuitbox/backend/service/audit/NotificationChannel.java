package com.circuitbox.backend.service.audit;

import com.circuitbox.backend.model.SystemAlert;

/**
 * Human-facing delivery of alerts (chat, webhook, pager). Implementations are optional.
 */
public interface NotificationChannel {

    void publish(SystemAlert alert);
}
