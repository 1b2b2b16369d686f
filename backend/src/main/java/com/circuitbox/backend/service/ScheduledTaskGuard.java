package com.circuitbox.backend.service;

import com.circuitbox.backend.service.audit.AuditTrailService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Wraps timer callbacks so a failure is logged and audited instead of dying silently
 * on a scheduler thread.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final AuditTrailService auditTrailService;

    public void run(String taskName, Runnable task) {
        try {
            task.run();
        } catch (Throwable t) {
            log.error("Scheduled task failed task={}", taskName, t);
            auditTrailService.record("system", "TASK_FAILED", taskName, null, t.getMessage());
        }
    }
}
