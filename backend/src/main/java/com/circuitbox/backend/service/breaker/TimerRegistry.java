package com.circuitbox.backend.service.breaker;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One-shot timers keyed by id. Scheduling under an id that already has a timer replaces it,
 * so at most one timer is live per key.
 */
@Component
@Slf4j
public class TimerRegistry {

    private final TaskScheduler scheduler;
    private final Map<String, ScheduledFuture<?>> timers = new ConcurrentHashMap<>();

    public TimerRegistry(@Qualifier("breakerResetScheduler") TaskScheduler scheduler) {
        this.scheduler = scheduler;
    }

    public void schedule(String key, Instant fireAt, Runnable task) {
        cancel(key);
        AtomicReference<ScheduledFuture<?>> self = new AtomicReference<>();
        ScheduledFuture<?> future = scheduler.schedule(() -> {
            ScheduledFuture<?> current = self.get();
            if (current != null) {
                timers.remove(key, current);
            }
            task.run();
        }, fireAt);
        self.set(future);
        timers.put(key, future);
        log.debug("Timer {} scheduled for {}", key, fireAt);
    }

    /**
     * @return true when a pending timer was cancelled
     */
    public boolean cancel(String key) {
        ScheduledFuture<?> future = timers.remove(key);
        if (future == null) {
            return false;
        }
        boolean pending = !future.isDone();
        future.cancel(false);
        log.debug("Timer {} cancelled", key);
        return pending;
    }

    public int cancelAll() {
        int cancelled = 0;
        for (String key : timers.keySet()) {
            if (cancel(key)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    public boolean isScheduled(String key) {
        ScheduledFuture<?> future = timers.get(key);
        return future != null && !future.isDone();
    }

    public int activeCount() {
        return (int) timers.values().stream().filter(future -> !future.isDone()).count();
    }
}
