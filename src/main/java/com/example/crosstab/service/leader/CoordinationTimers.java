package com.example.crosstab.service.leader;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Keyed one-shot fallback timers. Scheduling under a key that is already pending replaces
 * the earlier timer.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class CoordinationTimers {

    private final TaskScheduler taskScheduler;
    private final Map<String, ScheduledFuture<?>> pending = new ConcurrentHashMap<>();

    public static String candidateKey(String connectionId) {
        return "candidate:" + connectionId;
    }

    public static String transferKey(String userId) {
        return "transfer:" + userId;
    }

    public static String recoveryGraceKey(String userId) {
        return "recovery-grace:" + userId;
    }

    public static String reelectKey(String userId) {
        return "reelect:" + userId;
    }

    public void schedule(String key, Duration delay, Runnable action) {
        ScheduledFuture<?>[] self = new ScheduledFuture<?>[1];
        Runnable task = () -> {
            pending.remove(key, self[0]);
            try {
                action.run();
            } catch (Exception e) {
                log.error("Timer {} failed: {}", key, e.getMessage(), e);
            }
        };
        self[0] = taskScheduler.schedule(task, Instant.now().plus(delay));
        ScheduledFuture<?> previous = pending.put(key, self[0]);
        if (previous != null) {
            previous.cancel(false);
        }
        log.debug("Armed timer {} ({} ms)", key, delay.toMillis());
    }

    public boolean cancel(String key) {
        ScheduledFuture<?> future = pending.remove(key);
        if (future == null) {
            return false;
        }
        future.cancel(false);
        log.debug("Cancelled timer {}", key);
        return true;
    }

    public boolean isPending(String key) {
        return pending.containsKey(key);
    }

    /** Time left before the timer under the key fires, empty when none is pending. */
    public Optional<Duration> remaining(String key) {
        ScheduledFuture<?> future = pending.get(key);
        if (future == null) {
            return Optional.empty();
        }
        return Optional.of(Duration.ofMillis(Math.max(0, future.getDelay(TimeUnit.MILLISECONDS))));
    }

    public int pendingCount() {
        return pending.size();
    }
}
