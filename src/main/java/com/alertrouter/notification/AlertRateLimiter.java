package com.alertrouter.notification;

import com.alertrouter.config.AlertingProperties;
import com.alertrouter.domain.enums.AlertPriority;
import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

/**
 * Sliding-window counter that suppresses alert floods per {@code (type, priority)}.
 *
 * <p>Each key keeps the timestamps of accepted alerts inside the trailing window. On every
 * check the timestamps older than the window are dropped; if {@code maxAlertsPerWindow}
 * remain the alert is rejected, otherwise its timestamp is recorded and it is accepted.
 * Rejected alerts do not consume a slot.
 *
 * <p>The key ignores the message, so two different alerts of the same type and priority
 * count against the same window.
 *
 * <p>Thread safety: all work for a key happens inside {@link ConcurrentHashMap#compute},
 * which serializes concurrent checks on the same key.
 */
@Component
public class AlertRateLimiter {

    private final AlertingProperties alertingProperties;
    private final Clock clock;

    private final ConcurrentHashMap<String, Deque<Long>> windows = new ConcurrentHashMap<>();

    public AlertRateLimiter(AlertingProperties alertingProperties, Clock clock) {
        this.alertingProperties = alertingProperties;
        this.clock = clock;
    }

    /**
     * Returns true if the alert must be suppressed. An accepted alert is counted.
     */
    public boolean isRateLimited(String type, AlertPriority priority) {
        AlertingProperties.RateLimit config = alertingProperties.getRateLimit();
        if (!config.isEnabled()) {
            return false;
        }

        long now = clock.millis();
        long cutoff = now - config.getWindowMs();
        AtomicBoolean limited = new AtomicBoolean(false);

        windows.compute(key(type, priority), (key, timestamps) -> {
            Deque<Long> window = timestamps != null ? timestamps : new ArrayDeque<>();
            while (!window.isEmpty() && window.peekFirst() <= cutoff) {
                window.pollFirst();
            }
            if (window.size() >= config.getMaxAlertsPerWindow()) {
                limited.set(true);
            } else {
                window.addLast(now);
            }
            return window;
        });

        return limited.get();
    }

    /** Number of alerts currently counted in the window of the given key. */
    public int getWindowCount(String type, AlertPriority priority) {
        AtomicInteger count = new AtomicInteger();
        windows.computeIfPresent(key(type, priority), (key, window) -> {
            count.set(window.size());
            return window;
        });
        return count.get();
    }

    public void reset() {
        windows.clear();
    }

    static String key(String type, AlertPriority priority) {
        return type + "_" + priority.getKey();
    }
}
