package com.alertrouter.domain.enums;

import java.util.Locale;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Urgency of an alert.
 *
 * <p>Alerts are dequeued by level (lower number = more urgent), so CRITICAL alerts are
 * always routed before anything else pending in the queue. The level also drives the
 * default channel set when neither the alert nor its recipients declare channels.
 */
@Getter
@RequiredArgsConstructor
public enum AlertPriority {
    CRITICAL(0, "critical"),
    HIGH(1, "high"),
    MEDIUM(2, "medium"),
    LOW(3, "low"),
    INFO(4, "info");

    private final int level;
    private final String key;

    /**
     * Parses a priority name case-insensitively ("critical", "CRITICAL").
     *
     * @throws IllegalArgumentException if the value names no priority
     */
    public static AlertPriority fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Priority must not be null");
        }
        return AlertPriority.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
