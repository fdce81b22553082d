package com.alertrouter.event;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle events emitted by the routing engine. {@code eventName} is the name external
 * subscribers (dashboards, audit log) know the event by.
 */
@Getter
@RequiredArgsConstructor
public enum AlertEventType {
    CREATED("alertCreated"),
    PROCESSED("alertProcessed"),
    ACKNOWLEDGED("alertAcknowledged"),
    RESOLVED("alertResolved"),
    ESCALATED("alertEscalated"),
    RATE_LIMITED("alertRateLimited");

    private final String eventName;
}
