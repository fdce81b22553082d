package com.alertrouter.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Delivery channels an alert can be routed through.
 * WEBSOCKET is the in-app realtime push, SLACK the team chat webhook.
 */
@Getter
@RequiredArgsConstructor
public enum NotificationChannel {
    EMAIL("email"),
    SMS("sms"),
    WEBSOCKET("websocket"),
    SLACK("slack"),
    PUSH("push");

    private final String key;
}
