package com.alertrouter.domain.enums;

/**
 * Lifecycle transition recorded in the alert history log.
 */
public enum AlertAction {
    CREATED,
    ACKNOWLEDGED,
    RESOLVED,
    ESCALATED
}
