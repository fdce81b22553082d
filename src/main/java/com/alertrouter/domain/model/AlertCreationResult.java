package com.alertrouter.domain.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Result of {@code createAlert}. Rate limiting is a declined result, not an exception:
 * {@code success=false, reason="rate_limited"}.
 */
@Getter
@Builder
public class AlertCreationResult {

    public static final String REASON_RATE_LIMITED = "rate_limited";

    private final boolean success;
    private final String alertId;
    private final String reason;
    private final Alert alert;

    public static AlertCreationResult created(Alert alert) {
        return AlertCreationResult.builder()
                .success(true)
                .alertId(alert.getId())
                .alert(alert)
                .build();
    }

    public static AlertCreationResult rateLimited(String alertId) {
        return AlertCreationResult.builder()
                .success(false)
                .alertId(alertId)
                .reason(REASON_RATE_LIMITED)
                .build();
    }
}
