package com.alertrouter.event;

import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.AlertProcessingResult;
import org.springframework.context.ApplicationEvent;

/**
 * Published on every alert lifecycle transition.
 *
 * <p>Key listeners:
 * <ul>
 *   <li>AlertMetricsService: counts created, rate-limited, escalated and failed deliveries</li>
 *   <li>External subscribers: dashboards and audit logging via {@code @EventListener}</li>
 * </ul>
 *
 * <p>{@link #getProcessingResult()} is only set for {@link AlertEventType#PROCESSED}.
 */
public class AlertEvent extends ApplicationEvent {

    private final AlertEventType eventType;
    private final Alert alert;
    private final AlertProcessingResult processingResult;

    public AlertEvent(Object source, AlertEventType eventType, Alert alert) {
        super(source);
        this.eventType = eventType;
        this.alert = alert;
        this.processingResult = null;
    }

    public AlertEvent(Object source, AlertProcessingResult processingResult) {
        super(source);
        this.eventType = AlertEventType.PROCESSED;
        this.alert = processingResult.getAlert();
        this.processingResult = processingResult;
    }

    public AlertEventType getEventType() {
        return eventType;
    }

    public Alert getAlert() {
        return alert;
    }

    public AlertProcessingResult getProcessingResult() {
        return processingResult;
    }
}
