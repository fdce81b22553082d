package com.alertrouter.event;

import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.AlertProcessingResult;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for alert lifecycle
 * events, so call sites read {@code publishAlertResolved(this, alert)}.
 *
 * <p>Delivery is synchronous unless the listener is {@code @Async}.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    public void publishAlertCreated(Object source, Alert alert) {
        applicationEventPublisher.publishEvent(new AlertEvent(source, AlertEventType.CREATED, alert));
    }

    public void publishAlertProcessed(Object source, AlertProcessingResult result) {
        applicationEventPublisher.publishEvent(new AlertEvent(source, result));
    }

    public void publishAlertAcknowledged(Object source, Alert alert) {
        applicationEventPublisher.publishEvent(new AlertEvent(source, AlertEventType.ACKNOWLEDGED, alert));
    }

    public void publishAlertResolved(Object source, Alert alert) {
        applicationEventPublisher.publishEvent(new AlertEvent(source, AlertEventType.RESOLVED, alert));
    }

    public void publishAlertEscalated(Object source, Alert alert) {
        applicationEventPublisher.publishEvent(new AlertEvent(source, AlertEventType.ESCALATED, alert));
    }

    public void publishAlertRateLimited(Object source, Alert alert) {
        applicationEventPublisher.publishEvent(new AlertEvent(source, AlertEventType.RATE_LIMITED, alert));
    }
}
