package com.alertrouter.alert;

import com.alertrouter.api.dto.request.CreateAlertRequest;
import com.alertrouter.config.AlertingProperties;
import com.alertrouter.domain.enums.AlertPriority;
import com.alertrouter.domain.enums.NotificationChannel;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.AlertCreationResult;
import com.alertrouter.domain.model.AlertMetadata;
import com.alertrouter.event.EventPublisherHelper;
import com.alertrouter.exception.BusinessException;
import com.alertrouter.exception.ErrorCode;
import com.alertrouter.notification.AlertRateLimiter;
import com.alertrouter.notification.AlertTemplateRegistry;
import java.time.Clock;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns a {@link CreateAlertRequest} into a stored, queued alert.
 *
 * <p>Steps: validate and build the alert, apply the named template, check the rate limiter,
 * then store (CREATED history), enqueue and publish {@code alertCreated}. A rate-limited
 * request is declined with {@code reason="rate_limited"} and leaves no trace in the store or
 * queue.
 *
 * <p>Shared by {@link AlertService} and {@link EscalationManager}, which both create alerts.
 */
@Component
public class AlertIntake {

    private static final Logger log = LoggerFactory.getLogger(AlertIntake.class);

    static final String DEFAULT_SOURCE = "system";
    static final String DEFAULT_CREATED_BY = "system";

    private final AlertingProperties alertingProperties;
    private final AlertTemplateRegistry alertTemplateRegistry;
    private final AlertRateLimiter alertRateLimiter;
    private final AlertStore alertStore;
    private final AlertQueue alertQueue;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    public AlertIntake(
            AlertingProperties alertingProperties,
            AlertTemplateRegistry alertTemplateRegistry,
            AlertRateLimiter alertRateLimiter,
            AlertStore alertStore,
            AlertQueue alertQueue,
            EventPublisherHelper eventPublisherHelper,
            Clock clock) {
        this.alertingProperties = alertingProperties;
        this.alertTemplateRegistry = alertTemplateRegistry;
        this.alertRateLimiter = alertRateLimiter;
        this.alertStore = alertStore;
        this.alertQueue = alertQueue;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    public AlertCreationResult createAlert(CreateAlertRequest request) {
        if (request.getType() == null || request.getType().isBlank()) {
            throw new BusinessException(ErrorCode.VALIDATION_ERROR, "Alert type is required");
        }

        Alert alert = buildAlert(request);

        if (request.getTemplate() != null) {
            alertTemplateRegistry.applyTemplate(alert, request.getTemplate());
        }

        if (alertRateLimiter.isRateLimited(alert.getType(), alert.getPriority())) {
            log.warn(
                    "Alert rate limited: alertId={}, type={}, priority={}",
                    alert.getId(),
                    alert.getType(),
                    alert.getPriority().getKey());
            eventPublisherHelper.publishAlertRateLimited(this, alert);
            return AlertCreationResult.rateLimited(alert.getId());
        }

        alertStore.add(alert);
        alertQueue.enqueue(alert);
        eventPublisherHelper.publishAlertCreated(this, alert.snapshot());

        log.info(
                "Alert created: alertId={}, type={}, priority={}, queueLength={}",
                alert.getId(),
                alert.getType(),
                alert.getPriority().getKey(),
                alertQueue.size());
        return AlertCreationResult.created(alert.snapshot());
    }

    private Alert buildAlert(CreateAlertRequest request) {
        AlertPriority priority = parsePriority(request.getPriority());
        Map<String, Object> data = request.getData() != null ? new LinkedHashMap<>(request.getData()) : new LinkedHashMap<>();

        return Alert.builder()
                .id(generateAlertId())
                .timestamp(clock.instant())
                .type(request.getType())
                .priority(priority)
                .title(request.getTitle())
                .message(request.getMessage())
                .data(data)
                .source(request.getSource() != null ? request.getSource() : DEFAULT_SOURCE)
                .tags(request.getTags() != null ? new LinkedHashSet<>(request.getTags()) : new LinkedHashSet<>())
                .maxAttempts(alertingProperties.getQueue().getMaxAttempts())
                .channels(EnumSet.noneOf(NotificationChannel.class))
                .metadata(AlertMetadata.builder()
                        .createdBy(request.getCreatedBy() != null ? request.getCreatedBy() : DEFAULT_CREATED_BY)
                        .correlationId(request.getCorrelationId())
                        .environment(alertingProperties.getEnvironment())
                        .build())
                .build();
    }

    private AlertPriority parsePriority(String value) {
        if (value == null || value.isBlank()) {
            return AlertPriority.MEDIUM;
        }
        try {
            return AlertPriority.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new BusinessException(
                    ErrorCode.VALIDATION_ERROR, "Invalid priority: " + value, Map.of("priority", value));
        }
    }

    private String generateAlertId() {
        String random = UUID.randomUUID().toString().replace("-", "").substring(0, 9);
        return "alert_" + clock.millis() + "_" + random;
    }
}
