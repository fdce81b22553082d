package com.alertrouter.alert;

import com.alertrouter.api.dto.request.CreateAlertRequest;
import com.alertrouter.config.AlertingProperties;
import com.alertrouter.domain.enums.AlertPriority;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.AlertCreationResult;
import com.alertrouter.domain.model.EscalationStep;
import com.alertrouter.event.EventPublisherHelper;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/**
 * Walks unacknowledged alerts up the escalation chain.
 *
 * <p>The chain ({@code alerting.escalation.chain}) is indexed by escalation level. Level 0 is
 * the initial notification; each step names the role to pull in and how long to wait before
 * moving to it. After an alert is processed, a one-shot task is scheduled for
 * {@code chain[level + 1].delay}. When it fires, the live alert is re-checked under the store
 * lock: acknowledged or resolved alerts are left alone, otherwise the level goes up and an
 * {@code escalation} alert is raised for the next role.
 *
 * <p>Reaching the end of the chain stops escalation without error.
 */
@Component
public class EscalationManager {

    private static final Logger log = LoggerFactory.getLogger(EscalationManager.class);

    static final String ESCALATION_TYPE = "escalation";
    static final String ESCALATION_SOURCE = "escalation_system";

    private final AlertingProperties alertingProperties;
    private final AlertStore alertStore;
    private final AlertIntake alertIntake;
    private final EventPublisherHelper eventPublisherHelper;
    private final TaskScheduler taskScheduler;
    private final Clock clock;

    /** One pending escalation check per alert id. */
    private final Map<String, ScheduledFuture<?>> pendingEscalations = new ConcurrentHashMap<>();

    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public EscalationManager(
            AlertingProperties alertingProperties,
            AlertStore alertStore,
            AlertIntake alertIntake,
            EventPublisherHelper eventPublisherHelper,
            @Qualifier("escalationScheduler") TaskScheduler taskScheduler,
            Clock clock) {
        this.alertingProperties = alertingProperties;
        this.alertStore = alertStore;
        this.alertIntake = alertIntake;
        this.eventPublisherHelper = eventPublisherHelper;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
    }

    public boolean shouldEscalate(Alert alert) {
        return alertingProperties.getEscalation().isEnabled()
                && alert.getMetadata() != null
                && alert.getMetadata().isEscalate()
                && alert.getPriority() != AlertPriority.INFO
                && !alert.isAcknowledged()
                && !alert.isResolved();
    }

    /**
     * Delay before moving from {@code currentLevel} to the next level. Falls back to
     * {@code alerting.escalation.default-delay-ms} when the chain has no next step.
     */
    public long escalationDelay(int currentLevel) {
        List<EscalationStep> chain = alertingProperties.getEscalation().getChain();
        int next = currentLevel + 1;
        if (next < chain.size()) {
            return chain.get(next).getDelayMs();
        }
        return alertingProperties.getEscalation().getDefaultDelayMs();
    }

    public void scheduleEscalation(Alert alert) {
        if (shutdown.get()) {
            log.debug("Escalation not scheduled after shutdown: alertId={}", alert.getId());
            return;
        }

        String alertId = alert.getId();
        long delayMs = escalationDelay(alert.getEscalationLevel());
        ScheduledFuture<?> handle =
                taskScheduler.schedule(() -> onEscalationDue(alertId), clock.instant().plusMillis(delayMs));

        ScheduledFuture<?> previous = handle != null ? pendingEscalations.put(alertId, handle) : null;
        if (previous != null) {
            previous.cancel(false);
        }

        log.info(
                "Escalation scheduled: alertId={}, currentLevel={}, delayMs={}",
                alertId,
                alert.getEscalationLevel(),
                delayMs);
    }

    /** Scheduler callback. */
    void onEscalationDue(String alertId) {
        pendingEscalations.remove(alertId);
        if (shutdown.get()) {
            return;
        }
        try {
            escalateAlert(alertId);
        } catch (RuntimeException e) {
            log.error("Error escalating alert: alertId={}", alertId, e);
        }
    }

    /**
     * Moves the alert one level up the chain if it is still active, unacknowledged and
     * unresolved. Raises an escalation alert for the role at the new level and schedules the
     * following step while the chain has one.
     *
     * @return the escalated alert, or empty if it no longer qualified
     */
    public Optional<Alert> escalateAlert(String alertId) {
        Optional<Alert> escalated = alertStore.escalate(alertId, a -> !a.isAcknowledged() && !a.isResolved());
        if (escalated.isEmpty()) {
            log.debug("Escalation skipped, alert acknowledged or resolved: alertId={}", alertId);
            return Optional.empty();
        }

        Alert alert = escalated.get();
        int level = alert.getEscalationLevel();
        List<EscalationStep> chain = alertingProperties.getEscalation().getChain();

        if (level < chain.size()) {
            EscalationStep step = chain.get(level);
            raiseEscalationAlert(alert, step);

            if (level + 1 < chain.size()) {
                scheduleEscalation(alert);
            }
        }

        eventPublisherHelper.publishAlertEscalated(this, alert);
        log.warn("Alert escalated: alertId={}, escalationLevel={}", alertId, level);
        return Optional.of(alert);
    }

    private void raiseEscalationAlert(Alert alert, EscalationStep step) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("originalAlert", alert.getId());
        data.put("escalationLevel", alert.getEscalationLevel());
        data.put("escalateTo", step.getRole());

        CreateAlertRequest request = CreateAlertRequest.builder()
                .type(ESCALATION_TYPE)
                .priority(AlertPriority.HIGH.getKey())
                .title("ESCALATION: " + alert.getTitle())
                .message(String.format(
                        "Alert %s has been escalated to level %d. Original message: %s",
                        alert.getId(), alert.getEscalationLevel() + 1, alert.getMessage()))
                .data(data)
                .source(ESCALATION_SOURCE)
                .correlationId(alert.getMetadata() != null ? alert.getMetadata().getCorrelationId() : null)
                .build();

        AlertCreationResult result = alertIntake.createAlert(request);
        if (!result.isSuccess()) {
            log.warn(
                    "Escalation alert not created: originalAlert={}, reason={}", alert.getId(), result.getReason());
        }
    }

    /** Cancels every pending escalation check and refuses new ones. */
    public void cancelAll() {
        shutdown.set(true);
        int cancelled = 0;
        for (ScheduledFuture<?> handle : pendingEscalations.values()) {
            if (handle.cancel(false)) {
                cancelled++;
            }
        }
        pendingEscalations.clear();
        log.info("Escalation manager stopped: {} pending escalations cancelled", cancelled);
    }

    public int getPendingCount() {
        return pendingEscalations.size();
    }
}
