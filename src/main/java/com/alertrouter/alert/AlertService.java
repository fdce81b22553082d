package com.alertrouter.alert;

import com.alertrouter.api.dto.request.CreateAlertRequest;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.AlertCreationResult;
import com.alertrouter.domain.model.AlertHistoryEntry;
import com.alertrouter.domain.model.AlertStatistics;
import com.alertrouter.event.EventPublisherHelper;
import com.alertrouter.exception.ResourceNotFoundException;
import com.alertrouter.notification.ChannelDispatcher;
import jakarta.annotation.PreDestroy;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Public operations of the alert routing engine.
 *
 * <p>Creation is delegated to {@link AlertIntake}; delivery happens later on the queue
 * processor's tick. Acknowledge and resolve act on the {@link AlertStore} directly, and any
 * pending escalation for the alert sees the new state when it fires.
 */
@Service
public class AlertService {

    private static final Logger log = LoggerFactory.getLogger(AlertService.class);

    private final AlertIntake alertIntake;
    private final AlertStore alertStore;
    private final AlertStatisticsAggregator alertStatisticsAggregator;
    private final AlertQueueProcessor alertQueueProcessor;
    private final EscalationManager escalationManager;
    private final ChannelDispatcher channelDispatcher;
    private final EventPublisherHelper eventPublisherHelper;

    private final AtomicBoolean shutDown = new AtomicBoolean(false);

    public AlertService(
            AlertIntake alertIntake,
            AlertStore alertStore,
            AlertStatisticsAggregator alertStatisticsAggregator,
            AlertQueueProcessor alertQueueProcessor,
            EscalationManager escalationManager,
            ChannelDispatcher channelDispatcher,
            EventPublisherHelper eventPublisherHelper) {
        this.alertIntake = alertIntake;
        this.alertStore = alertStore;
        this.alertStatisticsAggregator = alertStatisticsAggregator;
        this.alertQueueProcessor = alertQueueProcessor;
        this.escalationManager = escalationManager;
        this.channelDispatcher = channelDispatcher;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    public AlertCreationResult createAlert(CreateAlertRequest request) {
        return alertIntake.createAlert(request);
    }

    /**
     * @throws ResourceNotFoundException if no active alert has this id
     */
    public Alert acknowledgeAlert(String alertId, String userId, String comment) {
        Alert alert = alertStore.acknowledge(alertId, userId, comment);
        eventPublisherHelper.publishAlertAcknowledged(this, alert);
        log.info("Alert acknowledged: alertId={}, userId={}", alertId, userId);
        return alert;
    }

    /**
     * @throws ResourceNotFoundException if no active alert has this id
     */
    public Alert resolveAlert(String alertId, String userId, String resolution) {
        Alert alert = alertStore.resolve(alertId, userId, resolution);
        eventPublisherHelper.publishAlertResolved(this, alert);
        log.info("Alert resolved: alertId={}, userId={}, resolution={}", alertId, userId, resolution);
        return alert;
    }

    public Alert getAlert(String alertId) {
        return alertStore.find(alertId).orElseThrow(() -> new ResourceNotFoundException("Alert", alertId));
    }

    public List<Alert> getActiveAlerts() {
        return alertStore.getActiveAlerts();
    }

    public List<AlertHistoryEntry> getHistory() {
        return alertStore.getHistory();
    }

    public AlertStatistics getStatistics() {
        return alertStatisticsAggregator.getStatistics();
    }

    /** Stops the queue tick, cancels pending escalations and closes channel adapters. Idempotent. */
    @PreDestroy
    public void shutdown() {
        if (!shutDown.compareAndSet(false, true)) {
            return;
        }
        log.info("Shutting down alert routing engine");
        alertQueueProcessor.stop();
        escalationManager.cancelAll();
        channelDispatcher.closeAll();
        log.info("Alert routing engine shut down");
    }
}
