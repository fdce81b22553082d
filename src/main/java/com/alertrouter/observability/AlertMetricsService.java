package com.alertrouter.observability;

import com.alertrouter.alert.AlertQueue;
import com.alertrouter.domain.model.AlertProcessingResult;
import com.alertrouter.event.AlertEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer meters for the routing engine:
 * <ul>
 *   <li><b>alerts.created.count</b> (counter): alerts accepted by createAlert</li>
 *   <li><b>alerts.rate_limited.count</b> (counter): alerts declined by the rate limiter</li>
 *   <li><b>alerts.escalated.count</b> (counter): escalation steps taken</li>
 *   <li><b>notifications.failed.count</b> (counter): failed channel deliveries</li>
 *   <li><b>alerts.queue.size</b> (gauge): alerts waiting in the queue</li>
 * </ul>
 *
 * <p>Counters are driven by {@link AlertEvent} listeners; the gauge is read at scrape time.
 */
@Service
public class AlertMetricsService {

    private static final Logger log = LoggerFactory.getLogger(AlertMetricsService.class);

    private final Counter alertsCreatedCounter;
    private final Counter alertsRateLimitedCounter;
    private final Counter alertsEscalatedCounter;
    private final Counter notificationsFailedCounter;

    public AlertMetricsService(MeterRegistry meterRegistry, AlertQueue alertQueue) {
        this.alertsCreatedCounter = Counter.builder("alerts.created.count")
                .description("Alerts accepted and queued for delivery")
                .register(meterRegistry);

        this.alertsRateLimitedCounter = Counter.builder("alerts.rate_limited.count")
                .description("Alerts declined by the per type and priority rate limiter")
                .register(meterRegistry);

        this.alertsEscalatedCounter = Counter.builder("alerts.escalated.count")
                .description("Escalation steps taken on unacknowledged alerts")
                .register(meterRegistry);

        this.notificationsFailedCounter = Counter.builder("notifications.failed.count")
                .description("Channel deliveries that failed or timed out")
                .register(meterRegistry);

        meterRegistry.gauge("alerts.queue.size", alertQueue, AlertQueue::size);
    }

    @EventListener
    @Order(20)
    public void onAlertEvent(AlertEvent event) {
        switch (event.getEventType()) {
            case CREATED -> alertsCreatedCounter.increment();
            case RATE_LIMITED -> alertsRateLimitedCounter.increment();
            case ESCALATED -> alertsEscalatedCounter.increment();
            case PROCESSED -> recordDeliveryFailures(event.getProcessingResult());
            default -> {
                // acknowledge and resolve are not counted
            }
        }
    }

    private void recordDeliveryFailures(AlertProcessingResult result) {
        long failed = result != null ? result.failedChannelCount() : 0;
        if (failed > 0) {
            notificationsFailedCounter.increment(failed);
            log.debug("Recorded {} failed deliveries for alert {}", failed, result.getAlert().getId());
        }
    }
}
