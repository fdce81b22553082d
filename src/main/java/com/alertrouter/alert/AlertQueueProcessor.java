package com.alertrouter.alert;

import com.alertrouter.config.AlertingProperties;
import com.alertrouter.domain.enums.NotificationChannel;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.AlertProcessingResult;
import com.alertrouter.domain.model.ChannelDeliveryResult;
import com.alertrouter.domain.model.Recipient;
import com.alertrouter.event.EventPublisherHelper;
import com.alertrouter.notification.ChannelDispatcher;
import com.alertrouter.notification.RecipientResolver;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Drains the {@link AlertQueue} on a fixed tick and delivers each alert.
 *
 * <p>Per alert: resolve recipients, pick channels, dispatch, record the outcome on the alert,
 * schedule escalation when the alert qualifies, then publish {@code alertProcessed}.
 *
 * <p>Only one drain runs at a time; a tick that finds a drain in progress returns at once.
 * Entries whose {@code nextRetry} lies in the future are held back and put back after the
 * drain. Alerts resolved while queued are dropped from the queue without processing.
 *
 * <p>A failure while processing one alert never stops the drain: the attempt is counted and
 * the alert is requeued with a backoff of {@code attempts * retry-backoff-ms} until it runs out
 * of attempts, after which it is dropped with an error log.
 */
@Component
public class AlertQueueProcessor implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(AlertQueueProcessor.class);

    private final AlertQueue alertQueue;
    private final AlertStore alertStore;
    private final RecipientResolver recipientResolver;
    private final ChannelDispatcher channelDispatcher;
    private final EscalationManager escalationManager;
    private final EventPublisherHelper eventPublisherHelper;
    private final AlertingProperties alertingProperties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean processing = new AtomicBoolean(false);

    public AlertQueueProcessor(
            AlertQueue alertQueue,
            AlertStore alertStore,
            RecipientResolver recipientResolver,
            ChannelDispatcher channelDispatcher,
            EscalationManager escalationManager,
            EventPublisherHelper eventPublisherHelper,
            AlertingProperties alertingProperties,
            Clock clock) {
        this.alertQueue = alertQueue;
        this.alertStore = alertStore;
        this.recipientResolver = recipientResolver;
        this.channelDispatcher = channelDispatcher;
        this.escalationManager = escalationManager;
        this.eventPublisherHelper = eventPublisherHelper;
        this.alertingProperties = alertingProperties;
        this.clock = clock;
    }

    @Override
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info(
                    "AlertQueueProcessor started: tickIntervalMs={}, channels={}",
                    alertingProperties.getQueue().getTickIntervalMs(),
                    channelDispatcher.getAvailableChannels());
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("AlertQueueProcessor stopped: {} alerts left in queue", alertQueue.size());
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Scheduled(fixedRateString = "${alerting.queue.tick-interval-ms:1000}")
    public void tick() {
        if (running.get()) {
            drain();
        }
    }

    /**
     * Processes every due alert currently in the queue.
     *
     * @return the number of alerts processed, 0 if another drain was already running
     */
    public int drain() {
        if (!processing.compareAndSet(false, true)) {
            return 0;
        }

        List<QueuedAlert> notYetDue = new ArrayList<>();
        int processed = 0;
        try {
            Instant now = clock.instant();
            QueuedAlert entry;
            while ((entry = alertQueue.poll()) != null) {
                Alert alert = entry.getAlert();
                if (!alertStore.isActive(alert.getId())) {
                    log.debug("Skipping resolved alert in queue: alertId={}", alert.getId());
                    continue;
                }
                if (alert.getNextRetry() != null && alert.getNextRetry().isAfter(now)) {
                    notYetDue.add(entry);
                    continue;
                }
                processAlert(entry);
                processed++;
            }
        } finally {
            notYetDue.forEach(alertQueue::requeue);
            processing.set(false);
        }
        return processed;
    }

    void processAlert(QueuedAlert entry) {
        Alert alert = entry.getAlert();
        long queueLatency = clock.millis() - entry.getEnqueuedAt();
        log.info(
                "Processing alert: alertId={}, type={}, priority={}, queueLatency={}ms",
                alert.getId(),
                alert.getType(),
                alert.getPriority().getKey(),
                queueLatency);

        try {
            List<Recipient> recipients = recipientResolver.determineRecipients(alert);
            List<NotificationChannel> channels = channelDispatcher.determineChannels(alert, recipients);
            List<ChannelDeliveryResult> results = channelDispatcher.dispatch(alert, channels, recipients);

            alertStore.recordProcessed(alert, recipients, channels);

            alertStore.find(alert.getId())
                    .filter(escalationManager::shouldEscalate)
                    .ifPresent(escalationManager::scheduleEscalation);

            AlertProcessingResult result = AlertProcessingResult.builder()
                    .alert(alert.snapshot())
                    .recipients(recipients)
                    .channels(channels)
                    .results(results)
                    .build();
            eventPublisherHelper.publishAlertProcessed(this, result);

            log.debug(
                    "Alert processed: alertId={}, recipients={}, channels={}, failedChannels={}",
                    alert.getId(),
                    recipients.size(),
                    channels,
                    result.failedChannelCount());
        } catch (RuntimeException e) {
            log.error("Error processing alert: alertId={}", alert.getId(), e);
            if (alertStore.recordFailedAttempt(alert, alertingProperties.getQueue().getRetryBackoffMs())) {
                alertQueue.enqueue(alert);
                log.info(
                        "Alert requeued: alertId={}, attempts={}, nextRetry={}",
                        alert.getId(),
                        alert.getAttempts(),
                        alert.getNextRetry());
            } else {
                log.error(
                        "Alert dropped after {} attempts: alertId={}", alert.getAttempts(), alert.getId());
            }
        }
    }

    public boolean isProcessing() {
        return processing.get();
    }
}
