package com.alertrouter.alert;

import com.alertrouter.config.AlertingProperties;
import com.alertrouter.domain.enums.AlertAction;
import com.alertrouter.domain.enums.NotificationChannel;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.AlertHistoryEntry;
import com.alertrouter.domain.model.Recipient;
import com.alertrouter.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory home of active alerts and the append-only lifecycle history.
 *
 * <p>All reads and writes go through one lock, so a lifecycle transition (acknowledge,
 * resolve, escalate, processing bookkeeping) is never interleaved with another on the same
 * alert. Callers get snapshots back, never the live instance, except for the queue processor
 * which owns the instance it dequeued.
 *
 * <p>Resolving removes the alert from the active map. Every later acknowledge, resolve or
 * escalate for that id sees "not found" (or a failed escalation predicate) and does nothing.
 */
@Component
public class AlertStore {

    private static final Logger log = LoggerFactory.getLogger(AlertStore.class);

    private final Object lock = new Object();
    private final Map<String, Alert> activeAlerts = new LinkedHashMap<>();
    private final List<AlertHistoryEntry> history = new ArrayList<>();

    private final AlertingProperties alertingProperties;
    private final Clock clock;

    public AlertStore(AlertingProperties alertingProperties, Clock clock) {
        this.alertingProperties = alertingProperties;
        this.clock = clock;
    }

    /** Adds a newly created alert and records its CREATED history entry. */
    public void add(Alert alert) {
        synchronized (lock) {
            activeAlerts.put(alert.getId(), alert);
            appendHistory(alert, AlertAction.CREATED, null, null);
        }
    }

    public Optional<Alert> find(String alertId) {
        synchronized (lock) {
            Alert alert = activeAlerts.get(alertId);
            return alert != null ? Optional.of(alert.snapshot()) : Optional.empty();
        }
    }

    public boolean isActive(String alertId) {
        synchronized (lock) {
            return activeAlerts.containsKey(alertId);
        }
    }

    /**
     * Marks an active alert acknowledged. The alert stays active.
     *
     * @throws ResourceNotFoundException if the alert is not active (unknown or resolved)
     */
    public Alert acknowledge(String alertId, String userId, String comment) {
        synchronized (lock) {
            Alert alert = requireActive(alertId);
            alert.setAcknowledged(true);
            alert.setAcknowledgedBy(userId);
            alert.setAcknowledgedAt(clock.instant());
            alert.setAcknowledgementComment(comment);
            appendHistory(alert, AlertAction.ACKNOWLEDGED, userId, comment);
            return alert.snapshot();
        }
    }

    /**
     * Marks an active alert resolved and removes it from the active set.
     *
     * @throws ResourceNotFoundException if the alert is not active (unknown or already resolved)
     */
    public Alert resolve(String alertId, String userId, String resolution) {
        synchronized (lock) {
            Alert alert = requireActive(alertId);
            alert.setResolved(true);
            alert.setResolvedBy(userId);
            alert.setResolvedAt(clock.instant());
            alert.setResolution(resolution);
            activeAlerts.remove(alertId);
            appendHistory(alert, AlertAction.RESOLVED, userId, resolution);
            return alert.snapshot();
        }
    }

    /**
     * Raises the escalation level of an active alert if {@code condition} still holds for it.
     * The check and the transition happen under the store lock, so an acknowledgement or
     * resolution that lands first always wins.
     *
     * @return a snapshot after the transition, or empty when the alert is gone or the
     *     condition no longer holds
     */
    public Optional<Alert> escalate(String alertId, Predicate<Alert> condition) {
        synchronized (lock) {
            Alert alert = activeAlerts.get(alertId);
            if (alert == null || !condition.test(alert)) {
                return Optional.empty();
            }
            alert.setEscalationLevel(alert.getEscalationLevel() + 1);
            alert.setEscalated(true);
            appendHistory(alert, AlertAction.ESCALATED, null, null);
            return Optional.of(alert.snapshot());
        }
    }

    /** Records the outcome of a successful processing pass on the queue's alert instance. */
    public void recordProcessed(Alert alert, List<Recipient> recipients, Collection<NotificationChannel> channels) {
        synchronized (lock) {
            alert.setRecipients(recipients.stream().map(Recipient::getId).collect(Collectors.toCollection(LinkedHashSet::new)));
            alert.setChannels(channels.isEmpty() ? EnumSet.noneOf(NotificationChannel.class) : EnumSet.copyOf(channels));
            alert.setAttempts(alert.getAttempts() + 1);
            alert.setLastProcessed(clock.instant());
            alert.setNextRetry(null);
        }
    }

    /**
     * Counts a failed processing attempt and, while attempts remain, sets the next retry time
     * to {@code now + attempts * backoffMs}.
     *
     * @return true if the alert should be requeued
     */
    public boolean recordFailedAttempt(Alert alert, long backoffMs) {
        synchronized (lock) {
            int attempts = alert.getAttempts() + 1;
            alert.setAttempts(attempts);
            alert.setLastProcessed(clock.instant());
            if (attempts < alert.getMaxAttempts()) {
                alert.setNextRetry(clock.instant().plusMillis(attempts * backoffMs));
                return true;
            }
            alert.setNextRetry(null);
            return false;
        }
    }

    public List<Alert> getActiveAlerts() {
        synchronized (lock) {
            return activeAlerts.values().stream().map(Alert::snapshot).toList();
        }
    }

    public List<AlertHistoryEntry> getHistory() {
        synchronized (lock) {
            return List.copyOf(history);
        }
    }

    /** History entries at or after {@code since}, oldest first. */
    public List<AlertHistoryEntry> getHistorySince(Instant since) {
        synchronized (lock) {
            return history.stream().filter(e -> !e.getTimestamp().isBefore(since)).toList();
        }
    }

    public int getActiveCount() {
        synchronized (lock) {
            return activeAlerts.size();
        }
    }

    private Alert requireActive(String alertId) {
        Alert alert = activeAlerts.get(alertId);
        if (alert == null) {
            throw new ResourceNotFoundException("Alert", alertId);
        }
        return alert;
    }

    private void appendHistory(Alert alert, AlertAction action, String userId, String note) {
        Instant now = clock.instant();
        history.add(AlertHistoryEntry.builder()
                .alert(alert.snapshot())
                .action(action)
                .timestamp(now)
                .userId(userId)
                .note(note)
                .build());
        pruneHistory(now);
    }

    // history is appended in time order, so expired entries are always at the head
    private void pruneHistory(Instant now) {
        Instant cutoff = now.minusMillis(alertingProperties.getHistoryRetentionMs());
        int pruned = 0;
        Iterator<AlertHistoryEntry> it = history.iterator();
        while (it.hasNext() && it.next().getTimestamp().isBefore(cutoff)) {
            it.remove();
            pruned++;
        }
        if (pruned > 0) {
            log.debug("Pruned {} history entries older than {}", pruned, cutoff);
        }
    }
}
