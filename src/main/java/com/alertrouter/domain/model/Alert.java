package com.alertrouter.domain.model;

import com.alertrouter.domain.enums.AlertPriority;
import com.alertrouter.domain.enums.NotificationChannel;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A condition requiring human attention, routed through the notification system.
 *
 * <p>Alerts are owned by the {@link com.alertrouter.alert.AlertStore} while active and are
 * mutated only through it (acknowledge, resolve, escalate) or by the queue processor while
 * the alert is being delivered. The history log keeps {@link #snapshot()} copies, never the
 * live instance.
 *
 * <p>{@code escalationLevel} only ever grows. Once {@code resolved} is set the alert has left
 * the active store and no further transition applies to it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Alert {

    private String id;
    private Instant timestamp;
    private String type;
    private AlertPriority priority;
    private String title;
    private String message;

    /** Template interpolation values. Treated as read-only once the alert is created. */
    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    private String source;

    @Builder.Default
    private Set<String> tags = new LinkedHashSet<>();

    private boolean acknowledged;
    private String acknowledgedBy;
    private Instant acknowledgedAt;
    private String acknowledgementComment;

    private boolean resolved;
    private String resolvedBy;
    private Instant resolvedAt;
    private String resolution;

    private boolean escalated;
    private int escalationLevel;

    private int attempts;

    @Builder.Default
    private int maxAttempts = 3;

    /** Earliest time a failed alert may be retried; null when not waiting for a retry. */
    private Instant nextRetry;

    private Instant lastProcessed;

    /** Ids of the recipients actually notified by the last processing pass. */
    @Builder.Default
    private Set<String> recipients = new LinkedHashSet<>();

    /** Declared channels before processing, channels actually used after it. */
    @Builder.Default
    private Set<NotificationChannel> channels = EnumSet.noneOf(NotificationChannel.class);

    @Builder.Default
    private AlertMetadata metadata = new AlertMetadata();

    /**
     * Returns a detached copy for the history log, so later mutations of the live alert
     * do not rewrite past entries.
     */
    public Alert snapshot() {
        return toBuilder()
                .data(new LinkedHashMap<>(data))
                .tags(new LinkedHashSet<>(tags))
                .recipients(new LinkedHashSet<>(recipients))
                .channels(channels.isEmpty() ? EnumSet.noneOf(NotificationChannel.class) : EnumSet.copyOf(channels))
                .metadata(metadata.toBuilder().build())
                .build();
    }
}
