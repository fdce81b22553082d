package com.alertrouter.alert;

import com.alertrouter.domain.enums.AlertAction;
import com.alertrouter.domain.enums.AlertPriority;
import com.alertrouter.domain.enums.NotificationChannel;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.AlertHistoryEntry;
import com.alertrouter.domain.model.AlertStatistics;
import com.alertrouter.notification.ChannelDispatcher;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Builds the {@link AlertStatistics} rollup. Read-only over the store, queue and dispatcher.
 */
@Component
public class AlertStatisticsAggregator {

    private static final Duration DAY = Duration.ofHours(24);
    private static final Duration WEEK = Duration.ofDays(7);

    private final AlertStore alertStore;
    private final AlertQueue alertQueue;
    private final AlertQueueProcessor alertQueueProcessor;
    private final ChannelDispatcher channelDispatcher;
    private final Clock clock;

    public AlertStatisticsAggregator(
            AlertStore alertStore,
            AlertQueue alertQueue,
            AlertQueueProcessor alertQueueProcessor,
            ChannelDispatcher channelDispatcher,
            Clock clock) {
        this.alertStore = alertStore;
        this.alertQueue = alertQueue;
        this.alertQueueProcessor = alertQueueProcessor;
        this.channelDispatcher = channelDispatcher;
        this.clock = clock;
    }

    public AlertStatistics getStatistics() {
        Instant now = clock.instant();
        List<Alert> active = alertStore.getActiveAlerts();
        List<NotificationChannel> available = new ArrayList<>(channelDispatcher.getAvailableChannels());

        return AlertStatistics.builder()
                .active(AlertStatistics.ActiveStats.builder()
                        .total(active.size())
                        .byPriority(countByPriority(active))
                        .acknowledged(active.stream().filter(Alert::isAcknowledged).count())
                        .build())
                .recent24h(window(alertStore.getHistorySince(now.minus(DAY))))
                .recent7d(window(alertStore.getHistorySince(now.minus(WEEK))))
                .channels(AlertStatistics.ChannelStats.builder()
                        .available(available)
                        .total(available.size())
                        .build())
                .processing(AlertStatistics.ProcessingStats.builder()
                        .queueLength(alertQueue.size())
                        .processing(alertQueueProcessor.isProcessing())
                        .build())
                .build();
    }

    private AlertStatistics.WindowStats window(List<AlertHistoryEntry> entries) {
        Map<AlertPriority, Long> byPriority = new EnumMap<>(AlertPriority.class);
        Map<AlertAction, Long> byAction = new EnumMap<>(AlertAction.class);
        for (AlertHistoryEntry entry : entries) {
            byPriority.merge(entry.getAlert().getPriority(), 1L, Long::sum);
            byAction.merge(entry.getAction(), 1L, Long::sum);
        }
        return AlertStatistics.WindowStats.builder()
                .total(entries.size())
                .byPriority(byPriority)
                .byAction(byAction)
                .build();
    }

    private static Map<AlertPriority, Long> countByPriority(List<Alert> alerts) {
        Map<AlertPriority, Long> counts = new EnumMap<>(AlertPriority.class);
        for (Alert alert : alerts) {
            counts.merge(alert.getPriority(), 1L, Long::sum);
        }
        return counts;
    }
}
