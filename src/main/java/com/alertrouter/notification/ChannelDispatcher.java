package com.alertrouter.notification;

import com.alertrouter.config.AlertingProperties;
import com.alertrouter.domain.enums.AlertPriority;
import com.alertrouter.domain.enums.NotificationChannel;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.ChannelDeliveryResult;
import com.alertrouter.domain.model.DeliveryResult;
import com.alertrouter.domain.model.Recipient;
import com.alertrouter.notification.channel.NotificationChannelAdapter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Chooses the channels for an alert and delivers it over each of them in parallel.
 *
 * <p>An adapter is registered at startup only if its channel is listed in
 * {@code alerting.channels.enabled} and the adapter reports itself available. Channels that
 * are requested but not registered are skipped without a result entry.
 *
 * <p>Default routing when neither the alert nor its recipients name a usable channel:
 * <ul>
 *   <li>CRITICAL: EMAIL, SMS, WEBSOCKET, SLACK</li>
 *   <li>HIGH: EMAIL, WEBSOCKET, SLACK</li>
 *   <li>MEDIUM: WEBSOCKET, SLACK</li>
 *   <li>LOW, INFO: WEBSOCKET</li>
 * </ul>
 *
 * <p>Each channel call runs on that channel's own executor (see {@link ChannelExecutors}).
 * All calls for one alert share a deadline of {@code alerting.channels.delivery-timeout-ms}
 * from submission. A call still running at the deadline is cancelled with interruption and
 * recorded as timed out. A failure, exception, timeout or full channel queue is recorded in
 * that channel's result and does not affect the others.
 */
@Component
public class ChannelDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ChannelDispatcher.class);

    static final Map<AlertPriority, Set<NotificationChannel>> DEFAULT_ROUTING = defaultRouting();

    private final Map<NotificationChannel, NotificationChannelAdapter> adapters =
            new EnumMap<>(NotificationChannel.class);
    private final ChannelExecutors channelExecutors;
    private final long deliveryTimeoutMs;

    public ChannelDispatcher(
            List<NotificationChannelAdapter> channelAdapters,
            ChannelExecutors channelExecutors,
            AlertingProperties alertingProperties) {
        this.channelExecutors = channelExecutors;
        this.deliveryTimeoutMs = alertingProperties.getChannels().getDeliveryTimeoutMs();

        Set<NotificationChannel> enabled = alertingProperties.getChannels().getEnabled();
        for (NotificationChannelAdapter adapter : channelAdapters) {
            NotificationChannel channel = adapter.channel();
            if (!enabled.contains(channel)) {
                continue;
            }
            if (!adapter.isAvailable()) {
                log.warn("Notification channel {} is enabled but not configured, skipping", channel.getKey());
                continue;
            }
            if (channelExecutors.forChannel(channel) == null) {
                log.warn("Notification channel {} has no executor, skipping", channel.getKey());
                continue;
            }
            adapters.put(channel, adapter);
        }
        log.info("Notification channels registered: {}", adapters.keySet());
    }

    /**
     * Union of the alert's declared channels and every recipient's preferred channels,
     * restricted to registered adapters. Falls back to the priority default, unfiltered,
     * when that union is empty.
     */
    public List<NotificationChannel> determineChannels(Alert alert, List<Recipient> recipients) {
        Set<NotificationChannel> channels = new LinkedHashSet<>();

        if (alert.getChannels() != null) {
            for (NotificationChannel channel : alert.getChannels()) {
                if (adapters.containsKey(channel)) {
                    channels.add(channel);
                }
            }
        }

        for (Recipient recipient : recipients) {
            if (recipient.getNotificationChannels() == null) {
                continue;
            }
            for (NotificationChannel channel : recipient.getNotificationChannels()) {
                if (adapters.containsKey(channel)) {
                    channels.add(channel);
                }
            }
        }

        if (channels.isEmpty()) {
            channels.addAll(DEFAULT_ROUTING.getOrDefault(alert.getPriority(), EnumSet.of(NotificationChannel.WEBSOCKET)));
        }
        return new ArrayList<>(channels);
    }

    /**
     * Delivers the alert over every registered channel in {@code channels} and waits for all
     * of them. The returned results are in channel order.
     */
    public List<ChannelDeliveryResult> dispatch(
            Alert alert, Collection<NotificationChannel> channels, List<Recipient> recipients) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(deliveryTimeoutMs);
        List<NotificationChannel> attempted = new ArrayList<>();
        List<Future<DeliveryResult>> futures = new ArrayList<>();

        for (NotificationChannel channel : channels) {
            NotificationChannelAdapter adapter = adapters.get(channel);
            if (adapter == null) {
                log.debug("Channel {} not registered, skipping alert {}", channel.getKey(), alert.getId());
                continue;
            }
            attempted.add(channel);
            futures.add(submit(adapter, alert, recipients));
        }

        List<ChannelDeliveryResult> results = new ArrayList<>(attempted.size());
        for (int i = 0; i < attempted.size(); i++) {
            NotificationChannel channel = attempted.get(i);
            results.add(ChannelDeliveryResult.of(channel, await(channel, futures.get(i), deadline, alert)));
        }
        return results;
    }

    private Future<DeliveryResult> submit(NotificationChannelAdapter adapter, Alert alert, List<Recipient> recipients) {
        AsyncTaskExecutor executor = channelExecutors.forChannel(adapter.channel());
        try {
            return executor.submit(() -> adapter.sendNotification(alert, recipients));
        } catch (TaskRejectedException e) {
            log.error("Channel {} queue full, alert {} not sent", adapter.channel().getKey(), alert.getId());
            return CompletableFuture.completedFuture(
                    DeliveryResult.failure("Channel " + adapter.channel().getKey() + " is saturated"));
        }
    }

    private DeliveryResult await(NotificationChannel channel, Future<DeliveryResult> future, long deadline, Alert alert) {
        String error;
        try {
            return future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            error = "Delivery timed out after " + deliveryTimeoutMs + "ms";
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            error = String.valueOf(cause.getMessage());
        } catch (CancellationException e) {
            error = "Delivery cancelled";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            error = "Delivery interrupted";
        }
        log.error("Failed to send via {}: alertId={}, {}", channel.getKey(), alert.getId(), error);
        return DeliveryResult.failure(error);
    }

    public Set<NotificationChannel> getAvailableChannels() {
        return Collections.unmodifiableSet(adapters.keySet());
    }

    public void closeAll() {
        for (NotificationChannelAdapter adapter : adapters.values()) {
            try {
                adapter.close();
            } catch (RuntimeException e) {
                log.error("Error closing {} channel: {}", adapter.channel().getKey(), e.getMessage(), e);
            }
        }
    }

    private static Map<AlertPriority, Set<NotificationChannel>> defaultRouting() {
        Map<AlertPriority, Set<NotificationChannel>> routing = new EnumMap<>(AlertPriority.class);
        routing.put(
                AlertPriority.CRITICAL,
                EnumSet.of(
                        NotificationChannel.EMAIL,
                        NotificationChannel.SMS,
                        NotificationChannel.WEBSOCKET,
                        NotificationChannel.SLACK));
        routing.put(
                AlertPriority.HIGH,
                EnumSet.of(NotificationChannel.EMAIL, NotificationChannel.WEBSOCKET, NotificationChannel.SLACK));
        routing.put(AlertPriority.MEDIUM, EnumSet.of(NotificationChannel.WEBSOCKET, NotificationChannel.SLACK));
        routing.put(AlertPriority.LOW, EnumSet.of(NotificationChannel.WEBSOCKET));
        routing.put(AlertPriority.INFO, EnumSet.of(NotificationChannel.WEBSOCKET));
        return Collections.unmodifiableMap(routing);
    }
}
