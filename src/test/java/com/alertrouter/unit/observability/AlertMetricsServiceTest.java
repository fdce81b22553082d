package com.alertrouter.unit.observability;

import static org.assertj.core.api.Assertions.assertThat;

import com.alertrouter.alert.AlertQueue;
import com.alertrouter.domain.enums.AlertPriority;
import com.alertrouter.domain.enums.NotificationChannel;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.AlertProcessingResult;
import com.alertrouter.domain.model.ChannelDeliveryResult;
import com.alertrouter.domain.model.DeliveryResult;
import com.alertrouter.event.AlertEvent;
import com.alertrouter.event.AlertEventType;
import com.alertrouter.observability.AlertMetricsService;
import com.alertrouter.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * Tests for AlertMetricsService counters and the queue size gauge.
 */
class AlertMetricsServiceTest {

    private SimpleMeterRegistry meterRegistry;
    private AlertQueue alertQueue;
    private AlertMetricsService alertMetricsService;

    private final Alert alert = Alert.builder().id("a1").type("t").priority(AlertPriority.HIGH).build();

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        alertQueue = new AlertQueue(MutableClock.atHour(12));
        alertMetricsService = new AlertMetricsService(meterRegistry, alertQueue);
    }

    private double count(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Test
    void countsLifecycleEvents() {
        alertMetricsService.onAlertEvent(new AlertEvent(this, AlertEventType.CREATED, alert));
        alertMetricsService.onAlertEvent(new AlertEvent(this, AlertEventType.CREATED, alert));
        alertMetricsService.onAlertEvent(new AlertEvent(this, AlertEventType.RATE_LIMITED, alert));
        alertMetricsService.onAlertEvent(new AlertEvent(this, AlertEventType.ESCALATED, alert));
        alertMetricsService.onAlertEvent(new AlertEvent(this, AlertEventType.ACKNOWLEDGED, alert));

        assertThat(count("alerts.created.count")).isEqualTo(2.0);
        assertThat(count("alerts.rate_limited.count")).isEqualTo(1.0);
        assertThat(count("alerts.escalated.count")).isEqualTo(1.0);
        assertThat(count("notifications.failed.count")).isZero();
    }

    @Test
    void countsFailedChannelsOfProcessedAlerts() {
        AlertProcessingResult result = AlertProcessingResult.builder()
                .alert(alert)
                .recipients(List.of())
                .channels(List.of(NotificationChannel.SLACK, NotificationChannel.SMS, NotificationChannel.WEBSOCKET))
                .results(List.of(
                        ChannelDeliveryResult.of(NotificationChannel.SLACK, DeliveryResult.failure("500")),
                        ChannelDeliveryResult.of(NotificationChannel.SMS, DeliveryResult.failure("timeout")),
                        ChannelDeliveryResult.of(NotificationChannel.WEBSOCKET, DeliveryResult.success(2))))
                .build();

        alertMetricsService.onAlertEvent(new AlertEvent(this, result));

        assertThat(count("notifications.failed.count")).isEqualTo(2.0);
    }

    @Test
    void queueGaugeTracksQueueLength() {
        alertQueue.enqueue(alert);
        alertQueue.enqueue(alert.toBuilder().id("a2").build());

        assertThat(meterRegistry.get("alerts.queue.size").gauge().value()).isEqualTo(2.0);
    }
}
