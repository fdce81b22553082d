package com.alertrouter.unit.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.alertrouter.alert.AlertQueue;
import com.alertrouter.alert.AlertQueueProcessor;
import com.alertrouter.alert.AlertStore;
import com.alertrouter.alert.EscalationManager;
import com.alertrouter.config.AlertingProperties;
import com.alertrouter.domain.enums.AlertPriority;
import com.alertrouter.domain.enums.NotificationChannel;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.AlertProcessingResult;
import com.alertrouter.domain.model.ChannelDeliveryResult;
import com.alertrouter.domain.model.DeliveryResult;
import com.alertrouter.domain.model.Recipient;
import com.alertrouter.event.EventPublisherHelper;
import com.alertrouter.notification.ChannelDispatcher;
import com.alertrouter.notification.RecipientResolver;
import com.alertrouter.support.MutableClock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Unit tests for AlertQueueProcessor covering drain order, outcome recording, escalation
 * scheduling, retry with backoff, single-flight draining and lifecycle.
 */
class AlertQueueProcessorTest {

    private MutableClock clock;
    private AlertingProperties alertingProperties;
    private AlertQueue alertQueue;
    private AlertStore alertStore;
    private RecipientResolver recipientResolver;
    private ChannelDispatcher channelDispatcher;
    private EscalationManager escalationManager;
    private EventPublisherHelper eventPublisherHelper;
    private AlertQueueProcessor alertQueueProcessor;

    private final Recipient admin = Recipient.builder().id("admin1").build();

    @BeforeEach
    void setUp() {
        clock = MutableClock.atHour(12);
        alertingProperties = new AlertingProperties();
        alertQueue = new AlertQueue(clock);
        alertStore = new AlertStore(alertingProperties, clock);
        recipientResolver = mock(RecipientResolver.class);
        channelDispatcher = mock(ChannelDispatcher.class);
        escalationManager = mock(EscalationManager.class);
        eventPublisherHelper = mock(EventPublisherHelper.class);

        when(recipientResolver.determineRecipients(any())).thenReturn(List.of(admin));
        when(channelDispatcher.determineChannels(any(), anyList())).thenReturn(List.of(NotificationChannel.WEBSOCKET));
        when(channelDispatcher.dispatch(any(), anyList(), anyList()))
                .thenReturn(List.of(ChannelDeliveryResult.of(NotificationChannel.WEBSOCKET, DeliveryResult.success(1))));

        alertQueueProcessor = new AlertQueueProcessor(
                alertQueue,
                alertStore,
                recipientResolver,
                channelDispatcher,
                escalationManager,
                eventPublisherHelper,
                alertingProperties,
                clock);
    }

    private Alert submit(String id, AlertPriority priority) {
        Alert alert = Alert.builder()
                .id(id)
                .type("t")
                .priority(priority)
                .timestamp(clock.instant())
                .build();
        alertStore.add(alert);
        alertQueue.enqueue(alert);
        return alert;
    }

    @Nested
    @DisplayName("Successful processing")
    class Successful {

        @Test
        @DisplayName("Alerts are processed most urgent first")
        void processesInPriorityOrder() {
            submit("low", AlertPriority.LOW);
            submit("critical", AlertPriority.CRITICAL);
            submit("medium", AlertPriority.MEDIUM);

            int processed = alertQueueProcessor.drain();

            assertThat(processed).isEqualTo(3);
            ArgumentCaptor<Alert> captor = ArgumentCaptor.forClass(Alert.class);
            verify(recipientResolver, times(3)).determineRecipients(captor.capture());
            assertThat(captor.getAllValues()).extracting(Alert::getId).containsExactly("critical", "medium", "low");
            assertThat(alertQueue.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Outcome is recorded on the alert and published as alertProcessed")
        void recordsAndPublishes() {
            Alert alert = submit("a1", AlertPriority.HIGH);

            alertQueueProcessor.drain();

            assertThat(alert.getAttempts()).isEqualTo(1);
            assertThat(alert.getLastProcessed()).isEqualTo(clock.instant());
            assertThat(alert.getRecipients()).containsExactly("admin1");
            assertThat(alert.getChannels()).containsExactly(NotificationChannel.WEBSOCKET);

            ArgumentCaptor<AlertProcessingResult> result = ArgumentCaptor.forClass(AlertProcessingResult.class);
            verify(eventPublisherHelper).publishAlertProcessed(any(), result.capture());
            assertThat(result.getValue().getAlert().getId()).isEqualTo("a1");
            assertThat(result.getValue().getRecipients()).containsExactly(admin);
            assertThat(result.getValue().getResults()).hasSize(1);
        }

        @Test
        @DisplayName("Escalation is scheduled only when the alert qualifies")
        void schedulesEscalationWhenQualified() {
            submit("a1", AlertPriority.CRITICAL);
            submit("a2", AlertPriority.LOW);
            when(escalationManager.shouldEscalate(any()))
                    .thenAnswer(invocation -> ((Alert) invocation.getArgument(0)).getId().equals("a1"));

            alertQueueProcessor.drain();

            ArgumentCaptor<Alert> scheduled = ArgumentCaptor.forClass(Alert.class);
            verify(escalationManager).scheduleEscalation(scheduled.capture());
            assertThat(scheduled.getValue().getId()).isEqualTo("a1");
        }

        @Test
        @DisplayName("Alerts resolved while queued are skipped")
        void skipsResolved() {
            submit("a1", AlertPriority.HIGH);
            alertStore.resolve("a1", "ops1", "false alarm");

            int processed = alertQueueProcessor.drain();

            assertThat(processed).isZero();
            verify(recipientResolver, never()).determineRecipients(any());
            assertThat(alertQueue.isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("Failures and retries")
    class Failures {

        @Test
        @DisplayName("A failing alert is retried with linear backoff and dropped after maxAttempts")
        void retriesThenDrops() {
            Alert alert = submit("a1", AlertPriority.HIGH);
            when(recipientResolver.determineRecipients(any())).thenThrow(new IllegalStateException("directory down"));

            alertQueueProcessor.drain();
            assertThat(alert.getAttempts()).isEqualTo(1);
            assertThat(alert.getNextRetry()).isEqualTo(clock.instant().plus(Duration.ofSeconds(60)));
            assertThat(alertQueue.size()).isEqualTo(1);

            // not yet due
            clock.advance(Duration.ofSeconds(30));
            assertThat(alertQueueProcessor.drain()).isZero();
            assertThat(alertQueue.size()).isEqualTo(1);

            clock.advance(Duration.ofSeconds(30));
            alertQueueProcessor.drain();
            assertThat(alert.getAttempts()).isEqualTo(2);
            assertThat(alert.getNextRetry()).isEqualTo(clock.instant().plus(Duration.ofSeconds(120)));

            clock.advance(Duration.ofSeconds(120));
            alertQueueProcessor.drain();
            assertThat(alert.getAttempts()).isEqualTo(3);
            assertThat(alertQueue.isEmpty()).isTrue();

            verify(recipientResolver, times(3)).determineRecipients(any());
            verify(eventPublisherHelper, never()).publishAlertProcessed(any(), any());
        }

        @Test
        @DisplayName("One failing alert does not stop the rest of the drain")
        void failureDoesNotStopDrain() {
            submit("bad", AlertPriority.CRITICAL);
            submit("good", AlertPriority.LOW);
            when(recipientResolver.determineRecipients(any())).thenAnswer(invocation -> {
                Alert alert = invocation.getArgument(0);
                if (alert.getId().equals("bad")) {
                    throw new IllegalStateException("boom");
                }
                return List.of(admin);
            });

            alertQueueProcessor.drain();

            ArgumentCaptor<AlertProcessingResult> result = ArgumentCaptor.forClass(AlertProcessingResult.class);
            verify(eventPublisherHelper).publishAlertProcessed(any(), result.capture());
            assertThat(result.getValue().getAlert().getId()).isEqualTo("good");
        }
    }

    @Nested
    @DisplayName("Concurrency and lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("A drain started while another is running returns immediately")
        void singleFlight() {
            submit("a1", AlertPriority.HIGH);
            AtomicInteger nested = new AtomicInteger(-1);
            AtomicBoolean processingSeen = new AtomicBoolean();
            when(recipientResolver.determineRecipients(any())).thenAnswer(invocation -> {
                processingSeen.set(alertQueueProcessor.isProcessing());
                nested.set(alertQueueProcessor.drain());
                return List.of(admin);
            });

            alertQueueProcessor.drain();

            assertThat(nested.get()).isZero();
            assertThat(processingSeen.get()).isTrue();
            assertThat(alertQueueProcessor.isProcessing()).isFalse();
        }

        @Test
        @DisplayName("tick drains only while running")
        void tickRespectsLifecycle() {
            submit("a1", AlertPriority.HIGH);

            alertQueueProcessor.tick();
            assertThat(alertQueue.size()).isEqualTo(1);

            alertQueueProcessor.start();
            alertQueueProcessor.tick();
            assertThat(alertQueue.isEmpty()).isTrue();

            alertQueueProcessor.stop();
            assertThat(alertQueueProcessor.isRunning()).isFalse();
        }
    }
}
