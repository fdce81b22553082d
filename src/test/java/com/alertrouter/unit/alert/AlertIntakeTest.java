package com.alertrouter.unit.alert;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.alertrouter.alert.AlertIntake;
import com.alertrouter.alert.AlertQueue;
import com.alertrouter.alert.AlertStore;
import com.alertrouter.api.dto.request.CreateAlertRequest;
import com.alertrouter.config.AlertingProperties;
import com.alertrouter.domain.enums.AlertAction;
import com.alertrouter.domain.enums.AlertPriority;
import com.alertrouter.domain.enums.NotificationChannel;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.AlertCreationResult;
import com.alertrouter.domain.model.AlertHistoryEntry;
import com.alertrouter.event.EventPublisherHelper;
import com.alertrouter.exception.BusinessException;
import com.alertrouter.exception.ErrorCode;
import com.alertrouter.notification.AlertRateLimiter;
import com.alertrouter.notification.AlertTemplateRegistry;
import com.alertrouter.support.MutableClock;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

/**
 * Tests for AlertIntake: defaults, priority validation, templates and rate limiting.
 */
class AlertIntakeTest {

    private AlertingProperties alertingProperties;
    private AlertStore alertStore;
    private AlertQueue alertQueue;
    private EventPublisherHelper eventPublisherHelper;
    private AlertIntake alertIntake;

    @BeforeEach
    void setUp() {
        MutableClock clock = MutableClock.atHour(10);
        alertingProperties = new AlertingProperties();
        alertStore = new AlertStore(alertingProperties, clock);
        alertQueue = new AlertQueue(clock);
        eventPublisherHelper = mock(EventPublisherHelper.class);
        alertIntake = new AlertIntake(
                alertingProperties,
                new AlertTemplateRegistry(alertingProperties),
                new AlertRateLimiter(alertingProperties, clock),
                alertStore,
                alertQueue,
                eventPublisherHelper,
                clock);
    }

    @Nested
    @DisplayName("Accepted alerts")
    class Accepted {

        @Test
        @DisplayName("Applies defaults, stores, enqueues and publishes alertCreated")
        void createsWithDefaults() {
            AlertCreationResult result = alertIntake.createAlert(CreateAlertRequest.builder()
                    .type("disk_full")
                    .title("Disk full")
                    .message("/var at 99%")
                    .build());

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getAlertId()).matches("alert_\\d+_[0-9a-f]{9}");

            Alert alert = result.getAlert();
            assertThat(alert.getPriority()).isEqualTo(AlertPriority.MEDIUM);
            assertThat(alert.getSource()).isEqualTo("system");
            assertThat(alert.getMetadata().getCreatedBy()).isEqualTo("system");
            assertThat(alert.getMetadata().getEnvironment()).isEqualTo("development");
            assertThat(alert.getEscalationLevel()).isZero();
            assertThat(alert.getMaxAttempts()).isEqualTo(3);

            assertThat(alertStore.isActive(result.getAlertId())).isTrue();
            assertThat(alertQueue.size()).isEqualTo(1);
            assertThat(alertStore.getHistory()).singleElement()
                    .extracting(AlertHistoryEntry::getAction)
                    .isEqualTo(AlertAction.CREATED);

            ArgumentCaptor<Alert> published = ArgumentCaptor.forClass(Alert.class);
            verify(eventPublisherHelper).publishAlertCreated(any(), published.capture());
            assertThat(published.getValue().getId()).isEqualTo(result.getAlertId());
        }

        @Test
        @DisplayName("Priority is parsed case-insensitively")
        void priorityCaseInsensitive() {
            AlertCreationResult upper = alertIntake.createAlert(
                    CreateAlertRequest.builder().type("a").priority("CRITICAL").build());
            AlertCreationResult lower = alertIntake.createAlert(
                    CreateAlertRequest.builder().type("b").priority("low").build());

            assertThat(upper.getAlert().getPriority()).isEqualTo(AlertPriority.CRITICAL);
            assertThat(lower.getAlert().getPriority()).isEqualTo(AlertPriority.LOW);
        }

        @Test
        @DisplayName("Each alert gets a distinct id")
        void idsAreUnique() {
            String first = alertIntake.createAlert(CreateAlertRequest.builder().type("a").build()).getAlertId();
            String second = alertIntake.createAlert(CreateAlertRequest.builder().type("a").build()).getAlertId();

            assertThat(first).isNotEqualTo(second);
        }

        @Test
        @DisplayName("Named template overrides title, message, priority and adds channels")
        void appliesTemplate() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("responseTime", 850);
            data.put("threshold", 500);

            Alert alert = alertIntake
                    .createAlert(CreateAlertRequest.builder()
                            .type("latency")
                            .priority("low")
                            .template("performance_degradation")
                            .data(data)
                            .build())
                    .getAlert();

            assertThat(alert.getTitle()).isEqualTo("MEDIUM: Performance Degradation");
            assertThat(alert.getMessage()).isEqualTo(
                    "System performance has degraded. Response time: 850ms (threshold: 500ms)");
            assertThat(alert.getPriority()).isEqualTo(AlertPriority.MEDIUM);
            assertThat(alert.getChannels())
                    .containsExactlyInAnyOrder(NotificationChannel.WEBSOCKET, NotificationChannel.SLACK);
            assertThat(alert.getMetadata().isEscalate()).isFalse();
        }
    }

    @Nested
    @DisplayName("Rejected alerts")
    class Rejected {

        @Test
        @DisplayName("Unknown priority is a validation error")
        void unknownPriority() {
            CreateAlertRequest request = CreateAlertRequest.builder().type("a").priority("urgent").build();

            assertThatThrownBy(() -> alertIntake.createAlert(request))
                    .isInstanceOf(BusinessException.class)
                    .extracting("errorCode")
                    .isEqualTo(ErrorCode.VALIDATION_ERROR);
            assertThat(alertQueue.isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Blank type is a validation error")
        void blankType() {
            assertThatThrownBy(() -> alertIntake.createAlert(CreateAlertRequest.builder().type(" ").build()))
                    .isInstanceOf(BusinessException.class);
        }

        @Test
        @DisplayName("Rate-limited alert is declined and leaves no trace")
        void rateLimited() {
            alertingProperties.getRateLimit().setMaxAlertsPerWindow(2);
            CreateAlertRequest request =
                    CreateAlertRequest.builder().type("disk_full").priority("high").build();

            alertIntake.createAlert(request);
            alertIntake.createAlert(request);
            AlertCreationResult third = alertIntake.createAlert(request);

            assertThat(third.isSuccess()).isFalse();
            assertThat(third.getReason()).isEqualTo("rate_limited");
            assertThat(third.getAlertId()).isNotNull();
            assertThat(alertStore.isActive(third.getAlertId())).isFalse();
            assertThat(alertQueue.size()).isEqualTo(2);
            assertThat(alertStore.getActiveCount()).isEqualTo(2);
            verify(eventPublisherHelper).publishAlertRateLimited(any(), any(Alert.class));
        }

        @Test
        @DisplayName("Rate limiting is keyed on type and priority only")
        void rateLimitKeyIgnoresContent() {
            alertingProperties.getRateLimit().setMaxAlertsPerWindow(1);

            alertIntake.createAlert(
                    CreateAlertRequest.builder().type("disk_full").priority("high").message("one").build());
            AlertCreationResult differentMessage = alertIntake.createAlert(
                    CreateAlertRequest.builder().type("disk_full").priority("high").message("two").build());
            AlertCreationResult differentPriority = alertIntake.createAlert(
                    CreateAlertRequest.builder().type("disk_full").priority("low").build());

            assertThat(differentMessage.isSuccess()).isFalse();
            assertThat(differentPriority.isSuccess()).isTrue();
            verify(eventPublisherHelper).publishAlertRateLimited(any(), any(Alert.class));
        }
    }
}
