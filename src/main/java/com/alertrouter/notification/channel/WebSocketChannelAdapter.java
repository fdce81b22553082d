package com.alertrouter.notification.channel;

import com.alertrouter.config.AlertingProperties;
import com.alertrouter.domain.enums.NotificationChannel;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.DeliveryResult;
import com.alertrouter.domain.model.Recipient;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.messaging.MessagingException;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Broadcasts alerts over STOMP to every connected dashboard client.
 *
 * <p>Messages go to {@code alerting.channels.websocket.destination} (default
 * {@code /topic/alerts}) with the shape:
 * <pre>
 * {"type": "alert_notification",
 *  "alert": {"id", "title", "message", "priority", "timestamp", "source"},
 *  "timestamp": ...}
 * </pre>
 * The recipient count reported is the number of resolved recipients; the broker does not
 * expose how many sessions received the frame.
 */
@Component
public class WebSocketChannelAdapter implements NotificationChannelAdapter {

    private static final Logger log = LoggerFactory.getLogger(WebSocketChannelAdapter.class);

    private static final String MESSAGE_TYPE = "alert_notification";

    private final SimpMessagingTemplate simpMessagingTemplate;
    private final AlertingProperties alertingProperties;

    public WebSocketChannelAdapter(
            SimpMessagingTemplate simpMessagingTemplate, AlertingProperties alertingProperties) {
        this.simpMessagingTemplate = simpMessagingTemplate;
        this.alertingProperties = alertingProperties;
        // bounds a send into a busy broker channel; slow sessions are cut by the transport limits
        this.simpMessagingTemplate.setSendTimeout(alertingProperties.getChannels().getDeliveryTimeoutMs());
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.WEBSOCKET;
    }

    @Override
    public DeliveryResult sendNotification(Alert alert, List<Recipient> recipients) {
        String destination = alertingProperties.getChannels().getWebsocket().getDestination();
        try {
            simpMessagingTemplate.convertAndSend(destination, buildMessage(alert));
            log.debug("WebSocket alert sent: alertId={}, destination={}", alert.getId(), destination);
            return DeliveryResult.success(recipients.size());
        } catch (MessagingException e) {
            log.error("Failed to send WebSocket alert {}: {}", alert.getId(), e.getMessage());
            return DeliveryResult.failure(e.getMessage());
        }
    }

    private Map<String, Object> buildMessage(Alert alert) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", alert.getId());
        body.put("title", alert.getTitle());
        body.put("message", alert.getMessage());
        body.put("priority", alert.getPriority().getKey());
        body.put("timestamp", alert.getTimestamp());
        body.put("source", alert.getSource());

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", MESSAGE_TYPE);
        message.put("alert", body);
        message.put("timestamp", System.currentTimeMillis());
        return message;
    }
}
