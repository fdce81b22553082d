package com.alertrouter.notification.channel;

import com.alertrouter.config.AlertingProperties;
import com.alertrouter.domain.enums.NotificationChannel;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.Recipient;
import java.util.List;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Hands alerts to a push-notification gateway, addressed by user id.
 */
@Component
public class PushChannelAdapter extends HttpChannelAdapter {

    private final AlertingProperties alertingProperties;

    public PushChannelAdapter(
            @Qualifier("channelRestTemplate") RestTemplate restTemplate, AlertingProperties alertingProperties) {
        super(restTemplate);
        this.alertingProperties = alertingProperties;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.PUSH;
    }

    @Override
    protected String endpointUrl() {
        return alertingProperties.getChannels().getPush().getUrl();
    }

    @Override
    protected String apiKey() {
        return alertingProperties.getChannels().getPush().getApiKey();
    }

    @Override
    protected List<Recipient> reachable(List<Recipient> recipients) {
        return recipients.stream().filter(r -> r.prefers(NotificationChannel.PUSH)).toList();
    }

    @Override
    protected Map<String, Object> buildPayload(Alert alert, List<Recipient> reachable) {
        return Map.of(
                "userIds", reachable.stream().map(Recipient::getId).toList(),
                "title", alert.getTitle(),
                "body", alert.getMessage() != null ? alert.getMessage() : "",
                "priority", alert.getPriority().getKey(),
                "alertId", alert.getId());
    }
}
