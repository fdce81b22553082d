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
 * Posts alerts to a team chat incoming webhook. The webhook targets a shared channel, so the
 * message goes out even when no individual recipient was resolved.
 */
@Component
public class SlackChannelAdapter extends HttpChannelAdapter {

    private final AlertingProperties alertingProperties;

    public SlackChannelAdapter(
            @Qualifier("channelRestTemplate") RestTemplate restTemplate, AlertingProperties alertingProperties) {
        super(restTemplate);
        this.alertingProperties = alertingProperties;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.SLACK;
    }

    @Override
    protected String endpointUrl() {
        return alertingProperties.getChannels().getSlack().getWebhookUrl();
    }

    @Override
    protected List<Recipient> reachable(List<Recipient> recipients) {
        return recipients.isEmpty() ? List.of(Recipient.builder().id("channel").build()) : recipients;
    }

    @Override
    protected Map<String, Object> buildPayload(Alert alert, List<Recipient> reachable) {
        String text = String.format(
                "*[%s] %s*%n%s%nSource: %s | Alert ID: %s",
                alert.getPriority().getKey().toUpperCase(),
                alert.getTitle(),
                alert.getMessage(),
                alert.getSource(),
                alert.getId());
        return Map.of("text", text);
    }
}
