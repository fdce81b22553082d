package com.alertrouter.notification.channel;

import com.alertrouter.config.AlertingProperties;
import com.alertrouter.domain.enums.NotificationChannel;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.Recipient;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

/**
 * Sends a short text through an HTTP SMS gateway to recipients with a phone number who opted
 * into SMS.
 */
@Component
public class SmsChannelAdapter extends HttpChannelAdapter {

    private static final int MAX_SMS_LENGTH = 160;

    private final AlertingProperties alertingProperties;

    public SmsChannelAdapter(
            @Qualifier("channelRestTemplate") RestTemplate restTemplate, AlertingProperties alertingProperties) {
        super(restTemplate);
        this.alertingProperties = alertingProperties;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.SMS;
    }

    @Override
    protected String endpointUrl() {
        return alertingProperties.getChannels().getSms().getUrl();
    }

    @Override
    protected String apiKey() {
        return alertingProperties.getChannels().getSms().getApiKey();
    }

    @Override
    protected List<Recipient> reachable(List<Recipient> recipients) {
        return recipients.stream()
                .filter(r -> r.getPhone() != null && r.prefers(NotificationChannel.SMS))
                .toList();
    }

    @Override
    protected Map<String, Object> buildPayload(Alert alert, List<Recipient> reachable) {
        String text = "[" + alert.getPriority().getKey().toUpperCase(Locale.ROOT) + "] " + alert.getTitle();
        return Map.of(
                "to", reachable.stream().map(Recipient::getPhone).toList(),
                "message", truncate(text),
                "reference", alert.getId());
    }

    /** Cuts to {@value #MAX_SMS_LENGTH} characters without splitting a surrogate pair. */
    private static String truncate(String text) {
        if (text.length() <= MAX_SMS_LENGTH) {
            return text;
        }
        int end = MAX_SMS_LENGTH;
        if (Character.isHighSurrogate(text.charAt(end - 1)) && Character.isLowSurrogate(text.charAt(end))) {
            end--;
        }
        return text.substring(0, end);
    }
}
