package com.alertrouter.notification.channel;

import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.DeliveryResult;
import com.alertrouter.domain.model.Recipient;
import com.alertrouter.exception.ChannelDeliveryException;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

/**
 * Base for channels that deliver by POSTing JSON to a webhook or gateway (chat, SMS, push).
 *
 * <p>Subclasses pick the recipients the channel can reach and build the provider payload;
 * this class performs the call and turns transport errors and non-2xx responses into a
 * failed {@link DeliveryResult}.
 */
public abstract class HttpChannelAdapter implements NotificationChannelAdapter {

    private static final Logger log = LoggerFactory.getLogger(HttpChannelAdapter.class);

    private final RestTemplate restTemplate;

    protected HttpChannelAdapter(RestTemplate restTemplate) {
        this.restTemplate = restTemplate;
    }

    protected abstract String endpointUrl();

    /** Bearer token sent with the request, or null when the endpoint needs none. */
    protected String apiKey() {
        return null;
    }

    /** Recipients this channel can reach. An empty list skips the call. */
    protected abstract List<Recipient> reachable(List<Recipient> recipients);

    protected abstract Map<String, Object> buildPayload(Alert alert, List<Recipient> reachable);

    @Override
    public boolean isAvailable() {
        String url = endpointUrl();
        return url != null && !url.isBlank();
    }

    @Override
    public DeliveryResult sendNotification(Alert alert, List<Recipient> recipients) {
        List<Recipient> targets = reachable(recipients);
        if (targets.isEmpty()) {
            return DeliveryResult.success(0);
        }

        try {
            post(buildPayload(alert, targets));
            return DeliveryResult.success(targets.size());
        } catch (ChannelDeliveryException e) {
            log.error("Channel delivery failed: alertId={}, {}", alert.getId(), e.getMessage());
            return DeliveryResult.failure(e.getMessage());
        }
    }

    private void post(Map<String, Object> payload) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        String apiKey = apiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(endpointUrl(), new HttpEntity<>(payload, headers), String.class);
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new ChannelDeliveryException(channel(), "HTTP " + response.getStatusCode().value());
            }
        } catch (RestClientException e) {
            throw new ChannelDeliveryException(channel(), e.getMessage(), e);
        }
    }
}
