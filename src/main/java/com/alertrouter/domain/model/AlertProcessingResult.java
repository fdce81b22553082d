package com.alertrouter.domain.model;

import com.alertrouter.domain.enums.NotificationChannel;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * Payload of the {@code alertProcessed} event: who was targeted, over which channels, and
 * how each channel fared.
 */
@Getter
@Builder
public class AlertProcessingResult {

    private final Alert alert;
    private final List<Recipient> recipients;
    private final List<NotificationChannel> channels;
    private final List<ChannelDeliveryResult> results;

    public long failedChannelCount() {
        return results.stream().filter(r -> !r.isSuccess()).count();
    }
}
