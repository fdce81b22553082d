package com.alertrouter.domain.model;

import com.alertrouter.domain.enums.NotificationChannel;
import lombok.Builder;
import lombok.Getter;

/**
 * Per-channel entry of an {@link AlertProcessingResult}.
 */
@Getter
@Builder
public class ChannelDeliveryResult {

    private final NotificationChannel channel;
    private final boolean success;
    private final int recipientCount;
    private final String error;

    public static ChannelDeliveryResult of(NotificationChannel channel, DeliveryResult result) {
        return ChannelDeliveryResult.builder()
                .channel(channel)
                .success(result.isSuccess())
                .recipientCount(result.getRecipientCount())
                .error(result.getError())
                .build();
    }
}
