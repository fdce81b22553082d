package com.alertrouter.exception;

import com.alertrouter.domain.enums.NotificationChannel;

/**
 * Raised inside a channel adapter when the provider call fails. Adapters convert it into a
 * failed {@link com.alertrouter.domain.model.DeliveryResult}; it never escapes the dispatcher.
 */
public class ChannelDeliveryException extends BaseException {

    public ChannelDeliveryException(NotificationChannel channel, String message) {
        super(ErrorCode.CHANNEL_ERROR, String.format("%s delivery failed: %s", channel.getKey(), message));
    }

    public ChannelDeliveryException(NotificationChannel channel, String message, Throwable cause) {
        super(ErrorCode.CHANNEL_ERROR, String.format("%s delivery failed: %s", channel.getKey(), message), cause);
    }
}
