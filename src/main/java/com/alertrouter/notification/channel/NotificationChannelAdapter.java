package com.alertrouter.notification.channel;

import com.alertrouter.domain.enums.NotificationChannel;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.DeliveryResult;
import com.alertrouter.domain.model.Recipient;
import java.util.List;

/**
 * Delivery capability of one {@link NotificationChannel}.
 *
 * <p>Implementations are shared across channel executor threads and must be thread-safe.
 * Provider failures are reported as a failed {@link DeliveryResult}; an exception that
 * escapes anyway is caught by the dispatcher and recorded the same way.
 */
public interface NotificationChannelAdapter {

    NotificationChannel channel();

    DeliveryResult sendNotification(Alert alert, List<Recipient> recipients);

    /** Whether the adapter has what it needs to deliver (credentials, endpoint, transport). */
    default boolean isAvailable() {
        return true;
    }

    /** Releases connections held by the adapter. Called once on shutdown. */
    default void close() {}
}
