package com.alertrouter.domain.model;

import lombok.Builder;
import lombok.Getter;

/**
 * Outcome of one {@code sendNotification} call on a channel adapter.
 */
@Getter
@Builder
public class DeliveryResult {

    private final boolean success;
    private final int recipientCount;
    private final String error;

    public static DeliveryResult success(int recipientCount) {
        return DeliveryResult.builder().success(true).recipientCount(recipientCount).build();
    }

    public static DeliveryResult failure(String error) {
        return DeliveryResult.builder().success(false).error(error).build();
    }
}
