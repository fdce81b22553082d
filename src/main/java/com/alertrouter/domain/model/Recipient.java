package com.alertrouter.domain.model;

import com.alertrouter.domain.enums.NotificationChannel;
import java.util.EnumSet;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A user returned by the {@link com.alertrouter.directory.UserDirectory}, with the channels
 * they prefer and their optional opt-outs.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Recipient {

    private String id;
    private String email;
    private String phone;
    private String role;

    @Builder.Default
    private Set<NotificationChannel> notificationChannels = EnumSet.noneOf(NotificationChannel.class);

    private NotificationPreferences notificationPreferences;

    public boolean prefers(NotificationChannel channel) {
        return notificationChannels != null && notificationChannels.contains(channel);
    }
}
