package com.alertrouter.domain.model;

import com.alertrouter.domain.enums.AlertPriority;
import com.alertrouter.domain.enums.NotificationChannel;
import java.util.EnumSet;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-role routing policy: which priorities the role receives, over which channels, and
 * whether its quiet hours apply.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationRule {

    @Builder.Default
    private Set<NotificationChannel> channels = EnumSet.noneOf(NotificationChannel.class);

    @Builder.Default
    private Set<AlertPriority> priorities = EnumSet.noneOf(AlertPriority.class);

    private int escalationLevel;

    private QuietHours quietHours;

    private boolean enableQuietHours;

    public boolean receives(AlertPriority priority) {
        return priorities != null && priorities.contains(priority);
    }
}
