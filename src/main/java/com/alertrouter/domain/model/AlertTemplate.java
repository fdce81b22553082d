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
 * Named alert template bound from {@code alerting.templates.<name>}.
 *
 * <p>The body may contain {@code {identifier}} placeholders that are filled from the
 * alert's data map when the template is applied.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertTemplate {

    private String subject;
    private String body;

    @Builder.Default
    private AlertPriority priority = AlertPriority.MEDIUM;

    @Builder.Default
    private Set<NotificationChannel> channels = EnumSet.noneOf(NotificationChannel.class);

    private boolean escalate;
}
