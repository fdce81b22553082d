package com.alertrouter.notification;

import com.alertrouter.config.AlertingProperties;
import com.alertrouter.directory.UserDirectory;
import com.alertrouter.domain.enums.AlertPriority;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.NotificationPreferences;
import com.alertrouter.domain.model.NotificationRule;
import com.alertrouter.domain.model.QuietHours;
import com.alertrouter.domain.model.Recipient;
import java.time.Clock;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Computes who is told about an alert.
 *
 * <p>Every role whose {@link NotificationRule} lists the alert's priority contributes its
 * users from the {@link UserDirectory}, minus the users filtered out by
 * {@link #shouldNotifyUser}. The result is deduplicated by user id, keeping the first
 * occurrence in rule order.
 *
 * <p>Quiet hours are evaluated against the injected {@link Clock}'s zone. CRITICAL alerts
 * pass through quiet hours; individual opt-outs still apply to them.
 */
@Component
public class RecipientResolver {

    private static final Logger log = LoggerFactory.getLogger(RecipientResolver.class);

    private final AlertingProperties alertingProperties;
    private final UserDirectory userDirectory;
    private final Clock clock;

    public RecipientResolver(AlertingProperties alertingProperties, UserDirectory userDirectory, Clock clock) {
        this.alertingProperties = alertingProperties;
        this.userDirectory = userDirectory;
        this.clock = clock;
    }

    public List<Recipient> determineRecipients(Alert alert) {
        Map<String, Recipient> recipients = new LinkedHashMap<>();

        for (Map.Entry<String, NotificationRule> entry :
                alertingProperties.getRules().entrySet()) {
            NotificationRule rule = entry.getValue();
            if (!rule.receives(alert.getPriority())) {
                continue;
            }
            for (Recipient user : userDirectory.getUsersByRole(entry.getKey())) {
                if (shouldNotifyUser(user, alert, rule)) {
                    recipients.putIfAbsent(user.getId(), user);
                }
            }
        }

        log.debug(
                "Recipients resolved: alertId={}, priority={}, recipients={}",
                alert.getId(),
                alert.getPriority(),
                recipients.keySet());
        return new ArrayList<>(recipients.values());
    }

    public boolean shouldNotifyUser(Recipient user, Alert alert, NotificationRule rule) {
        if (rule.isEnableQuietHours()
                && isQuietHours(rule.getQuietHours())
                && alert.getPriority() != AlertPriority.CRITICAL) {
            return false;
        }

        NotificationPreferences preferences = user.getNotificationPreferences();
        return preferences == null || preferences.accepts(alert.getPriority());
    }

    public boolean isQuietHours(QuietHours quietHours) {
        if (quietHours == null) {
            return false;
        }
        return quietHours.contains(LocalTime.now(clock).getHour());
    }
}
