package com.alertrouter.domain.model;

import com.alertrouter.domain.enums.AlertPriority;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Individual opt-outs of a recipient. A null priority set means every priority is wanted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationPreferences {

    private boolean disabled;
    private Set<AlertPriority> priorities;

    public boolean accepts(AlertPriority priority) {
        if (disabled) {
            return false;
        }
        return priorities == null || priorities.contains(priority);
    }
}
