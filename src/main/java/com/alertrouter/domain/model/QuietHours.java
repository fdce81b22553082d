package com.alertrouter.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Hour-of-day window {@code [start, end)} during which non-critical notifications are held
 * back. A window with {@code start > end} spans midnight (e.g. 22 to 8).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QuietHours {

    private int start;
    private int end;

    public boolean contains(int hour) {
        if (start > end) {
            return hour >= start || hour < end;
        }
        return hour >= start && hour < end;
    }
}
