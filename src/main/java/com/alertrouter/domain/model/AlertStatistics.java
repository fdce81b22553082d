package com.alertrouter.domain.model;

import com.alertrouter.domain.enums.AlertAction;
import com.alertrouter.domain.enums.AlertPriority;
import com.alertrouter.domain.enums.NotificationChannel;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Read-only rollup over the active store, the history log and the queue.
 */
@Getter
@Builder
public class AlertStatistics {

    private final ActiveStats active;
    private final WindowStats recent24h;
    private final WindowStats recent7d;
    private final ChannelStats channels;
    private final ProcessingStats processing;

    @Getter
    @Builder
    public static class ActiveStats {
        private final int total;
        private final Map<AlertPriority, Long> byPriority;
        private final long acknowledged;
    }

    @Getter
    @Builder
    public static class WindowStats {
        private final int total;
        private final Map<AlertPriority, Long> byPriority;
        private final Map<AlertAction, Long> byAction;
    }

    @Getter
    @Builder
    public static class ChannelStats {
        private final List<NotificationChannel> available;
        private final int total;
    }

    @Getter
    @Builder
    public static class ProcessingStats {
        private final int queueLength;
        private final boolean processing;
    }
}
