package com.alertrouter.notification;

import com.alertrouter.domain.enums.NotificationChannel;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * One executor per notification channel. A channel whose calls hang can only tie up its own
 * workers; the other channels keep delivering.
 */
public class ChannelExecutors {

    private final Map<NotificationChannel, AsyncTaskExecutor> executors = new EnumMap<>(NotificationChannel.class);

    public ChannelExecutors(Map<NotificationChannel, ? extends AsyncTaskExecutor> executors) {
        this.executors.putAll(executors);
    }

    /** Returns the channel's executor, or null if none was configured for it. */
    public AsyncTaskExecutor forChannel(NotificationChannel channel) {
        return executors.get(channel);
    }

    /** Stops the pooled executors, interrupting calls still in flight. */
    public void shutdown() {
        for (AsyncTaskExecutor executor : executors.values()) {
            if (executor instanceof ThreadPoolTaskExecutor pool) {
                pool.shutdown();
            }
        }
    }
}
