package com.alertrouter.config;

import com.alertrouter.domain.enums.NotificationChannel;
import com.alertrouter.notification.ChannelExecutors;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ThreadPoolExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Delivery pools for the notification channels.
 *
 * <p>Each channel gets a fixed pool ({@code core == max}) with a bounded queue. When the queue
 * is full the submission is rejected and the dispatcher records a failed delivery; running
 * the call on the caller would stall the queue drain behind a hung channel. On shutdown
 * in-flight calls are interrupted rather than awaited.
 */
@Configuration
public class ChannelExecutorConfig {

    private static final Logger log = LoggerFactory.getLogger(ChannelExecutorConfig.class);

    private static final int AWAIT_TERMINATION_SECONDS = 5;

    @Bean(destroyMethod = "shutdown")
    public ChannelExecutors channelExecutors(AlertingProperties alertingProperties) {
        AlertingProperties.Executor settings = alertingProperties.getChannels().getExecutor();
        Map<NotificationChannel, ThreadPoolTaskExecutor> executors = new EnumMap<>(NotificationChannel.class);
        for (NotificationChannel channel : NotificationChannel.values()) {
            executors.put(channel, channelExecutor(channel, settings.poolSizeFor(channel), settings.getQueueCapacity()));
        }
        log.info(
                "Channel executors created: defaultPoolSize={}, overrides={}, queueCapacity={}",
                settings.getPoolSize(),
                settings.getPoolSizes(),
                settings.getQueueCapacity());
        return new ChannelExecutors(executors);
    }

    private static ThreadPoolTaskExecutor channelExecutor(NotificationChannel channel, int poolSize, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setAllowCoreThreadTimeOut(true);
        executor.setThreadNamePrefix("channel-" + channel.getKey() + "-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(AWAIT_TERMINATION_SECONDS);
        executor.initialize();
        return executor;
    }
}
