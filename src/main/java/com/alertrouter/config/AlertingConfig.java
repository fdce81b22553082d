package com.alertrouter.config;

import java.time.Clock;
import java.time.Duration;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.web.client.RestTemplate;

/**
 * Infrastructure beans of the routing engine: the clock every time decision is made
 * against, the schedulers for the queue tick and for escalation checks, and the HTTP client
 * shared by the webhook/gateway channel adapters.
 */
@Configuration
public class AlertingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    /**
     * Runs the {@code @Scheduled} queue tick. Kept apart from {@code escalationScheduler} so a
     * drain waiting on slow channels never delays an escalation check.
     */
    @Bean("taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("alert-queue-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean("escalationScheduler")
    public ThreadPoolTaskScheduler escalationScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("escalation-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean("channelRestTemplate")
    public RestTemplate channelRestTemplate(RestTemplateBuilder builder, AlertingProperties alertingProperties) {
        Duration timeout = Duration.ofMillis(alertingProperties.getChannels().getDeliveryTimeoutMs());
        return builder.setConnectTimeout(timeout).setReadTimeout(timeout).build();
    }
}
