package com.alertrouter.unit.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.alertrouter.config.AlertingConfig;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Tests for AlertingConfig scheduler beans.
 */
class AlertingConfigTest {

    private final AlertingConfig alertingConfig = new AlertingConfig();

    @Test
    @DisplayName("Queue tick scheduler and escalation scheduler are separate pools")
    void schedulersAreSeparatePools() {
        ThreadPoolTaskScheduler queueScheduler = alertingConfig.taskScheduler();
        ThreadPoolTaskScheduler escalationScheduler = alertingConfig.escalationScheduler();

        assertThat(queueScheduler).isNotSameAs(escalationScheduler);
        assertThat(queueScheduler.getThreadNamePrefix()).isEqualTo("alert-queue-");
        assertThat(escalationScheduler.getThreadNamePrefix()).isEqualTo("escalation-");
    }

    @Test
    @DisplayName("A blocked queue tick does not delay escalation checks")
    void blockedQueueTickDoesNotDelayEscalation() throws Exception {
        ThreadPoolTaskScheduler queueScheduler = alertingConfig.taskScheduler();
        ThreadPoolTaskScheduler escalationScheduler = alertingConfig.escalationScheduler();
        queueScheduler.initialize();
        escalationScheduler.initialize();

        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch escalated = new CountDownLatch(1);
        AtomicReference<String> escalationThread = new AtomicReference<>();
        try {
            queueScheduler.execute(() -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            escalationScheduler.execute(() -> {
                escalationThread.set(Thread.currentThread().getName());
                escalated.countDown();
            });

            assertThat(escalated.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(escalationThread.get()).startsWith("escalation-");
        } finally {
            release.countDown();
            queueScheduler.shutdown();
            escalationScheduler.shutdown();
        }
    }
}
