package com.alertrouter.unit.notification;

import static org.assertj.core.api.Assertions.assertThat;

import com.alertrouter.config.AlertingProperties;
import com.alertrouter.domain.enums.AlertPriority;
import com.alertrouter.notification.AlertRateLimiter;
import com.alertrouter.support.MutableClock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for AlertRateLimiter: window capacity, expiry of old timestamps and key isolation.
 */
class AlertRateLimiterTest {

    private static final int MAX_ALERTS = 3;
    private static final long WINDOW_MS = 60_000;

    private AlertingProperties alertingProperties;
    private MutableClock clock;
    private AlertRateLimiter alertRateLimiter;

    @BeforeEach
    void setUp() {
        alertingProperties = new AlertingProperties();
        alertingProperties.getRateLimit().setMaxAlertsPerWindow(MAX_ALERTS);
        alertingProperties.getRateLimit().setWindowMs(WINDOW_MS);
        clock = MutableClock.atHour(12);
        alertRateLimiter = new AlertRateLimiter(alertingProperties, clock);
    }

    @Test
    @DisplayName("First K alerts within the window are accepted, the K+1th is limited")
    void acceptsUpToMaxThenLimits() {
        for (int i = 0; i < MAX_ALERTS; i++) {
            assertThat(alertRateLimiter.isRateLimited("disk_full", AlertPriority.HIGH))
                    .as("alert %d", i + 1)
                    .isFalse();
            clock.advanceMillis(1000);
        }

        assertThat(alertRateLimiter.isRateLimited("disk_full", AlertPriority.HIGH)).isTrue();
        assertThat(alertRateLimiter.getWindowCount("disk_full", AlertPriority.HIGH)).isEqualTo(MAX_ALERTS);
    }

    @Test
    @DisplayName("Alert is accepted again once the oldest timestamp leaves the window")
    void acceptsAfterWindowExpires() {
        for (int i = 0; i < MAX_ALERTS; i++) {
            alertRateLimiter.isRateLimited("disk_full", AlertPriority.HIGH);
        }
        assertThat(alertRateLimiter.isRateLimited("disk_full", AlertPriority.HIGH)).isTrue();

        clock.advance(Duration.ofMillis(WINDOW_MS + 1));

        assertThat(alertRateLimiter.isRateLimited("disk_full", AlertPriority.HIGH)).isFalse();
        assertThat(alertRateLimiter.getWindowCount("disk_full", AlertPriority.HIGH)).isEqualTo(1);
    }

    @Test
    @DisplayName("Rejected alerts do not consume a slot")
    void rejectedAlertsNotCounted() {
        for (int i = 0; i < MAX_ALERTS + 5; i++) {
            alertRateLimiter.isRateLimited("disk_full", AlertPriority.HIGH);
        }

        assertThat(alertRateLimiter.getWindowCount("disk_full", AlertPriority.HIGH)).isEqualTo(MAX_ALERTS);
    }

    @Test
    @DisplayName("Type and priority form separate windows")
    void keysAreIsolated() {
        for (int i = 0; i < MAX_ALERTS; i++) {
            alertRateLimiter.isRateLimited("disk_full", AlertPriority.HIGH);
        }

        assertThat(alertRateLimiter.isRateLimited("disk_full", AlertPriority.HIGH)).isTrue();
        assertThat(alertRateLimiter.isRateLimited("disk_full", AlertPriority.CRITICAL)).isFalse();
        assertThat(alertRateLimiter.isRateLimited("cpu_high", AlertPriority.HIGH)).isFalse();
    }

    @Test
    @DisplayName("Disabled limiter never limits and records nothing")
    void disabledLimiterBypasses() {
        alertingProperties.getRateLimit().setEnabled(false);

        for (int i = 0; i < MAX_ALERTS * 3; i++) {
            assertThat(alertRateLimiter.isRateLimited("disk_full", AlertPriority.HIGH)).isFalse();
        }
        assertThat(alertRateLimiter.getWindowCount("disk_full", AlertPriority.HIGH)).isZero();
    }

    @Test
    @DisplayName("reset clears every window")
    void resetClearsWindows() {
        for (int i = 0; i < MAX_ALERTS; i++) {
            alertRateLimiter.isRateLimited("disk_full", AlertPriority.HIGH);
        }

        alertRateLimiter.reset();

        assertThat(alertRateLimiter.isRateLimited("disk_full", AlertPriority.HIGH)).isFalse();
    }

    @Test
    @DisplayName("Concurrent callers on one key never admit more than the window allows")
    void concurrentCallsAdmitExactlyMax() throws Exception {
        int callers = MAX_ALERTS + 17;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return alertRateLimiter.isRateLimited("disk_full", AlertPriority.HIGH);
                }));
            }
            start.countDown();

            int accepted = 0;
            for (Future<Boolean> result : results) {
                if (!result.get(5, TimeUnit.SECONDS)) {
                    accepted++;
                }
            }

            assertThat(accepted).isEqualTo(MAX_ALERTS);
            assertThat(alertRateLimiter.getWindowCount("disk_full", AlertPriority.HIGH))
                    .isEqualTo(MAX_ALERTS);
        } finally {
            pool.shutdownNow();
        }
    }
}
