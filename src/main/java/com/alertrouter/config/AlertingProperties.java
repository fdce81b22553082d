package com.alertrouter.config;

import com.alertrouter.domain.enums.AlertPriority;
import com.alertrouter.domain.enums.NotificationChannel;
import com.alertrouter.domain.model.AlertTemplate;
import com.alertrouter.domain.model.EscalationStep;
import com.alertrouter.domain.model.NotificationRule;
import com.alertrouter.domain.model.QuietHours;
import com.alertrouter.domain.model.Recipient;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Configuration for the alert routing engine, bound from the {@code alerting} prefix.
 *
 * <p>Every value has a working default, so the engine runs with an empty configuration:
 * <pre>
 * alerting.rate-limit.window-ms=300000
 * alerting.rate-limit.max-alerts-per-window=10
 * alerting.escalation.default-delay-ms=300000
 * alerting.queue.tick-interval-ms=1000
 * alerting.channels.enabled=websocket
 * </pre>
 *
 * <p>Role rules, the escalation chain, templates and directory users default to the
 * built-in admin / supervisor / developer / operations setup and can be replaced per key.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "alerting")
public class AlertingProperties {

    /** Recorded in every alert's metadata. */
    private String environment = "development";

    /** History entries older than this are pruned. Covers the 7-day statistics window. */
    private long historyRetentionMs = 7L * 24 * 60 * 60 * 1000;

    private RateLimit rateLimit = new RateLimit();
    private Escalation escalation = new Escalation();
    private Queue queue = new Queue();
    private Channels channels = new Channels();
    private Directory directory = new Directory();

    private Map<String, NotificationRule> rules = defaultRules();
    private Map<String, AlertTemplate> templates = defaultTemplates();

    @Getter
    @Setter
    public static class RateLimit {
        private boolean enabled = true;
        private long windowMs = 300_000;
        private int maxAlertsPerWindow = 10;
    }

    @Getter
    @Setter
    public static class Escalation {
        private boolean enabled = true;

        /** Delay used when the next chain level is out of range. */
        private long defaultDelayMs = 300_000;

        private List<EscalationStep> chain = defaultChain();
    }

    @Getter
    @Setter
    public static class Queue {
        private long tickIntervalMs = 1000;

        /** Retry delay per attempt already made: attempts * retryBackoffMs. */
        private long retryBackoffMs = 60_000;

        private int maxAttempts = 3;
    }

    @Getter
    @Setter
    public static class Channels {
        private Set<NotificationChannel> enabled = EnumSet.of(NotificationChannel.WEBSOCKET);

        /** Upper bound on one adapter call before the channel is recorded as failed. */
        private long deliveryTimeoutMs = 10_000;

        private Executor executor = new Executor();
        private Email email = new Email();
        private Slack slack = new Slack();
        private Gateway sms = new Gateway();
        private Gateway push = new Gateway();
        private WebSocket websocket = new WebSocket();
    }

    /**
     * Worker pool settings. Every channel gets its own pool of {@code poolSize} threads, or
     * the size given for it in {@code poolSizes}, so calls hanging on one channel only ever
     * occupy that channel's workers.
     */
    @Getter
    @Setter
    public static class Executor {
        private int poolSize = 4;
        private Map<NotificationChannel, Integer> poolSizes = new EnumMap<>(NotificationChannel.class);

        /** Pending deliveries per channel beyond which new ones fail immediately. */
        private int queueCapacity = 100;

        public int poolSizeFor(NotificationChannel channel) {
            return poolSizes.getOrDefault(channel, poolSize);
        }
    }

    @Getter
    @Setter
    public static class Email {
        private String from = "noreply@company.com";
    }

    @Getter
    @Setter
    public static class Slack {
        private String webhookUrl;
    }

    @Getter
    @Setter
    public static class Gateway {
        private String url;
        private String apiKey;
    }

    @Getter
    @Setter
    public static class WebSocket {
        private String destination = "/topic/alerts";
    }

    @Getter
    @Setter
    public static class Directory {
        private Map<String, List<Recipient>> users = defaultUsers();
    }

    private static Map<String, NotificationRule> defaultRules() {
        Map<String, NotificationRule> rules = new LinkedHashMap<>();
        // Admins get all alerts, quiet hours off
        rules.put(
                "admin",
                rule(
                        EnumSet.of(NotificationChannel.EMAIL, NotificationChannel.WEBSOCKET, NotificationChannel.SLACK),
                        EnumSet.of(AlertPriority.CRITICAL, AlertPriority.HIGH, AlertPriority.MEDIUM),
                        1,
                        22,
                        8,
                        false));
        rules.put(
                "supervisor",
                rule(
                        EnumSet.of(NotificationChannel.EMAIL, NotificationChannel.WEBSOCKET),
                        EnumSet.of(AlertPriority.CRITICAL, AlertPriority.HIGH),
                        2,
                        20,
                        9,
                        true));
        rules.put(
                "developer",
                rule(
                        EnumSet.of(NotificationChannel.WEBSOCKET, NotificationChannel.SLACK),
                        EnumSet.of(AlertPriority.HIGH, AlertPriority.MEDIUM, AlertPriority.LOW),
                        3,
                        19,
                        10,
                        true));
        rules.put(
                "operations",
                rule(
                        EnumSet.of(NotificationChannel.EMAIL, NotificationChannel.WEBSOCKET, NotificationChannel.SMS),
                        EnumSet.of(AlertPriority.CRITICAL, AlertPriority.HIGH, AlertPriority.MEDIUM),
                        1,
                        23,
                        7,
                        true));
        return rules;
    }

    private static NotificationRule rule(
            Set<NotificationChannel> channels,
            Set<AlertPriority> priorities,
            int escalationLevel,
            int quietStart,
            int quietEnd,
            boolean enableQuietHours) {
        return NotificationRule.builder()
                .channels(channels)
                .priorities(priorities)
                .escalationLevel(escalationLevel)
                .quietHours(new QuietHours(quietStart, quietEnd))
                .enableQuietHours(enableQuietHours)
                .build();
    }

    private static List<EscalationStep> defaultChain() {
        List<EscalationStep> chain = new ArrayList<>();
        chain.add(new EscalationStep("admin", 0));
        chain.add(new EscalationStep("supervisor", 300_000));
        chain.add(new EscalationStep("operations", 900_000));
        return chain;
    }

    private static Map<String, AlertTemplate> defaultTemplates() {
        Map<String, AlertTemplate> templates = new LinkedHashMap<>();
        templates.put(
                "system_down",
                template(
                        "CRITICAL: System Down - Immediate Action Required",
                        "The system has experienced a critical failure. Immediate attention required.",
                        AlertPriority.CRITICAL,
                        EnumSet.of(
                                NotificationChannel.EMAIL,
                                NotificationChannel.SMS,
                                NotificationChannel.SLACK,
                                NotificationChannel.WEBSOCKET),
                        true));
        templates.put(
                "high_error_rate",
                template(
                        "HIGH: Elevated Error Rate Detected",
                        "Error rate has exceeded threshold. Current rate: {errorRate}%. Threshold: {threshold}%",
                        AlertPriority.HIGH,
                        EnumSet.of(NotificationChannel.EMAIL, NotificationChannel.SLACK, NotificationChannel.WEBSOCKET),
                        true));
        templates.put(
                "performance_degradation",
                template(
                        "MEDIUM: Performance Degradation",
                        "System performance has degraded. Response time: {responseTime}ms (threshold: {threshold}ms)",
                        AlertPriority.MEDIUM,
                        EnumSet.of(NotificationChannel.WEBSOCKET, NotificationChannel.SLACK),
                        false));
        templates.put(
                "cost_threshold",
                template(
                        "MEDIUM: Cost Threshold Exceeded",
                        "Daily cost has exceeded budget. Current: ${currentCost}, Budget: ${budgetLimit}",
                        AlertPriority.MEDIUM,
                        EnumSet.of(NotificationChannel.EMAIL, NotificationChannel.WEBSOCKET),
                        false));
        templates.put(
                "resource_usage",
                template(
                        "LOW: High Resource Usage",
                        "Resource usage is elevated. {resource}: {usage}% (threshold: {threshold}%)",
                        AlertPriority.LOW,
                        EnumSet.of(NotificationChannel.WEBSOCKET),
                        false));
        templates.put(
                "optimization_completed",
                template(
                        "INFO: System Optimization Completed",
                        "Automatic optimization has been applied. Expected improvement: {improvement}%",
                        AlertPriority.INFO,
                        EnumSet.of(NotificationChannel.WEBSOCKET),
                        false));
        return templates;
    }

    private static AlertTemplate template(
            String subject, String body, AlertPriority priority, Set<NotificationChannel> channels, boolean escalate) {
        return AlertTemplate.builder()
                .subject(subject)
                .body(body)
                .priority(priority)
                .channels(channels)
                .escalate(escalate)
                .build();
    }

    private static Map<String, List<Recipient>> defaultUsers() {
        Map<String, List<Recipient>> users = new LinkedHashMap<>();
        users.put(
                "admin",
                List.of(user(
                        "admin1",
                        "+15550100001",
                        "admin@company.com",
                        "admin",
                        EnumSet.of(NotificationChannel.EMAIL, NotificationChannel.SMS, NotificationChannel.WEBSOCKET))));
        users.put(
                "supervisor",
                List.of(user(
                        "supervisor1",
                        "+15550100002",
                        "supervisor@company.com",
                        "supervisor",
                        EnumSet.of(NotificationChannel.EMAIL, NotificationChannel.WEBSOCKET))));
        users.put(
                "developer",
                List.of(user(
                        "dev1",
                        null,
                        "dev@company.com",
                        "developer",
                        EnumSet.of(NotificationChannel.WEBSOCKET, NotificationChannel.SLACK))));
        users.put(
                "operations",
                List.of(user(
                        "ops1",
                        "+15550100004",
                        "ops@company.com",
                        "operations",
                        EnumSet.of(NotificationChannel.EMAIL, NotificationChannel.SMS, NotificationChannel.WEBSOCKET))));
        return users;
    }

    private static Recipient user(
            String id, String phone, String email, String role, Set<NotificationChannel> channels) {
        return Recipient.builder()
                .id(id)
                .phone(phone)
                .email(email)
                .role(role)
                .notificationChannels(channels)
                .build();
    }
}
