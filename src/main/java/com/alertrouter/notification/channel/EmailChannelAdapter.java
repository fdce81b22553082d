package com.alertrouter.notification.channel;

import com.alertrouter.config.AlertingProperties;
import com.alertrouter.domain.enums.AlertPriority;
import com.alertrouter.domain.enums.NotificationChannel;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.DeliveryResult;
import com.alertrouter.domain.model.Recipient;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

/**
 * Sends HTML alert emails through the Spring {@link JavaMailSender}.
 *
 * <p>Only available when a mail sender is configured ({@code spring.mail.host}). One message
 * is sent with every reachable recipient in {@code To}; recipients without an address or
 * without EMAIL among their preferred channels are skipped.
 */
@Component
public class EmailChannelAdapter implements NotificationChannelAdapter {

    private static final Logger log = LoggerFactory.getLogger(EmailChannelAdapter.class);

    private static final Map<AlertPriority, String> PRIORITY_COLORS = Map.of(
            AlertPriority.CRITICAL, "#dc3545",
            AlertPriority.HIGH, "#fd7e14",
            AlertPriority.MEDIUM, "#ffc107",
            AlertPriority.LOW, "#28a745",
            AlertPriority.INFO, "#17a2b8");

    private final ObjectProvider<JavaMailSender> mailSenderProvider;
    private final AlertingProperties alertingProperties;

    public EmailChannelAdapter(
            ObjectProvider<JavaMailSender> mailSenderProvider, AlertingProperties alertingProperties) {
        this.mailSenderProvider = mailSenderProvider;
        this.alertingProperties = alertingProperties;
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.EMAIL;
    }

    @Override
    public boolean isAvailable() {
        return mailSenderProvider.getIfAvailable() != null;
    }

    @Override
    public DeliveryResult sendNotification(Alert alert, List<Recipient> recipients) {
        List<String> addresses = recipients.stream()
                .filter(r -> r.getEmail() != null && r.prefers(NotificationChannel.EMAIL))
                .map(Recipient::getEmail)
                .toList();
        if (addresses.isEmpty()) {
            return DeliveryResult.success(0);
        }

        JavaMailSender mailSender = mailSenderProvider.getIfAvailable();
        if (mailSender == null) {
            return DeliveryResult.failure("No mail sender configured");
        }

        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, false, "UTF-8");
            helper.setFrom(alertingProperties.getChannels().getEmail().getFrom());
            helper.setTo(addresses.toArray(String[]::new));
            helper.setSubject(alert.getTitle());
            helper.setText(renderHtml(alert), true);
            mailSender.send(message);
            log.debug("Email alert sent: alertId={}, recipients={}", alert.getId(), addresses.size());
            return DeliveryResult.success(addresses.size());
        } catch (MessagingException | MailException e) {
            log.error("Failed to send email alert {}: {}", alert.getId(), e.getMessage());
            return DeliveryResult.failure(e.getMessage());
        }
    }

    private String renderHtml(Alert alert) {
        String color = PRIORITY_COLORS.getOrDefault(alert.getPriority(), "#6c757d");
        StringBuilder html = new StringBuilder();
        html.append("<div style=\"font-family: Arial, sans-serif; max-width: 600px;\">");
        html.append("<div style=\"background-color: ")
                .append(color)
                .append("; color: white; padding: 16px;\"><h2 style=\"margin: 0;\">")
                .append(escape(alert.getTitle()))
                .append("</h2></div>");
        html.append("<div style=\"padding: 16px;\"><p>")
                .append(escape(alert.getMessage()))
                .append("</p>");
        html.append("<p><strong>Priority:</strong> ")
                .append(alert.getPriority().getKey().toUpperCase())
                .append("<br><strong>Time:</strong> ")
                .append(alert.getTimestamp())
                .append("<br><strong>Source:</strong> ")
                .append(escape(alert.getSource()))
                .append("<br><strong>Alert ID:</strong> ")
                .append(escape(alert.getId()))
                .append("</p>");
        if (alert.getData() != null && !alert.getData().isEmpty()) {
            html.append("<h3>Details</h3><pre>")
                    .append(escape(String.valueOf(alert.getData())))
                    .append("</pre>");
        }
        html.append("</div></div>");
        return html.toString();
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
