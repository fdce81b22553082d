package com.alertrouter.notification;

import com.alertrouter.config.AlertingProperties;
import com.alertrouter.domain.model.Alert;
import com.alertrouter.domain.model.AlertTemplate;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Looks up named alert templates and renders their bodies.
 *
 * <p>Placeholders use {@code {identifier}} syntax and are filled from the alert's data map in
 * a single left-to-right pass. A placeholder with no matching key is left verbatim, so
 * {@code "{missing}"} renders as {@code "{missing}"}. There is no escaping and no nesting.
 */
@Component
public class AlertTemplateRegistry {

    private static final Logger log = LoggerFactory.getLogger(AlertTemplateRegistry.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{(\\w+)}");

    private final AlertingProperties alertingProperties;

    public AlertTemplateRegistry(AlertingProperties alertingProperties) {
        this.alertingProperties = alertingProperties;
    }

    public Optional<AlertTemplate> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(alertingProperties.getTemplates().get(name));
    }

    public Set<String> getTemplateNames() {
        return alertingProperties.getTemplates().keySet();
    }

    /**
     * Applies the named template to the alert: subject becomes the title, the rendered body
     * the message, the template priority replaces the alert's, template channels are added to
     * the declared ones and the escalate flag is recorded in the metadata.
     *
     * @return false if no template with that name exists (the alert is left untouched)
     */
    public boolean applyTemplate(Alert alert, String name) {
        Optional<AlertTemplate> found = find(name);
        if (found.isEmpty()) {
            log.debug("Unknown alert template '{}', alert {} left as is", name, alert.getId());
            return false;
        }

        AlertTemplate template = found.get();
        alert.setTitle(template.getSubject());
        alert.setMessage(render(template.getBody(), alert.getData()));
        alert.setPriority(template.getPriority());
        if (template.getChannels() != null) {
            alert.getChannels().addAll(template.getChannels());
        }
        alert.getMetadata().setTemplate(name);
        alert.getMetadata().setEscalate(template.isEscalate());
        return true;
    }

    public String render(String body, Map<String, Object> data) {
        if (body == null) {
            return null;
        }
        Matcher matcher = PLACEHOLDER.matcher(body);
        StringBuilder rendered = new StringBuilder(body.length());
        while (matcher.find()) {
            Object value = data != null ? data.get(matcher.group(1)) : null;
            String replacement = value != null ? String.valueOf(value) : matcher.group();
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }
}
