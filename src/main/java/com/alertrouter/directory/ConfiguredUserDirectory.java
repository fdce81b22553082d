package com.alertrouter.directory;

import com.alertrouter.config.AlertingProperties;
import com.alertrouter.domain.model.Recipient;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * {@link UserDirectory} backed by {@code alerting.directory.users.<role>}.
 */
@Component
public class ConfiguredUserDirectory implements UserDirectory {

    private final AlertingProperties alertingProperties;

    public ConfiguredUserDirectory(AlertingProperties alertingProperties) {
        this.alertingProperties = alertingProperties;
    }

    @Override
    public List<Recipient> getUsersByRole(String role) {
        List<Recipient> users = alertingProperties.getDirectory().getUsers().get(role);
        return users != null ? List.copyOf(users) : List.of();
    }
}
