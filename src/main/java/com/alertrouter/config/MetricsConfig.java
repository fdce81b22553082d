package com.alertrouter.config;

import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import org.springframework.context.annotation.Configuration;

/**
 * Tags every meter with the application and environment so alert metrics from several
 * deployments can share one backend.
 */
@Configuration
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final AlertingProperties alertingProperties;

    public MetricsConfig(MeterRegistry meterRegistry, AlertingProperties alertingProperties) {
        this.meterRegistry = meterRegistry;
        this.alertingProperties = alertingProperties;
    }

    @PostConstruct
    void configureCommonTags() {
        meterRegistry.config().commonTags("application", "alert-router", "environment", alertingProperties.getEnvironment());
    }
}
