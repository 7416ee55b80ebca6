package com.phillippitts.swarmcouncil.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for council lifecycle, health monitoring and degradation.
 */
@ConfigurationProperties(prefix = "council")
@Validated
public class CouncilProperties {

    /** Upper bound for constructing a single provider. */
    @NotNull
    private Duration constructionTimeout = Duration.ofSeconds(10);

    /** Interval between periodic provider health checks. */
    @NotNull
    private Duration healthCheckInterval = Duration.ofMinutes(5);

    /** Enable/disable periodic health checks after initialization. */
    private boolean healthMonitoringEnabled = true;

    /** Appended to the original prompt when asking providers for fallback content. */
    @NotNull
    private String fallbackMarker = "\n\n[Fallback mode - simple response requested]";

    /** Returned as fallback content when every provider fails. */
    @NotBlank
    private String fallbackSentinel = "Unable to generate content - all providers failed";

    /** Initialize both councils once the application is ready. */
    private boolean autoInitialize = true;

    /** Adopt healthy providers from the shared pool instead of constructing new ones. */
    private boolean useSharedPool = false;

    /** Default workflow deadline; zero means no deadline. */
    @NotNull
    private Duration workflowTimeout = Duration.ZERO;

    public Duration getConstructionTimeout() {
        return constructionTimeout;
    }

    public void setConstructionTimeout(Duration constructionTimeout) {
        this.constructionTimeout = constructionTimeout;
    }

    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }

    public void setHealthCheckInterval(Duration healthCheckInterval) {
        this.healthCheckInterval = healthCheckInterval;
    }

    public boolean isHealthMonitoringEnabled() {
        return healthMonitoringEnabled;
    }

    public void setHealthMonitoringEnabled(boolean healthMonitoringEnabled) {
        this.healthMonitoringEnabled = healthMonitoringEnabled;
    }

    public String getFallbackMarker() {
        return fallbackMarker;
    }

    public void setFallbackMarker(String fallbackMarker) {
        this.fallbackMarker = fallbackMarker;
    }

    public String getFallbackSentinel() {
        return fallbackSentinel;
    }

    public void setFallbackSentinel(String fallbackSentinel) {
        this.fallbackSentinel = fallbackSentinel;
    }

    public boolean isAutoInitialize() {
        return autoInitialize;
    }

    public void setAutoInitialize(boolean autoInitialize) {
        this.autoInitialize = autoInitialize;
    }

    public boolean isUseSharedPool() {
        return useSharedPool;
    }

    public void setUseSharedPool(boolean useSharedPool) {
        this.useSharedPool = useSharedPool;
    }

    public Duration getWorkflowTimeout() {
        return workflowTimeout;
    }

    public void setWorkflowTimeout(Duration workflowTimeout) {
        this.workflowTimeout = workflowTimeout;
    }
}
