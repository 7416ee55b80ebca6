package com.phillippitts.swarmcouncil.config.properties;

import com.phillippitts.swarmcouncil.service.provider.ProviderKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Provider catalog bound from {@code council.providers.<id>.*}.
 *
 * <p>Declaration order is preserved and is the enumeration order used by the base council.
 */
@ConfigurationProperties(prefix = "council")
@Validated
public class ProviderProperties {

    /** Priority assumed for entries that do not declare one. */
    public static final int DEFAULT_PRIORITY = 999;

    private Map<String, ProviderSettings> providers = new LinkedHashMap<>();

    public Map<String, ProviderSettings> getProviders() {
        return providers;
    }

    public void setProviders(Map<String, ProviderSettings> providers) {
        this.providers = providers;
    }

    /**
     * Settings for one provider backend.
     */
    public static class ProviderSettings {
        private String displayName;
        private ProviderKind kind = ProviderKind.CHAT_COMPLETIONS;
        private String baseUrl;
        private String apiKey;
        private String model;
        private String role;
        private List<String> specialties = new ArrayList<>();
        private Integer priority;
        private boolean enabled = true;
        private int maxTokens = 2000;
        private double temperature = 0.7;
        private Duration requestTimeout = Duration.ofSeconds(60);

        public boolean hasCredential() {
            return apiKey != null && !apiKey.isBlank();
        }

        public int effectivePriority() {
            return priority != null ? priority : DEFAULT_PRIORITY;
        }

        public String getDisplayName() {
            return displayName;
        }

        public void setDisplayName(String displayName) {
            this.displayName = displayName;
        }

        public ProviderKind getKind() {
            return kind;
        }

        public void setKind(ProviderKind kind) {
            this.kind = kind;
        }

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getRole() {
            return role;
        }

        public void setRole(String role) {
            this.role = role;
        }

        public List<String> getSpecialties() {
            return specialties;
        }

        public void setSpecialties(List<String> specialties) {
            this.specialties = specialties;
        }

        public Integer getPriority() {
            return priority;
        }

        public void setPriority(Integer priority) {
            this.priority = priority;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public double getTemperature() {
            return temperature;
        }

        public void setTemperature(double temperature) {
            this.temperature = temperature;
        }

        public Duration getRequestTimeout() {
            return requestTimeout;
        }

        public void setRequestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
        }
    }
}
