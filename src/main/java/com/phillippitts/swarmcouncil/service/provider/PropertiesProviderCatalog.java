package com.phillippitts.swarmcouncil.service.provider;

import com.phillippitts.swarmcouncil.config.properties.ProviderProperties;
import com.phillippitts.swarmcouncil.config.properties.ProviderProperties.ProviderSettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ProviderCatalog} backed by {@code council.providers.*} properties.
 */
@Component
public class PropertiesProviderCatalog implements ProviderCatalog {

    private static final Logger LOG = LogManager.getLogger(PropertiesProviderCatalog.class);

    private final ProviderProperties properties;

    public PropertiesProviderCatalog(ProviderProperties properties) {
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    @Override
    public List<ProviderDefinition> enabledProviders() {
        List<ProviderDefinition> candidates = new ArrayList<>();
        for (Map.Entry<String, ProviderSettings> entry : properties.getProviders().entrySet()) {
            ProviderDefinition def = toDefinition(entry.getKey(), entry.getValue());
            if (def.isCandidate()) {
                candidates.add(def);
            } else if (def.enabled()) {
                LOG.debug("Provider {} enabled but has no credential; skipping", def.identifier());
            }
        }
        return List.copyOf(candidates);
    }

    @Override
    public ProviderDefinition find(String identifier) {
        ProviderSettings settings = properties.getProviders().get(identifier);
        return settings == null ? null : toDefinition(identifier, settings);
    }

    private static ProviderDefinition toDefinition(String id, ProviderSettings s) {
        return new ProviderDefinition(
                id,
                s.getDisplayName(),
                s.getRole(),
                s.getSpecialties(),
                s.effectivePriority(),
                s.isEnabled(),
                s.hasCredential()
        );
    }
}
