package com.phillippitts.swarmcouncil.service.provider;

import com.phillippitts.swarmcouncil.config.properties.ProviderProperties;
import com.phillippitts.swarmcouncil.config.properties.ProviderProperties.ProviderSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PropertiesProviderCatalogTest {

    private ProviderProperties properties;
    private PropertiesProviderCatalog catalog;

    @BeforeEach
    void setUp() {
        properties = new ProviderProperties();
        properties.getProviders().put("gemini", settings("key-1", "creator", true, 4));
        properties.getProviders().put("openai", settings(null, "reviewer", true, 2));
        properties.getProviders().put("claude", settings("key-3", "enhancer", false, 1));
        properties.getProviders().put("chinda", settings("key-5", "localizer", true, null));
        catalog = new PropertiesProviderCatalog(properties);
    }

    private static ProviderSettings settings(String apiKey, String role, boolean enabled, Integer priority) {
        ProviderSettings s = new ProviderSettings();
        s.setApiKey(apiKey);
        s.setRole(role);
        s.setEnabled(enabled);
        s.setPriority(priority);
        s.setSpecialties(List.of("thai"));
        return s;
    }

    @Test
    void listsEnabledCredentialedProvidersInDeclarationOrder() {
        assertThat(catalog.enabledProviders()).extracting(ProviderDefinition::identifier)
                .containsExactly("gemini", "chinda");
    }

    @Test
    void appliesDefaults() {
        ProviderDefinition chinda = catalog.find("chinda");

        assertThat(chinda.priority()).isEqualTo(ProviderProperties.DEFAULT_PRIORITY);
        assertThat(chinda.displayName()).isEqualTo("chinda");
        assertThat(chinda.specialties()).containsExactly("thai");
    }

    @Test
    void findsDisabledAndUnknownEntries() {
        ProviderDefinition claude = catalog.find("claude");

        assertThat(claude.enabled()).isFalse();
        assertThat(claude.isCandidate()).isFalse();
        assertThat(catalog.find("openai").hasCredential()).isFalse();
        assertThat(catalog.find("mistral")).isNull();
    }

    @Test
    void blankApiKeyCountsAsMissing() {
        properties.getProviders().get("gemini").setApiKey("  ");

        assertThat(catalog.enabledProviders()).extracting(ProviderDefinition::identifier).containsExactly("chinda");
    }
}
