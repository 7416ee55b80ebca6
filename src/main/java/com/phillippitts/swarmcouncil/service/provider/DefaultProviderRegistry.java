package com.phillippitts.swarmcouncil.service.provider;

import com.phillippitts.swarmcouncil.config.properties.ProviderProperties;
import com.phillippitts.swarmcouncil.config.properties.ProviderProperties.ProviderSettings;
import com.phillippitts.swarmcouncil.exception.ProviderConstructionException;
import com.phillippitts.swarmcouncil.service.provider.http.ChatCompletionsProvider;
import com.phillippitts.swarmcouncil.service.provider.http.GeminiProvider;
import com.phillippitts.swarmcouncil.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.Objects;

/**
 * Builds HTTP-backed providers from {@code council.providers.*} settings.
 *
 * <p>Each construction gets its own {@link RestClient} cloned from the shared builder, bound to the
 * provider's base URL with its request timeout.
 */
@Component
public class DefaultProviderRegistry implements ProviderRegistry {

    private static final Logger LOG = LogManager.getLogger(DefaultProviderRegistry.class);
    private static final int CONNECT_TIMEOUT_MS = 10_000;

    private final ProviderProperties properties;
    private final RestClient.Builder restClientBuilder;
    private final ApplicationEventPublisher publisher;

    public DefaultProviderRegistry(ProviderProperties properties,
                                   RestClient.Builder restClientBuilder,
                                   ApplicationEventPublisher publisher) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.restClientBuilder = Objects.requireNonNull(restClientBuilder, "restClientBuilder");
        this.publisher = publisher;
    }

    @Override
    public ContentProvider construct(String identifier) {
        ProviderSettings settings = properties.getProviders().get(identifier);
        if (settings == null) {
            throw new ProviderConstructionException(identifier, "Unknown provider");
        }
        if (settings.getBaseUrl() == null || settings.getBaseUrl().isBlank()) {
            throw new ProviderConstructionException(identifier, "Base URL not configured");
        }
        if (!settings.hasCredential()) {
            throw new ProviderConstructionException(identifier, "API key not configured");
        }
        if (settings.getModel() == null || settings.getModel().isBlank()) {
            throw new ProviderConstructionException(identifier, "Model not configured");
        }

        RestClient client = buildClient(settings);
        LOG.info("Constructing provider {} (kind={}, model={}, key={})", identifier, settings.getKind(),
                settings.getModel(), LogSanitizer.maskSecret(settings.getApiKey()));
        return switch (settings.getKind()) {
            case GEMINI -> new GeminiProvider(identifier, settings, client, publisher);
            case CHAT_COMPLETIONS -> new ChatCompletionsProvider(identifier, settings, client, publisher);
        };
    }

    private RestClient buildClient(ProviderSettings settings) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(CONNECT_TIMEOUT_MS);
        requestFactory.setReadTimeout((int) settings.getRequestTimeout().toMillis());
        return restClientBuilder.clone()
                .baseUrl(settings.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }
}
