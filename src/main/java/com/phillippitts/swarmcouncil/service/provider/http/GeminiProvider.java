package com.phillippitts.swarmcouncil.service.provider.http;

import com.phillippitts.swarmcouncil.config.properties.ProviderProperties.ProviderSettings;
import com.phillippitts.swarmcouncil.exception.ProviderExceptionBuilder;
import com.phillippitts.swarmcouncil.service.provider.AbstractContentProvider;
import com.phillippitts.swarmcouncil.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Objects;

/**
 * Provider for the Gemini {@code models/{model}:generateContent} endpoint. The API key travels
 * as a query parameter.
 */
public class GeminiProvider extends AbstractContentProvider {

    private static final Logger LOG = LogManager.getLogger(GeminiProvider.class);

    private final RestClient restClient;
    private final ProviderSettings settings;

    public GeminiProvider(String providerId, ProviderSettings settings, RestClient restClient,
                          ApplicationEventPublisher publisher) {
        super(providerId, publisher);
        this.settings = Objects.requireNonNull(settings, "settings");
        this.restClient = Objects.requireNonNull(restClient, "restClient");
    }

    @Override
    protected String doGenerate(String prompt) {
        String body = ProviderJsonCodec.geminiRequest(
                prompt, settings.getMaxTokens(), settings.getTemperature()).toString();
        long start = System.nanoTime();
        try {
            String response = restClient.post()
                    .uri("/models/{model}:generateContent?key={key}", settings.getModel(), settings.getApiKey())
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(String.class);
            String text = ProviderJsonCodec.extractGeminiText(response, getProviderId());
            LOG.debug("{} generated {} chars in {}ms", getProviderId(), text.length(), TimeUtils.elapsedMillis(start));
            return text;
        } catch (RestClientResponseException e) {
            throw ProviderExceptionBuilder.create("Gemini request rejected")
                    .provider(getProviderId())
                    .statusCode(e.getStatusCode().value())
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("model", settings.getModel())
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw ProviderExceptionBuilder.create("Gemini request failed")
                    .provider(getProviderId())
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("model", settings.getModel())
                    .cause(e)
                    .build();
        }
    }

    @Override
    protected void doProbe() {
        if (!settings.hasCredential()) {
            throw ProviderExceptionBuilder.create("API key not configured").provider(getProviderId()).build();
        }
        doGenerate(HEALTH_CHECK_PROMPT);
    }
}
