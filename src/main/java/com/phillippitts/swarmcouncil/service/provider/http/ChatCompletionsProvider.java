package com.phillippitts.swarmcouncil.service.provider.http;

import com.phillippitts.swarmcouncil.config.properties.ProviderProperties.ProviderSettings;
import com.phillippitts.swarmcouncil.exception.ProviderExceptionBuilder;
import com.phillippitts.swarmcouncil.service.provider.AbstractContentProvider;
import com.phillippitts.swarmcouncil.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

import java.util.Objects;

/**
 * Provider for OpenAI-compatible {@code POST /chat/completions} endpoints.
 *
 * <p>Used for OpenAI, DeepSeek, ChindaX and Qwen backends, which differ only in base URL,
 * model and key.
 */
public class ChatCompletionsProvider extends AbstractContentProvider {

    private static final Logger LOG = LogManager.getLogger(ChatCompletionsProvider.class);

    private final RestClient restClient;
    private final ProviderSettings settings;

    /**
     * @param providerId provider identifier
     * @param settings   model, key and sampling settings
     * @param restClient client already bound to the provider's base URL
     * @param publisher  failure event publisher (may be null)
     */
    public ChatCompletionsProvider(String providerId, ProviderSettings settings, RestClient restClient,
                                   ApplicationEventPublisher publisher) {
        super(providerId, publisher);
        this.settings = Objects.requireNonNull(settings, "settings");
        this.restClient = Objects.requireNonNull(restClient, "restClient");
    }

    @Override
    protected String doGenerate(String prompt) {
        String body = ProviderJsonCodec.chatCompletionsRequest(
                settings.getModel(), prompt, settings.getMaxTokens(), settings.getTemperature()).toString();
        long start = System.nanoTime();
        try {
            String response = restClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey())
                    .body(body)
                    .retrieve()
                    .body(String.class);
            String text = ProviderJsonCodec.extractChatContent(response, getProviderId());
            LOG.debug("{} generated {} chars in {}ms", getProviderId(), text.length(), TimeUtils.elapsedMillis(start));
            return text;
        } catch (RestClientResponseException e) {
            throw ProviderExceptionBuilder.create("Chat completion request rejected")
                    .provider(getProviderId())
                    .statusCode(e.getStatusCode().value())
                    .durationMs(TimeUtils.elapsedMillis(start))
                    .metadata("model", settings.getModel())
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw ProviderExceptionBuilder.create("Chat completion request failed")
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
