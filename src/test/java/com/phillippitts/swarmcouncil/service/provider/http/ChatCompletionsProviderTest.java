package com.phillippitts.swarmcouncil.service.provider.http;

import com.phillippitts.swarmcouncil.config.properties.ProviderProperties.ProviderSettings;
import com.phillippitts.swarmcouncil.exception.ProviderException;
import com.phillippitts.swarmcouncil.service.provider.ProviderFailureEvent;
import com.phillippitts.swarmcouncil.testutil.EventCapturingPublisher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class ChatCompletionsProviderTest {

    private static final String BASE_URL = "https://api.example.test/v1";

    private MockRestServiceServer server;
    private EventCapturingPublisher publisher;
    private ChatCompletionsProvider provider;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder().baseUrl(BASE_URL);
        server = MockRestServiceServer.bindTo(builder).build();
        publisher = new EventCapturingPublisher();

        ProviderSettings settings = new ProviderSettings();
        settings.setApiKey("sk-test-1234");
        settings.setModel("gpt-4o-mini");
        settings.setMaxTokens(500);
        provider = new ChatCompletionsProvider("openai", settings, builder.build(), publisher);
    }

    @Test
    void postsChatRequestAndExtractsContent() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer sk-test-1234"))
                .andExpect(jsonPath("$.model").value("gpt-4o-mini"))
                .andExpect(jsonPath("$.max_tokens").value(500))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[0].content").value("Write about Thai tea"))
                .andRespond(withSuccess(
                        "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"  Thai tea is great.  \"}}]}",
                        MediaType.APPLICATION_JSON));

        assertThat(provider.generate("Write about Thai tea")).isEqualTo("Thai tea is great.");
        server.verify();
    }

    @Test
    void reportsRejectedRequestWithStatus() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));

        assertThatThrownBy(() -> provider.generate("Hello"))
                .isInstanceOf(ProviderException.class)
                .hasMessageStartingWith("Chat completion request rejected (status=429")
                .hasMessageContaining("model=gpt-4o-mini")
                .hasMessageEndingWith("(provider: openai)")
                .satisfies(e -> assertThat(((ProviderException) e).getStatusCode()).isEqualTo(429));
        assertThat(publisher.eventsOf(ProviderFailureEvent.class)).singleElement()
                .satisfies(e -> assertThat(e.message()).isEqualTo("generation failure"));
    }

    @Test
    void rejectsResponseWithoutChoices() {
        server.expect(requestTo(BASE_URL + "/chat/completions"))
                .andRespond(withSuccess("{\"choices\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> provider.generate("Hello"))
                .isInstanceOf(ProviderException.class)
                .hasMessage("Response has no choices (provider: openai)");
    }

    @Test
    void rejectsBlankPromptWithoutCallingBackend() {
        assertThatThrownBy(() -> provider.generate(" "))
                .isInstanceOf(ProviderException.class)
                .hasMessage("Prompt must not be blank (provider: openai)");
        server.verify();
    }

    @Test
    void refusesCallsAfterTeardown() {
        provider.teardown();
        provider.teardown();

        assertThat(provider.isClosed()).isTrue();
        assertThatThrownBy(() -> provider.generate("Hello"))
                .isInstanceOf(ProviderException.class)
                .hasMessageContaining("torn down");
    }

    @Test
    void keepsAssignedRoleAndSpecialties() {
        provider.assignRole("reviewer");
        provider.assignSpecialties(List.of("grammar", "tone"));

        assertThat(provider.getRole()).isEqualTo("reviewer");
        assertThat(provider.getSpecialties()).containsExactly("grammar", "tone");
    }
}
