package com.phillippitts.swarmcouncil.presentation.exception;

import com.phillippitts.swarmcouncil.exception.CouncilConfigurationException;
import com.phillippitts.swarmcouncil.exception.CouncilNotReadyException;
import com.phillippitts.swarmcouncil.exception.InvalidRequestException;
import com.phillippitts.swarmcouncil.exception.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void invalidRequestReturns400WithReason() {
        ResponseEntity<?> response = handler.handleInvalidRequest(
                new InvalidRequestException("workflow", "Unknown workflow: x. Available workflows: full"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("InvalidRequestException")
                .contains("Unknown workflow: x");
    }

    @Test
    void notReadyReturns503() {
        ResponseEntity<?> response = handler.handleNotReady(
                new CouncilNotReadyException("SwarmCouncil", "FAILED", List.of()));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).contains("Council not ready");
    }

    @Test
    void configurationErrorDoesNotExposeProviderErrors() {
        ResponseEntity<?> response = handler.handleConfiguration(new CouncilConfigurationException(
                "Failed to initialize any providers", List.of("openai: key sk-secret rejected")));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody().toString()).doesNotContain("sk-secret");
    }

    @Test
    void providerFailureReturns502WithoutInternalDetails() {
        ResponseEntity<?> response = handler.handleProviderFailure(
                new ProviderException("Internal error: token=secret123", "gemini", 500, null));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_GATEWAY);
        assertThat(response.getBody().toString())
                .contains("gemini")
                .contains("retry")
                .doesNotContain("secret123");
    }

    @Test
    void unexpectedReturns500WithGenericBody() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("Internal stack detail"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .contains("contact support")
                .doesNotContain("Internal stack detail");
    }

    @Test
    void errorResponseHasValidStructure() {
        ResponseEntity<?> response = handler.handleInvalidRequest(new InvalidRequestException("prompt", "Test"));

        String body = response.getBody().toString();
        assertThat(body).contains("errorCode=");
        assertThat(body).contains("message=");
        assertThat(body).contains("details=");
        assertThat(body).matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
