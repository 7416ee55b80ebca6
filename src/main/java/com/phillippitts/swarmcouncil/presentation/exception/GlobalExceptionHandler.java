package com.phillippitts.swarmcouncil.presentation.exception;

import com.phillippitts.swarmcouncil.exception.CouncilConfigurationException;
import com.phillippitts.swarmcouncil.exception.CouncilNotReadyException;
import com.phillippitts.swarmcouncil.exception.InvalidRequestException;
import com.phillippitts.swarmcouncil.exception.ProviderException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Provider details stay in the server log.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - invalid prompt, workflow or role (HTTP 400).
     */
    @ExceptionHandler(InvalidRequestException.class)
    ResponseEntity<ApiError> handleInvalidRequest(InvalidRequestException ex) {
        LOG.warn("Invalid request: field={}, reason={}", ex.getField(), ex.getReason());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Invalid request",
                ex.getReason(),
                Instant.now()
            ));
    }

    /**
     * Client error - request body failed Bean Validation (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
            .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
            .collect(Collectors.joining(", "));
        LOG.warn("Request validation failed: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("ValidationError", "Invalid request", details, Instant.now()));
    }

    /**
     * Client error - unreadable JSON body (HTTP 400).
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError("MalformedRequest", "Invalid request", "Request body is not valid JSON",
                Instant.now()));
    }

    /**
     * Council not initialized - retry after reinitialization (HTTP 503).
     */
    @ExceptionHandler(CouncilNotReadyException.class)
    ResponseEntity<ApiError> handleNotReady(CouncilNotReadyException ex) {
        LOG.warn("Council not ready: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Council not ready",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Configuration error - no provider could be initialized (HTTP 503).
     */
    @ExceptionHandler(CouncilConfigurationException.class)
    ResponseEntity<ApiError> handleConfiguration(CouncilConfigurationException ex) {
        LOG.error("Council configuration error: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Council unavailable",
                "No providers could be initialized. Check provider configuration and credentials.",
                Instant.now()
            ));
    }

    /**
     * Upstream provider failure on a direct consultation (HTTP 502).
     */
    @ExceptionHandler(ProviderException.class)
    ResponseEntity<ApiError> handleProviderFailure(ProviderException ex) {
        LOG.error("Provider call failed: provider={}, status={}", ex.getProviderId(), ex.getStatusCode(), ex);
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Provider request failed",
                "Provider " + ex.getProviderId() + " did not return content. Please retry.",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
