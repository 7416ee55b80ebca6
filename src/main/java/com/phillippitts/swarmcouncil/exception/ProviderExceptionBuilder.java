package com.phillippitts.swarmcouncil.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ProviderException} with contextual details.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw ProviderExceptionBuilder.create("Generation request failed")
 *         .provider("openai")
 *         .statusCode(429)
 *         .durationMs(812)
 *         .metadata("model", model)
 *         .cause(ex)
 *         .build();
 * </pre>
 */
public final class ProviderExceptionBuilder {

    private final String message;
    private String providerId;
    private Throwable cause;
    private Integer statusCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ProviderExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ProviderExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ProviderExceptionBuilder(message);
    }

    public ProviderExceptionBuilder provider(String providerId) {
        this.providerId = providerId;
        return this;
    }

    public ProviderExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ProviderExceptionBuilder statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public ProviderExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata entry to the message. Null keys or values are ignored.
     *
     * @param key metadata key (e.g. model, endpoint)
     * @param value metadata value
     * @return this builder for chaining
     */
    public ProviderExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (status={code}, durationMs={ms}, {key1}={val1}, ...) (provider: {id})
     * </pre>
     *
     * @return constructed ProviderException
     */
    public ProviderException build() {
        String provider = providerId != null ? providerId : "unknown";
        return new ProviderException(buildDetailedMessage(), provider, statusCode, cause);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = statusCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (statusCode != null) {
            sb.append("status=").append(statusCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
