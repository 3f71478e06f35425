package com.phillippitts.voicegate.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for provider failures carrying request context.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * // Retry budget exhausted
 * throw ProviderExceptionBuilder.create("Credential request failed")
 *         .attempts(3)
 *         .durationMs(7012)
 *         .metadata("model", "gpt-realtime-mini")
 *         .cause(lastError)
 *         .unavailable();
 *
 * // Terminal rejection
 * throw ProviderExceptionBuilder.create("Credential request rejected")
 *         .status(401)
 *         .metadata("voice", "cedar")
 *         .rejected();
 * </pre>
 */
public final class ProviderExceptionBuilder {

    private final String message;
    private Throwable cause;
    private int attempts = 1;
    private int status;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ProviderExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static ProviderExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ProviderExceptionBuilder(message);
    }

    public ProviderExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ProviderExceptionBuilder attempts(int attempts) {
        this.attempts = attempts;
        return this;
    }

    /**
     * Sets the HTTP status returned by the provider.
     *
     * @param status HTTP status code
     * @return this builder for chaining
     */
    public ProviderExceptionBuilder status(int status) {
        this.status = status;
        return this;
    }

    public ProviderExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message.
     * Never pass credentials or API keys here.
     *
     * @param key metadata key
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
     * Builds the exception for an exhausted retry budget.
     *
     * @return constructed ProviderUnavailableException
     */
    public ProviderUnavailableException unavailable() {
        String detailed = buildDetailedMessage();
        return cause != null
                ? new ProviderUnavailableException(detailed, attempts, cause)
                : new ProviderUnavailableException(detailed, attempts);
    }

    /**
     * Builds the exception for a terminal provider rejection.
     *
     * @return constructed ProviderRequestException
     */
    public ProviderRequestException rejected() {
        String detailed = buildDetailedMessage();
        return cause != null
                ? new ProviderRequestException(detailed, status, cause)
                : new ProviderRequestException(detailed, status);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (durationMs != null) {
            sb.append("durationMs=").append(durationMs);
            first = false;
        }

        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        sb.append(")");
        return sb.toString();
    }
}
