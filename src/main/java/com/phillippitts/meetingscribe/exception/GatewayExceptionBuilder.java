package com.phillippitts.meetingscribe.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link GatewayException} with request context.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw GatewayExceptionBuilder.create("Recognition request failed")
 *         .gateway("recognition")
 *         .correlationId(7)
 *         .statusCode(502)
 *         .durationMs(1500)
 *         .metadata("streamId", streamId)
 *         .build();
 * </pre>
 */
public final class GatewayExceptionBuilder {

    private final String message;
    private String gateway;
    private Throwable cause;
    private Long correlationId;
    private Integer statusCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private GatewayExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static GatewayExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new GatewayExceptionBuilder(message);
    }

    public GatewayExceptionBuilder gateway(String gateway) {
        this.gateway = gateway;
        return this;
    }

    public GatewayExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public GatewayExceptionBuilder correlationId(long correlationId) {
        this.correlationId = correlationId;
        return this;
    }

    public GatewayExceptionBuilder statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public GatewayExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public GatewayExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (correlationId={id}, status={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     *
     * @return constructed GatewayException
     */
    public GatewayException build() {
        String detailedMessage = buildDetailedMessage();
        String name = gateway != null ? gateway : "unknown";
        if (cause != null) {
            return new GatewayException(detailedMessage, name, cause);
        }
        return new GatewayException(detailedMessage, name);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (correlationId != null) {
            details.put("correlationId", String.valueOf(correlationId));
        }
        if (statusCode != null) {
            details.put("status", String.valueOf(statusCode));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
