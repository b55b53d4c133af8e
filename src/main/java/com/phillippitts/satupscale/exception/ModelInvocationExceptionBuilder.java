package com.phillippitts.satupscale.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link ModelInvocationException} with process context.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw ModelInvocationExceptionBuilder.create("Non-zero exit: 1")
 *         .model("SatelliteSR")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("weights", weightsPath)
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class ModelInvocationExceptionBuilder {

    private final String message;
    private String modelName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private ModelInvocationExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static ModelInvocationExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new ModelInvocationExceptionBuilder(message);
    }

    public ModelInvocationExceptionBuilder model(String modelName) {
        this.modelName = modelName;
        return this;
    }

    public ModelInvocationExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public ModelInvocationExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public ModelInvocationExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     */
    public ModelInvocationExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (model: {model})
     * </pre>
     */
    public ModelInvocationException build() {
        String detailedMessage = buildDetailedMessage();
        String model = modelName != null ? modelName : "unknown";
        if (cause != null) {
            return new ModelInvocationException(detailedMessage, model, cause);
        }
        return new ModelInvocationException(detailedMessage, model);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
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
