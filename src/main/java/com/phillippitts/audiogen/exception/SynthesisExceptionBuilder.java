package com.phillippitts.audiogen.exception;

import com.phillippitts.audiogen.util.LogContext;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for synthesis failures with rich contextual information.
 *
 * <p>Keeps the diagnostic message format identical across backends so every failed chunk
 * can be traced back to its request, chunk and backend response.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw SynthesisExceptionBuilder.create("Backend returned HTTP 502")
 *         .backend("http")
 *         .withLogContext()
 *         .httpStatus(502)
 *         .metadata("body", snippet)
 *         .transport();
 *
 * throw SynthesisExceptionBuilder.create("Response is not valid JSON")
 *         .backend("http")
 *         .cause(e)
 *         .decode();
 * </pre>
 */
public final class SynthesisExceptionBuilder {

    private final String message;
    private String backend;
    private String requestId;
    private Integer chunkIndex;
    private Integer httpStatus;
    private Long durationMs;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private SynthesisExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static SynthesisExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new SynthesisExceptionBuilder(message);
    }

    public SynthesisExceptionBuilder backend(String backend) {
        this.backend = backend;
        return this;
    }

    public SynthesisExceptionBuilder requestId(String requestId) {
        this.requestId = requestId;
        return this;
    }

    public SynthesisExceptionBuilder chunkIndex(Integer chunkIndex) {
        this.chunkIndex = chunkIndex;
        return this;
    }

    /**
     * Copies request id and chunk index from the current logging context, when present.
     *
     * @return this builder for chaining
     */
    public SynthesisExceptionBuilder withLogContext() {
        if (requestId == null) {
            requestId = LogContext.requestId();
        }
        if (chunkIndex == null) {
            chunkIndex = LogContext.chunkIndex();
        }
        return this;
    }

    public SynthesisExceptionBuilder httpStatus(int httpStatus) {
        this.httpStatus = httpStatus;
        return this;
    }

    public SynthesisExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    public SynthesisExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are skipped.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public SynthesisExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public TransportException transport() {
        return new TransportException(detailedMessage(), backendName(), requestId, chunkIndex, httpStatus, cause);
    }

    public DecodeException decode() {
        return new DecodeException(detailedMessage(), backendName(), requestId, chunkIndex, cause);
    }

    public BackendStatusException status(int statusCode) {
        metadata.putIfAbsent("statusCode", String.valueOf(statusCode));
        return new BackendStatusException(detailedMessage(), backendName(), requestId, chunkIndex, statusCode);
    }

    private String backendName() {
        return backend != null ? backend : "unknown";
    }

    /**
     * Message format:
     * <pre>
     * {message} (requestId={id}, chunk={index}, httpStatus={code}, durationMs={ms}, {key1}={val1}, ...)
     * </pre>
     */
    String detailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (requestId != null) {
            details.put("requestId", requestId);
        }
        if (chunkIndex != null) {
            details.put("chunk", String.valueOf(chunkIndex));
        }
        if (httpStatus != null) {
            details.put("httpStatus", String.valueOf(httpStatus));
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
