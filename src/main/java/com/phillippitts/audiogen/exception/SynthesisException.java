package com.phillippitts.audiogen.exception;

/**
 * Thrown when synthesizing a chunk fails. Fatal for the current request only.
 *
 * <p>Carries the backend name and, when known, the request id and chunk index so the
 * failure can be reproduced from the log line alone.
 */
public class SynthesisException extends AudioGenException {

    private final String backend;
    private final String requestId;
    private final Integer chunkIndex;

    public SynthesisException(String message, String backend) {
        this(message, backend, null, null, null);
    }

    public SynthesisException(String message, String backend, Throwable cause) {
        this(message, backend, null, null, cause);
    }

    public SynthesisException(String message, String backend, String requestId, Integer chunkIndex,
                              Throwable cause) {
        super(message + " (backend: " + backend + ")", cause);
        this.backend = backend;
        this.requestId = requestId;
        this.chunkIndex = chunkIndex;
    }

    public String getBackend() {
        return backend;
    }

    public String getRequestId() {
        return requestId;
    }

    public Integer getChunkIndex() {
        return chunkIndex;
    }

    /**
     * Short machine-friendly reason, used as a metrics tag.
     */
    public String getReason() {
        return "synthesis";
    }
}
