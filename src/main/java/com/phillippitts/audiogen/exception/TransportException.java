package com.phillippitts.audiogen.exception;

/**
 * Network or transport level failure calling a backend, including non-200 HTTP responses.
 * Never retried automatically.
 */
public class TransportException extends SynthesisException {

    private final Integer httpStatus;

    public TransportException(String message, String backend, String requestId, Integer chunkIndex,
                              Integer httpStatus, Throwable cause) {
        super(message, backend, requestId, chunkIndex, cause);
        this.httpStatus = httpStatus;
    }

    /**
     * @return HTTP status returned by the backend, or null when no response was received
     */
    public Integer getHttpStatus() {
        return httpStatus;
    }

    @Override
    public String getReason() {
        return "transport";
    }
}
