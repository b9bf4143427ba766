package com.phillippitts.audiogen.exception;

import com.phillippitts.audiogen.service.synthesis.BackendStatus;

/**
 * Backend reported a semantic failure through its own status code.
 * The message always includes the raw code and its human-readable mapping.
 */
public class BackendStatusException extends SynthesisException {

    private final int statusCode;
    private final BackendStatus status;

    public BackendStatusException(String message, String backend, String requestId, Integer chunkIndex,
                                  int statusCode) {
        super(message, backend, requestId, chunkIndex, null);
        this.statusCode = statusCode;
        this.status = BackendStatus.fromCode(statusCode);
    }

    public int getStatusCode() {
        return statusCode;
    }

    public BackendStatus getStatus() {
        return status;
    }

    @Override
    public String getReason() {
        return "status-" + status.name().toLowerCase();
    }
}
