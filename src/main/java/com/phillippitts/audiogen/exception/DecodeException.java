package com.phillippitts.audiogen.exception;

/**
 * Backend response body could not be parsed into the expected shape.
 */
public class DecodeException extends SynthesisException {

    public DecodeException(String message, String backend, String requestId, Integer chunkIndex,
                           Throwable cause) {
        super(message, backend, requestId, chunkIndex, cause);
    }

    @Override
    public String getReason() {
        return "decode";
    }
}
