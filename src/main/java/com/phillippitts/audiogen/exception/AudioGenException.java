package com.phillippitts.audiogen.exception;

/**
 * Base exception for all audiogen application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class AudioGenException extends RuntimeException {

    public AudioGenException(String message) {
        super(message);
    }

    public AudioGenException(String message, Throwable cause) {
        super(message, cause);
    }

    public AudioGenException(Throwable cause) {
        super(cause);
    }
}
