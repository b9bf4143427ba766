package com.phillippitts.audiogen.exception;

/**
 * Thrown when an authenticator used up its attempt budget without obtaining a usable session.
 * The run cannot continue without a session, so this aborts it.
 */
public class AuthExhaustedException extends AudioGenException {

    private final String backend;
    private final int attempts;

    public AuthExhaustedException(String backend, int attempts, Throwable lastFailure) {
        super("Unable to authenticate with " + backend + " after " + attempts + " attempt(s)", lastFailure);
        this.backend = backend;
        this.attempts = attempts;
    }

    public String getBackend() {
        return backend;
    }

    public int getAttempts() {
        return attempts;
    }
}
