package com.phillippitts.audiogen.service.auth;

import com.phillippitts.audiogen.exception.AuthExhaustedException;

/**
 * Obtains and refreshes the session a backend needs.
 *
 * <p>Only the authenticator creates or replaces sessions. Concurrent callers all observe the
 * same current session.
 *
 * @param <S> session type of the backend
 */
public interface Authenticator<S extends BackendSession> extends AutoCloseable {

    /**
     * Returns the current session, establishing one if none is held yet.
     *
     * @return a usable session
     * @throws AuthExhaustedException if no session could be established within the attempt budget
     */
    S acquire();

    /**
     * Replaces {@code stale} with a fresh session, re-authenticating first when the backend
     * supports it. If another caller already replaced {@code stale}, that newer session is
     * returned without re-authenticating again.
     *
     * @param stale the session the caller found to be expired
     * @return a fresh session
     * @throws AuthExhaustedException if no session could be established within the attempt budget
     */
    S refresh(S stale);

    /**
     * @return backend name for logs and metrics (e.g., "polly", "http")
     */
    String getBackendName();

    @Override
    void close();
}
