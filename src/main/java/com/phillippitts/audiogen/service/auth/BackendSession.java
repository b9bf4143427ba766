package com.phillippitts.audiogen.service.auth;

import java.time.Instant;

/**
 * Opaque credential or cookie handle authorizing calls to a backend.
 *
 * <p>Owned by an {@link Authenticator}; synthesis clients only read it. A session is used
 * for the lifetime of a run or until the authenticator replaces it.
 */
public interface BackendSession extends AutoCloseable {

    /**
     * @return when this session was obtained
     */
    Instant acquiredAt();

    /**
     * Releases resources held by the session. Default is a no-op.
     */
    @Override
    default void close() {
    }
}
