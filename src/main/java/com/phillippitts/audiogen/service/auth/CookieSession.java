package com.phillippitts.audiogen.service.auth;

import java.time.Instant;
import java.util.Objects;

/**
 * Session for the raw HTTP backend: a cookie header value sent with every call.
 */
public record CookieSession(String cookie, Instant acquiredAt) implements BackendSession {

    public CookieSession {
        Objects.requireNonNull(cookie, "cookie");
        Objects.requireNonNull(acquiredAt, "acquiredAt");
    }

    @Override
    public String toString() {
        // Cookie values are credentials; keep them out of logs
        return "CookieSession[acquiredAt=" + acquiredAt + "]";
    }
}
