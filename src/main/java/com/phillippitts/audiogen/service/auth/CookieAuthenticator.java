package com.phillippitts.audiogen.service.auth;

import com.phillippitts.audiogen.exception.InvalidConfigException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;

/**
 * Authenticator for the raw HTTP backend. The cookie is static for the whole run, so there
 * is nothing to retry: {@link #refresh(CookieSession)} hands back the same session.
 */
public class CookieAuthenticator implements Authenticator<CookieSession> {

    private static final Logger LOG = LogManager.getLogger(CookieAuthenticator.class);
    static final String BACKEND = "http";

    private final CookieSession session;

    public CookieAuthenticator(String cookie) {
        if (cookie == null || cookie.isBlank()) {
            throw new InvalidConfigException("audiogen.http.session-cookie", "must not be blank");
        }
        this.session = new CookieSession(cookie, Instant.now());
    }

    @Override
    public CookieSession acquire() {
        return session;
    }

    @Override
    public CookieSession refresh(CookieSession stale) {
        LOG.warn("Static session cookie cannot be refreshed; reusing it");
        return session;
    }

    @Override
    public String getBackendName() {
        return BACKEND;
    }

    @Override
    public void close() {
    }
}
