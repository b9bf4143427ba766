package com.phillippitts.audiogen.service.auth;

/**
 * External re-authentication step (typically an interactive login flow).
 *
 * <p>Implementations must not throw: a failed login is logged, and the next session attempt
 * is what decides whether authentication worked.
 */
@FunctionalInterface
public interface Reauthenticator {

    /**
     * @param profile credential profile to log in with
     */
    void reauthenticate(String profile);
}
