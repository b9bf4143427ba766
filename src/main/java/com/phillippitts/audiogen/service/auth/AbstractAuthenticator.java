package com.phillippitts.audiogen.service.auth;

import com.phillippitts.audiogen.exception.AuthExhaustedException;
import com.phillippitts.audiogen.exception.InvalidConfigException;
import com.phillippitts.audiogen.service.metrics.SynthesisMetrics;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base class for authenticators with a bounded re-authentication loop.
 *
 * <p>{@link #acquire()} makes at most {@code maxAttempts} calls to {@link #openSession()}.
 * Between two failed attempts the {@link Reauthenticator} is invoked; after the last failed
 * attempt an {@link AuthExhaustedException} is thrown and no session is returned.
 *
 * <p><b>Thread Safety:</b> session creation and replacement are synchronized on an internal
 * lock, so a burst of expiry signals from parallel chunk calls triggers one refresh.
 * A replaced session is retired, not closed: other workers may still be calling through it.
 * Retired sessions are closed together with the current one in {@link #close()}.
 *
 * @param <S> session type
 */
public abstract class AbstractAuthenticator<S extends BackendSession> implements Authenticator<S> {

    private static final Logger LOG = LogManager.getLogger(AbstractAuthenticator.class);

    private final Object lock = new Object();
    private final Reauthenticator reauthenticator;
    private final String profile;
    private final int maxAttempts;
    private volatile SynthesisMetrics metrics;

    // Guarded by lock
    private S current;
    private final List<S> retired = new ArrayList<>();

    protected AbstractAuthenticator(Reauthenticator reauthenticator, String profile, int maxAttempts) {
        this.reauthenticator = Objects.requireNonNull(reauthenticator, "reauthenticator");
        this.profile = profile;
        if (maxAttempts <= 0) {
            throw new InvalidConfigException("max-auth-attempts", "must be positive, got " + maxAttempts);
        }
        this.maxAttempts = maxAttempts;
    }

    /**
     * Builds a session and proves it is usable (e.g., by resolving credentials).
     *
     * @return a validated session
     * @throws RuntimeException any failure; counts as one failed attempt
     */
    protected abstract S openSession();

    @Override
    public final S acquire() {
        synchronized (lock) {
            if (current == null) {
                current = establish();
            }
            return current;
        }
    }

    @Override
    public final S refresh(S stale) {
        synchronized (lock) {
            if (current != null && current != stale) {
                LOG.debug("{} session already refreshed by another caller", getBackendName());
                return current;
            }
            if (current != null) {
                retired.add(current);
                current = null;
            }
            LOG.info("{} session expired; re-authenticating profile '{}'", getBackendName(), profile);
            reauthenticator.reauthenticate(profile);
            current = establish();
            return current;
        }
    }

    private S establish() {
        RuntimeException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                S session = openSession();
                recordAttempt("success");
                LOG.info("{} session established (attempt {} of {})", getBackendName(), attempt, maxAttempts);
                return session;
            } catch (InvalidConfigException e) {
                throw e;
            } catch (RuntimeException e) {
                last = e;
                recordAttempt("failure");
                LOG.warn("{} session unavailable (attempt {} of {}): {}",
                        getBackendName(), attempt, maxAttempts, e.getMessage());
                if (attempt < maxAttempts) {
                    reauthenticator.reauthenticate(profile);
                }
            }
        }
        LOG.error("Max authentication attempts reached for {}; unable to authenticate", getBackendName());
        throw new AuthExhaustedException(getBackendName(), maxAttempts, last);
    }

    private void recordAttempt(String outcome) {
        SynthesisMetrics m = metrics;
        if (m != null) {
            m.recordAuthAttempt(getBackendName(), outcome);
        }
    }

    private void closeQuietly(S session) {
        try {
            session.close();
        } catch (RuntimeException e) {
            LOG.debug("Closing {} session failed: {}", getBackendName(), e.toString());
        }
    }

    /**
     * Optional; attempts are not counted when unset.
     */
    public void setMetrics(SynthesisMetrics metrics) {
        this.metrics = metrics;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    protected String getProfile() {
        return profile;
    }

    @Override
    @PreDestroy
    public void close() {
        synchronized (lock) {
            if (current != null) {
                retired.add(current);
                current = null;
            }
            retired.forEach(this::closeQuietly);
            retired.clear();
        }
    }
}
