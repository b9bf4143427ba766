package com.phillippitts.audiogen.service.auth;

import com.phillippitts.audiogen.config.properties.PollyProperties;
import com.phillippitts.audiogen.exception.InvalidConfigException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import software.amazon.awssdk.auth.credentials.ProfileCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.polly.PollyClient;

import java.time.Instant;

/**
 * Authenticator for Amazon Polly using a named shared-config profile (typically SSO).
 *
 * <p>Opening a session resolves the profile's credentials eagerly, so an expired SSO token
 * surfaces here as a failed attempt rather than later on the first synthesis call.
 */
public class PollyAuthenticator extends AbstractAuthenticator<PollySession> {

    private static final Logger LOG = LogManager.getLogger(PollyAuthenticator.class);
    static final String BACKEND = "polly";

    private final String region;

    public PollyAuthenticator(PollyProperties props, Reauthenticator reauthenticator) {
        super(reauthenticator, requireProfile(props), props.maxAuthAttempts());
        this.region = props.region();
    }

    private static String requireProfile(PollyProperties props) {
        if (props.profileName() == null || props.profileName().isBlank()) {
            throw new InvalidConfigException("audiogen.polly.profile-name",
                    "required when the polly backend is selected");
        }
        return props.profileName();
    }

    @Override
    protected PollySession openSession() {
        ProfileCredentialsProvider credentials = ProfileCredentialsProvider.builder()
                .profileName(getProfile())
                .build();
        try {
            credentials.resolveCredentials();
        } catch (RuntimeException e) {
            credentials.close();
            throw e;
        }
        PollyClient client = PollyClient.builder()
                .region(Region.of(region))
                .credentialsProvider(credentials)
                .build();
        LOG.debug("Polly client created: profile={}, region={}", getProfile(), region);
        return new PollySession(client, credentials, Instant.now());
    }

    @Override
    public String getBackendName() {
        return BACKEND;
    }
}
