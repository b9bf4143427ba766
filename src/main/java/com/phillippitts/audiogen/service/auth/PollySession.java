package com.phillippitts.audiogen.service.auth;

import software.amazon.awssdk.services.polly.PollyClient;
import software.amazon.awssdk.utils.SdkAutoCloseable;

import java.time.Instant;
import java.util.Objects;

/**
 * Session for the cloud backend: a Polly client bound to resolved profile credentials.
 *
 * @param client      service client
 * @param credentials credentials provider to release with the client (may be null)
 * @param acquiredAt  when the credentials were resolved
 */
public record PollySession(PollyClient client, SdkAutoCloseable credentials, Instant acquiredAt)
        implements BackendSession {

    public PollySession {
        Objects.requireNonNull(client, "client");
        Objects.requireNonNull(acquiredAt, "acquiredAt");
    }

    @Override
    public void close() {
        client.close();
        if (credentials != null) {
            credentials.close();
        }
    }
}
