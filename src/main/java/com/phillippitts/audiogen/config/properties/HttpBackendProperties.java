package com.phillippitts.audiogen.config.properties;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the raw HTTP speech endpoint. Binds to "audiogen.http".
 *
 * @param baseUrl          synthesis endpoint URL
 * @param clientId         client identifier, sent as the User-Agent header
 * @param mapType          backend-specific mapping type identifier
 * @param accountId        backend account identifier
 * @param sessionCookie    static session cookie sent with every call
 * @param connectTimeoutMs connect timeout
 * @param readTimeoutMs    read timeout
 */
@Validated
@ConfigurationProperties(prefix = "audiogen.http")
public record HttpBackendProperties(
        String baseUrl,
        String clientId,
        String mapType,
        String accountId,
        String sessionCookie,

        @NotNull
        @Positive(message = "Connect timeout must be positive")
        Integer connectTimeoutMs,

        @NotNull
        @Positive(message = "Read timeout must be positive")
        Integer readTimeoutMs
) {

    public HttpBackendProperties {
        clientId = clientId == null ? "audiogen/1.0" : clientId;
        sessionCookie = sessionCookie == null ? "session=placeholder" : sessionCookie;
        connectTimeoutMs = connectTimeoutMs == null ? 5_000 : connectTimeoutMs;
        readTimeoutMs = readTimeoutMs == null ? 60_000 : readTimeoutMs;
    }
}
