package com.phillippitts.audiogen.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Settings for the managed cloud speech backend (Amazon Polly). Binds to "audiogen.polly".
 *
 * <p>{@code profileName} is only required when this backend is selected, so it is
 * checked when the backend beans are created rather than here.
 *
 * @param profileName         shared-config profile holding the SSO credentials
 * @param region              service region
 * @param maxAuthAttempts     session attempts before giving up
 * @param loginCommand        executable used for interactive re-authentication
 * @param loginTimeoutSeconds how long the interactive login may take
 */
@Validated
@ConfigurationProperties(prefix = "audiogen.polly")
public record PollyProperties(
        String profileName,

        @NotBlank(message = "Region must not be blank")
        String region,

        @NotNull
        @Positive(message = "Max auth attempts must be positive")
        Integer maxAuthAttempts,

        @NotBlank(message = "Login command must not be blank")
        String loginCommand,

        @NotNull
        @Positive(message = "Login timeout must be positive")
        Integer loginTimeoutSeconds
) {

    public PollyProperties {
        region = region == null ? "us-east-1" : region;
        maxAuthAttempts = maxAuthAttempts == null ? 2 : maxAuthAttempts;
        loginCommand = loginCommand == null ? "aws" : loginCommand;
        loginTimeoutSeconds = loginTimeoutSeconds == null ? 300 : loginTimeoutSeconds;
    }
}
