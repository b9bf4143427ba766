package com.phillippitts.audiogen.config;

import com.phillippitts.audiogen.config.properties.HttpBackendProperties;
import com.phillippitts.audiogen.config.properties.PollyProperties;
import com.phillippitts.audiogen.service.auth.CookieAuthenticator;
import com.phillippitts.audiogen.service.auth.PollyAuthenticator;
import com.phillippitts.audiogen.service.auth.Reauthenticator;
import com.phillippitts.audiogen.service.auth.sso.SsoLoginReauthenticator;
import com.phillippitts.audiogen.service.metrics.SynthesisMetrics;
import com.phillippitts.audiogen.service.synthesis.HttpSynthesisClient;
import com.phillippitts.audiogen.service.synthesis.PollySynthesisClient;
import com.phillippitts.audiogen.service.synthesis.SynthesisClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * Wires exactly one backend, chosen by {@code audiogen.pipeline.backend}.
 *
 * <p>Each variant contributes an {@link com.phillippitts.audiogen.service.auth.Authenticator}
 * and a {@link SynthesisClient}; nothing downstream branches on the backend kind.
 */
@Configuration
public class BackendConfig {

    private static final Logger LOG = LogManager.getLogger(BackendConfig.class);

    @Configuration
    @ConditionalOnProperty(prefix = "audiogen.pipeline", name = "backend", havingValue = "polly",
            matchIfMissing = true)
    static class PollyBackend {

        @Bean
        Reauthenticator ssoLoginReauthenticator(PollyProperties props) {
            return new SsoLoginReauthenticator(props.loginCommand(), Duration.ofSeconds(props.loginTimeoutSeconds()));
        }

        @Bean
        PollyAuthenticator pollyAuthenticator(PollyProperties props, Reauthenticator reauthenticator,
                                              SynthesisMetrics metrics) {
            PollyAuthenticator authenticator = new PollyAuthenticator(props, reauthenticator);
            authenticator.setMetrics(metrics);
            LOG.info("Backend: polly (profile={}, region={}, maxAuthAttempts={})",
                    props.profileName(), props.region(), props.maxAuthAttempts());
            return authenticator;
        }

        @Bean
        SynthesisClient pollySynthesisClient(PollyAuthenticator authenticator) {
            return new PollySynthesisClient(authenticator);
        }
    }

    @Configuration
    @ConditionalOnProperty(prefix = "audiogen.pipeline", name = "backend", havingValue = "http")
    static class HttpBackend {

        @Bean
        CookieAuthenticator cookieAuthenticator(HttpBackendProperties props) {
            LOG.info("Backend: http (url={})", props.baseUrl());
            return new CookieAuthenticator(props.sessionCookie());
        }

        @Bean
        RestTemplate synthesisRestTemplate(RestTemplateBuilder builder, HttpBackendProperties props) {
            return builder
                    .setConnectTimeout(Duration.ofMillis(props.connectTimeoutMs()))
                    .setReadTimeout(Duration.ofMillis(props.readTimeoutMs()))
                    .build();
        }

        @Bean
        SynthesisClient httpSynthesisClient(RestTemplate synthesisRestTemplate,
                                            CookieAuthenticator authenticator,
                                            HttpBackendProperties props) {
            return new HttpSynthesisClient(synthesisRestTemplate, authenticator, props);
        }
    }
}
