package com.phillippitts.audiogen.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the synthesis thread pool. Pool size follows
 * {@code audiogen.pipeline.parallelism}; only queueing and naming are tuned here.
 */
@Validated
@ConfigurationProperties(prefix = "audiogen.executor")
public record ThreadPoolProperties(
        @NotNull
        @Min(0)
        Integer queueCapacity,

        @NotNull
        @Min(0)
        Integer keepAliveSeconds,

        @NotBlank
        String threadNamePrefix
) {

    public ThreadPoolProperties {
        queueCapacity = queueCapacity == null ? 100 : queueCapacity;
        keepAliveSeconds = keepAliveSeconds == null ? 60 : keepAliveSeconds;
        threadNamePrefix = threadNamePrefix == null ? "synth-pool-" : threadNamePrefix;
    }
}
