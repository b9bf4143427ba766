package com.phillippitts.audiogen.service.synthesis.event;

import com.phillippitts.audiogen.exception.SynthesisException;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Utility class for publishing backend failure events.
 *
 * <p>If the publisher is null, nothing is published. This allows the synthesis service to
 * run without an application context in tests.
 *
 * @since 1.0
 */
public final class BackendEventPublisher {

    private BackendEventPublisher() {
        // Utility class - prevent instantiation
    }

    public static void publishFailure(ApplicationEventPublisher publisher, SynthesisException failure) {
        if (publisher == null) {
            return;
        }
        Map<String, String> context = new HashMap<>();
        if (failure.getRequestId() != null) {
            context.put("requestId", failure.getRequestId());
        }
        if (failure.getChunkIndex() != null) {
            context.put("chunkIndex", String.valueOf(failure.getChunkIndex()));
        }
        publisher.publishEvent(new BackendFailureEvent(
                failure.getBackend(),
                Instant.now(),
                failure.getReason(),
                failure.getMessage(),
                context
        ));
    }
}
