package com.phillippitts.audiogen.service.synthesis.event;

import java.time.Instant;
import java.util.Map;

/**
 * Published when a chunk synthesis call fails (transport, decode or backend status).
 *
 * <p>PII note: Do not include source text in context. Restrict to technical diagnostics.
 */
public record BackendFailureEvent(
        String backend,
        Instant at,
        String reason,
        String message,
        Map<String, String> context
) {
    public BackendFailureEvent {
        if (at == null) {
            at = Instant.now();
        }
        context = context == null ? Map.of() : Map.copyOf(context);
    }
}
