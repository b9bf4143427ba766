package com.phillippitts.audiogen.service.pipeline;

import com.phillippitts.audiogen.domain.AudioArtifact;

import java.util.Objects;

/**
 * Result of processing one request: either an artifact, or the reason none was produced.
 *
 * @param requestId request id
 * @param artifact  produced artifact; null on failure
 * @param reason    short failure reason (metrics tag); null on success
 * @param message   failure diagnostic; null on success
 */
public record RequestOutcome(String requestId, AudioArtifact artifact, String reason, String message) {

    public RequestOutcome {
        Objects.requireNonNull(requestId, "requestId");
        if ((artifact == null) == (reason == null)) {
            throw new IllegalArgumentException("Exactly one of artifact or reason must be set");
        }
    }

    public static RequestOutcome success(String requestId, AudioArtifact artifact) {
        return new RequestOutcome(requestId, Objects.requireNonNull(artifact, "artifact"), null, null);
    }

    public static RequestOutcome failure(String requestId, String reason, String message) {
        return new RequestOutcome(requestId, null, Objects.requireNonNull(reason, "reason"), message);
    }

    public boolean succeeded() {
        return artifact != null;
    }
}
