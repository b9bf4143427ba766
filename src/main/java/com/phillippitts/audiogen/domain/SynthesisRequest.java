package com.phillippitts.audiogen.domain;

import java.util.Objects;

/**
 * One unit of work: render {@code text} with the {@code speaker} voice into one audio artifact.
 *
 * @param id      caller-supplied identifier, used in logs and diagnostics
 * @param speaker backend voice identifier (e.g., "Joanna")
 * @param text    source text of arbitrary length
 */
public record SynthesisRequest(String id, String speaker, String text) {

    public SynthesisRequest {
        Objects.requireNonNull(id, "Request id must not be null");
        Objects.requireNonNull(speaker, "Speaker must not be null");
        Objects.requireNonNull(text, "Request text must not be null");
        if (speaker.isBlank()) {
            throw new IllegalArgumentException("Speaker must not be blank (request " + id + ")");
        }
    }
}
