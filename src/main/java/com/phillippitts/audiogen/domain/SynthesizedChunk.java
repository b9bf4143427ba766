package com.phillippitts.audiogen.domain;

import java.util.Objects;

/**
 * Raw audio bytes produced for one {@link TextChunk}. The bytes are opaque to the pipeline.
 */
public record SynthesizedChunk(int index, byte[] audio) {

    public SynthesizedChunk {
        if (index < 0) {
            throw new IllegalArgumentException("Chunk index must not be negative, got: " + index);
        }
        Objects.requireNonNull(audio, "Chunk audio must not be null");
    }
}
