package com.phillippitts.audiogen.domain;

import java.util.Objects;

/**
 * A segment of request text small enough for one backend call.
 *
 * @param index          0-based position in the request; dense and contiguous
 * @param text           chunk text, never longer than the configured limit
 * @param continuesWord  true when this chunk is the continuation of a word that was force-split
 *                       because it alone exceeded the limit; such a chunk is joined to the
 *                       previous one without a separating space
 */
public record TextChunk(int index, String text, boolean continuesWord) {

    public TextChunk {
        if (index < 0) {
            throw new IllegalArgumentException("Chunk index must not be negative, got: " + index);
        }
        Objects.requireNonNull(text, "Chunk text must not be null");
    }

    public static TextChunk of(int index, String text) {
        return new TextChunk(index, text, false);
    }
}
