package com.phillippitts.audiogen.service.text;

import com.phillippitts.audiogen.domain.TextChunk;
import com.phillippitts.audiogen.exception.InvalidConfigException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Splits request text into chunks no longer than a backend's character limit.
 *
 * <p>Words are separated by runs of whitespace and packed greedily, left to right, joined by a
 * single space. A word longer than the limit is never dropped or truncated: it is force-split
 * into limit-sized pieces, each emitted as its own chunk, with every piece after the first
 * marked {@link TextChunk#continuesWord()}. Pieces end on code point boundaries.
 *
 * <p>Invariant: {@link #join(List)} over the result equals the input's words separated by
 * single spaces (whitespace normalized, nothing lost, nothing duplicated).
 */
@Component
public class TextChunker {

    /**
     * @param text      source text (must not be null); blank text yields no chunks
     * @param maxLength maximum characters per chunk
     * @return chunks in source order, indexed 0..n-1
     * @throws InvalidConfigException if maxLength is not positive
     */
    public List<TextChunk> chunk(String text, int maxLength) {
        Objects.requireNonNull(text, "text");
        if (maxLength <= 0) {
            throw new InvalidConfigException("max-chunk-length", "must be positive, got " + maxLength);
        }

        List<TextChunk> chunks = new ArrayList<>();
        StringBuilder current = new StringBuilder();

        for (String word : text.trim().split("\\s+")) {
            if (word.isEmpty()) {
                continue; // blank input splits into a single empty token
            }
            if (word.length() > maxLength) {
                flush(chunks, current);
                int start = 0;
                while (start < word.length()) {
                    int end = pieceEnd(word, start, maxLength);
                    chunks.add(new TextChunk(chunks.size(), word.substring(start, end), start > 0));
                    start = end;
                }
                continue;
            }
            int needed = current.length() == 0 ? word.length() : current.length() + 1 + word.length();
            if (needed > maxLength) {
                flush(chunks, current);
            }
            if (current.length() > 0) {
                current.append(' ');
            }
            current.append(word);
        }
        flush(chunks, current);
        return List.copyOf(chunks);
    }

    /**
     * Reverses {@link #chunk(String, int)}: joins chunks with a single space, except that
     * continuation pieces of a force-split word are appended directly.
     */
    public static String join(List<TextChunk> chunks) {
        StringBuilder sb = new StringBuilder();
        for (TextChunk chunk : chunks) {
            if (sb.length() > 0 && !chunk.continuesWord()) {
                sb.append(' ');
            }
            sb.append(chunk.text());
        }
        return sb.toString();
    }

    /**
     * End of the next force-split piece. Never cuts between the halves of a surrogate pair: the
     * cut moves back one char, or forward when the piece would otherwise be empty (limit 1).
     */
    private static int pieceEnd(String word, int start, int maxLength) {
        int end = Math.min(word.length(), start + maxLength);
        if (end < word.length() && Character.isHighSurrogate(word.charAt(end - 1))
                && Character.isLowSurrogate(word.charAt(end))) {
            end = end - 1 > start ? end - 1 : end + 1;
        }
        return end;
    }

    private static void flush(List<TextChunk> chunks, StringBuilder current) {
        if (current.length() > 0) {
            chunks.add(TextChunk.of(chunks.size(), current.toString()));
            current.setLength(0);
        }
    }
}
