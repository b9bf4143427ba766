package com.phillippitts.audiogen.util;

import org.apache.logging.log4j.ThreadContext;

import java.util.Map;

/**
 * Request- and chunk-scoped values kept in Log4j2's MDC (ThreadContext).
 *
 * <p>Keys:
 * <ul>
 *   <li>{@code requestId}: id of the request being processed</li>
 *   <li>{@code speaker}: voice the request is rendered with</li>
 *   <li>{@code chunkIndex}: index of the chunk currently being synthesized</li>
 * </ul>
 *
 * <p>Callers must clear what they put, in a {@code finally} block, so values never
 * leak into the next request handled by the same thread.
 */
public final class LogContext {

    public static final String REQUEST_ID = "requestId";
    public static final String SPEAKER = "speaker";
    public static final String CHUNK_INDEX = "chunkIndex";

    private LogContext() {
    }

    public static void putRequest(String requestId, String speaker) {
        ThreadContext.put(REQUEST_ID, requestId);
        if (speaker != null) {
            ThreadContext.put(SPEAKER, speaker);
        }
    }

    public static void clearRequest() {
        ThreadContext.remove(REQUEST_ID);
        ThreadContext.remove(SPEAKER);
        ThreadContext.remove(CHUNK_INDEX);
    }

    public static void putChunk(int index) {
        ThreadContext.put(CHUNK_INDEX, String.valueOf(index));
    }

    public static void clearChunk() {
        ThreadContext.remove(CHUNK_INDEX);
    }

    public static String requestId() {
        return ThreadContext.get(REQUEST_ID);
    }

    /**
     * @return chunk index from the context, or null when absent or not numeric
     */
    public static Integer chunkIndex() {
        String v = ThreadContext.get(CHUNK_INDEX);
        if (v == null) {
            return null;
        }
        try {
            return Integer.valueOf(v);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Wraps a task so it runs with the caller's context and restores the worker's afterwards.
     */
    public static Runnable propagating(Runnable task) {
        Map<String, String> contextMap = ThreadContext.getImmutableContext();
        return () -> {
            Map<String, String> previous = ThreadContext.getImmutableContext();
            try {
                ThreadContext.clearMap();
                if (contextMap != null && !contextMap.isEmpty()) {
                    ThreadContext.putAll(contextMap);
                }
                task.run();
            } finally {
                ThreadContext.clearMap();
                if (previous != null && !previous.isEmpty()) {
                    ThreadContext.putAll(previous);
                }
            }
        };
    }
}
