package com.phillippitts.audiogen.util;

/**
 * Utility methods for time conversions and elapsed time calculations.
 *
 * <p>Typical usage:
 * <pre>
 * long startTime = System.nanoTime();
 * // ... do work ...
 * long elapsedMs = TimeUtils.elapsedMillis(startTime);
 * </pre>
 *
 * @since 1.0
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one millisecond.
     */
    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts nanoseconds to milliseconds (truncated).
     */
    public static long nanosToMillis(long nanos) {
        return nanos / NANOS_PER_MILLI;
    }

    /**
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }
}
