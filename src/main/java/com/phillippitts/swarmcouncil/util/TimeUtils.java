package com.phillippitts.swarmcouncil.util;

import java.time.Duration;

/**
 * Utility methods for elapsed time calculations around provider calls.
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
     * Calculates elapsed milliseconds since a nanosecond timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Returns true when the duration is null, zero or negative, meaning "no bound".
     */
    public static boolean isUnbounded(Duration duration) {
        return duration == null || duration.isZero() || duration.isNegative();
    }
}
