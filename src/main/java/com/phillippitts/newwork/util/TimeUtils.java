package com.phillippitts.newwork.util;

import java.time.Duration;

/**
 * Elapsed-time helpers over {@link System#nanoTime()}.
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
     * Elapsed time since a nanosecond timestamp, as a {@link Duration}.
     *
     * <pre>
     * long start = System.nanoTime();
     * boolean healthy = probe.isHealthy(timeout);
     * Duration latency = TimeUtils.elapsed(start);
     * </pre>
     */
    public static Duration elapsed(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
