package com.phillippitts.voicegate.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Utility methods for elapsed-time measurement and quota-day boundaries.
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
     * Returns the quota day an instant falls into.
     */
    public static LocalDate dayOf(Instant instant, ZoneId zone) {
        return instant.atZone(zone).toLocalDate();
    }

    /**
     * Returns the start of the day after the one containing {@code instant}.
     *
     * <p>Used as the reset hint of daily-limit denials.
     */
    public static Instant nextMidnight(Instant instant, ZoneId zone) {
        return dayOf(instant, zone).plusDays(1).atStartOfDay(zone).toInstant();
    }

    /**
     * Converts seconds to whole units, rounding any partial unit up.
     *
     * @param seconds     consumed seconds (negative treated as 0)
     * @param unitSeconds seconds per unit, must be positive
     * @return ceil(seconds / unitSeconds)
     */
    public static long ceilUnits(long seconds, long unitSeconds) {
        if (unitSeconds <= 0) {
            throw new IllegalArgumentException("unitSeconds must be positive");
        }
        if (seconds <= 0) {
            return 0;
        }
        return (seconds + unitSeconds - 1) / unitSeconds;
    }
}
