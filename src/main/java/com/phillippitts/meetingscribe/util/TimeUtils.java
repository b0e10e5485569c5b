package com.phillippitts.meetingscribe.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Utility methods for time conversions between sample counts, durations and instants.
 */
public final class TimeUtils {

    /**
     * Number of nanoseconds in one second.
     */
    public static final long NANOS_PER_SECOND = 1_000_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Converts a sample count to seconds at the given rate.
     *
     * @param samples number of samples
     * @param sampleRate sample rate in Hz
     * @return duration in seconds
     */
    public static double samplesToSeconds(long samples, int sampleRate) {
        return (double) samples / sampleRate;
    }

    /**
     * Converts a duration in milliseconds to a sample count (truncated).
     *
     * @param durationMs duration in milliseconds
     * @param sampleRate sample rate in Hz
     * @return number of samples
     */
    public static int millisToSamples(long durationMs, int sampleRate) {
        return (int) (durationMs * sampleRate / 1000L);
    }

    /**
     * Returns the instant of a sample that lies {@code samples} after {@code origin}.
     *
     * @param origin instant of sample zero
     * @param samples offset in samples
     * @param sampleRate sample rate in Hz
     * @return shifted instant
     */
    public static Instant plusSamples(Instant origin, long samples, int sampleRate) {
        return origin.plusNanos(samples * NANOS_PER_SECOND / sampleRate);
    }

    /**
     * Returns whether at least {@code threshold} has passed between {@code since} and {@code now}.
     * A null {@code since} never counts as elapsed.
     */
    public static boolean hasElapsed(Instant since, Instant now, Duration threshold) {
        return since != null && Duration.between(since, now).compareTo(threshold) >= 0;
    }
}
