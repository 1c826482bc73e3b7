package com.questrail.telemetry.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for packet parse timestamps.
 *
 * <h2>Binding invariant</h2>
 * Packet timestamps (and therefore time-ordered x-coordinates) MUST come from a
 * monotonic source. Wall-clock time (e.g. {@code Instant.now()}) is used only
 * for observability events.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick value in nanoseconds.
     * Values are only meaningful relative to each other.
     */
    long nowNanos();
}
