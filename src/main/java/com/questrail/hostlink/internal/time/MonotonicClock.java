package com.questrail.hostlink.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for receive deadlines.
 *
 * <p>Deadlines are computed once per receive and compared against this clock,
 * so a wall-clock step (NTP correction, manual change) can neither cut a
 * long-running host command short nor stretch a stalled one. Wall-clock time
 * ({@code Instant.now()}) is used only to stamp observability events.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically non-decreasing tick in nanoseconds. Only
     * differences between two readings are meaningful.
     */
    long nowNanos();
}
