package com.questrail.runner.internal.time;

import java.time.Instant;

/**
 * WallClock
 * =============================================================================
 * Source of event timestamps.
 *
 * <p>
 * Timestamps are for observers only. Scheduling decisions never consult this
 * clock, so it may jump (NTP, manual adjustment) without affecting a run.
 * </p>
 */
@FunctionalInterface
public interface WallClock
{
    /**
     * Returns the current wall-clock time.
     */
    Instant now();
}
