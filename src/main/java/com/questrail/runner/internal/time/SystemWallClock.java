package com.questrail.runner.internal.time;

import java.time.Instant;

/**
 * SystemWallClock
 * =============================================================================
 * {@link WallClock} backed by {@link Instant#now()}.
 *
 * <p>Thread-safe. Tests that need fixed timestamps pass their own
 * {@link WallClock} to the event bus instead.</p>
 */
public enum SystemWallClock implements WallClock {
    /**
     * Singleton instance.
     */
    INSTANCE;

    @Override
    public Instant now() {
        return Instant.now();
    }
}
