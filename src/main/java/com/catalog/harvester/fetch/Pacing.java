package com.catalog.harvester.fetch;

import com.catalog.harvester.exception.HarvestException;

import java.time.Duration;

/**
 * Deliberate idle time between waves, rounds and batches.
 */
public final class Pacing {

    private Pacing() {
    }

    /**
     * Sleeps for the given duration; zero or negative durations return at once.
     *
     * @throws HarvestException when interrupted (the interrupt flag is restored)
     */
    public static void pause(final Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new HarvestException("Interrupted while pacing requests", ex);
        }
    }
}
