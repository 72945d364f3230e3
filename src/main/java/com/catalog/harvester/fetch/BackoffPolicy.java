package com.catalog.harvester.fetch;

import com.catalog.harvester.config.HarvestProperties;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter, shared by the fetch engine and the render bridge.
 *
 * <p>The wait before retry {@code n} is {@code base^n + jitter} units, where the jitter is
 * a whole number of units drawn uniformly from {@code [jitterMin, jitterMax]}. After a
 * {@code 429} or {@code 503} a fixed rate-limit floor is added on top.</p>
 */
public final class BackoffPolicy {

    private final double base;

    private final Duration unit;

    private final int jitterMin;

    private final int jitterMax;

    private final Duration rateLimitFloor;

    public BackoffPolicy(final double base, final Duration unit,
                         final int jitterMin, final int jitterMax,
                         final Duration rateLimitFloor) {
        if (jitterMax < jitterMin) {
            throw new IllegalArgumentException("jitterMax < jitterMin");
        }
        this.base = base;
        this.unit = unit;
        this.jitterMin = jitterMin;
        this.jitterMax = jitterMax;
        this.rateLimitFloor = rateLimitFloor;
    }

    public static BackoffPolicy from(final HarvestProperties.Fetch cfg) {
        return new BackoffPolicy(cfg.getBackoffBase(), cfg.getBackoffUnit(),
                cfg.getJitterMin(), cfg.getJitterMax(), cfg.getRateLimitFloor());
    }

    /**
     * @param attempt    number of attempts made so far (1 after the first failure)
     * @param lastStatus HTTP status of the failed attempt, {@code 0} when none
     * @return how long to wait before the next attempt
     */
    public Duration delayFor(final int attempt, final int lastStatus) {
        double units = Math.pow(base, attempt) + jitter();
        long millis = Math.round(units * unit.toMillis());
        if (lastStatus == 429 || lastStatus == 503) {
            millis += rateLimitFloor.toMillis();
        }
        return Duration.ofMillis(millis);
    }

    /** Anti-bot challenges wait twice as long as transport failures. */
    public Duration challengeDelayFor(final int attempt) {
        return delayFor(attempt, 0).multipliedBy(2);
    }

    private int jitter() {
        return ThreadLocalRandom.current().nextInt(jitterMin, jitterMax + 1);
    }
}
