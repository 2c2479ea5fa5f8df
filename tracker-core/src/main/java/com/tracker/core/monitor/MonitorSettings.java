package com.tracker.core.monitor;

import java.time.Duration;

/**
 * Loop timing and baseline behavior.
 *
 * @param interval                  pause between the end of one cycle and the start of the next
 * @param errorBackoffMultiplier    pause after an unexpected cycle error, in intervals (at least 3)
 * @param announceExistingPositions whether positions found on the first poll are announced
 */
public record MonitorSettings(Duration interval, int errorBackoffMultiplier, boolean announceExistingPositions) {

    public static final int MIN_BACKOFF_MULTIPLIER = 3;

    public MonitorSettings {
        if (interval == null || interval.isNegative() || interval.isZero()) {
            throw new IllegalArgumentException("Interval must be positive, got " + interval);
        }
        errorBackoffMultiplier = Math.max(MIN_BACKOFF_MULTIPLIER, errorBackoffMultiplier);
    }

    public static MonitorSettings defaults() {
        return new MonitorSettings(Duration.ofSeconds(10), MIN_BACKOFF_MULTIPLIER, true);
    }

    public Duration errorBackoff() {
        return interval.multipliedBy(errorBackoffMultiplier);
    }
}
