package com.tracker.core.notify.format;

import java.time.Duration;

/**
 * Compact trade duration text: {@code 45s}, {@code 12m 5s}, {@code 3h 20m}.
 */
public final class DurationFormat {

    private DurationFormat() {
    }

    public static String format(Duration duration) {
        long seconds = duration == null ? 0 : Math.max(0, duration.getSeconds());
        if (seconds < 60) {
            return seconds + "s";
        }
        if (seconds < 3600) {
            return (seconds / 60) + "m " + (seconds % 60) + "s";
        }
        return (seconds / 3600) + "h " + ((seconds % 3600) / 60) + "m";
    }
}
