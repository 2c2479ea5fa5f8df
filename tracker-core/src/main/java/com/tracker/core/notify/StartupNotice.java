package com.tracker.core.notify;

import java.time.Instant;
import java.util.Set;

/**
 * Content of the "bot online" announcement sent once per bot lifetime.
 */
public record StartupNotice(String exchangeName, Set<Platform> platforms, Instant startedAt) {

    public StartupNotice {
        platforms = Set.copyOf(platforms);
    }
}
