package com.tracker.core.monitor;

import com.tracker.core.notify.Recipient;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

/**
 * Immutable view of the monitor, republished after every cycle so it can be read from any
 * thread without touching loop state.
 *
 * @param lastCycleAt null until the first cycle completes
 */
public record StatusSnapshot(
    MonitorState state,
    Set<String> activeSymbols,
    Duration interval,
    List<Recipient> recipients,
    long cyclesCompleted,
    Instant lastCycleAt,
    boolean baselineEstablished
) {
    public StatusSnapshot {
        activeSymbols = Set.copyOf(activeSymbols);
        recipients = List.copyOf(recipients);
    }
}
