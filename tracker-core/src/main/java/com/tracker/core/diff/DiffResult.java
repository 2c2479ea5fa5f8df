package com.tracker.core.diff;

import com.tracker.core.event.PositionEvent;
import com.tracker.core.model.Snapshot;

import java.util.List;

/**
 * Events detected in one cycle plus the snapshot the caller must keep for the next one.
 */
public record DiffResult(List<PositionEvent> events, Snapshot next) {

    public DiffResult {
        events = List.copyOf(events);
    }

    public long count(PositionEvent.Kind kind) {
        return events.stream().filter(e -> e.kind() == kind).count();
    }
}
