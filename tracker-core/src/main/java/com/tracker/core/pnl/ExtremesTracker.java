package com.tracker.core.pnl;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Per-symbol running max-profit / max-drawdown accumulator.
 *
 * <p>Not thread-safe. Owned by the monitor thread and mutated only while a snapshot is diffed.
 */
public final class ExtremesTracker {

    private final Map<String, PositionExtremes> extremes = new HashMap<>();

    /**
     * Record a PnL reading. The first reading for a symbol initializes both extremes to it.
     */
    public PositionExtremes update(String symbol, double pnlPercent) {
        return extremes.merge(symbol, PositionExtremes.initial(pnlPercent),
            (existing, fresh) -> existing.observe(pnlPercent));
    }

    public Optional<PositionExtremes> get(String symbol) {
        return Optional.ofNullable(extremes.get(symbol));
    }

    /**
     * Forget a symbol. Safe to call for a symbol that is not tracked.
     */
    public void remove(String symbol) {
        extremes.remove(symbol);
    }

    public Set<String> trackedSymbols() {
        return Collections.unmodifiableSet(extremes.keySet());
    }

    public int size() {
        return extremes.size();
    }
}
