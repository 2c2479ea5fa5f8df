package com.tracker.core.diff;

import com.tracker.core.pnl.ExtremesTracker;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Per-symbol bookkeeping that outlives a single poll: PnL extremes, observed start times
 * and the last live price.
 *
 * <p>One ledger per bot lifetime, owned by the monitor and handed to the differ each cycle.
 * Nothing here is persisted, so a restart begins with an empty ledger.
 */
public final class TrackingLedger {

    private final ExtremesTracker extremes = new ExtremesTracker();
    private final Map<String, Instant> startTimes = new HashMap<>();
    private final Map<String, Double> lastPrices = new HashMap<>();
    private boolean baselineEstablished;

    public ExtremesTracker extremes() {
        return extremes;
    }

    public void recordStart(String symbol, Instant startedAt) {
        startTimes.put(symbol, startedAt);
    }

    public Optional<Instant> startTime(String symbol) {
        return Optional.ofNullable(startTimes.get(symbol));
    }

    public void recordPrice(String symbol, double price) {
        lastPrices.put(symbol, price);
    }

    public Optional<Double> lastPrice(String symbol) {
        return Optional.ofNullable(lastPrices.get(symbol));
    }

    /**
     * Drop everything known about a closed symbol. Idempotent.
     */
    public void forget(String symbol) {
        extremes.remove(symbol);
        startTimes.remove(symbol);
        lastPrices.remove(symbol);
    }

    public boolean isBaselineEstablished() {
        return baselineEstablished;
    }

    void markBaselineEstablished() {
        this.baselineEstablished = true;
    }
}
