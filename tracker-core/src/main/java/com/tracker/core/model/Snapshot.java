package com.tracker.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The full set of open positions at one poll instant, keyed by symbol.
 * Never contains a zero-size position.
 */
public final class Snapshot {
    private static final Logger logger = LoggerFactory.getLogger(Snapshot.class);
    private static final Snapshot EMPTY = new Snapshot(Map.of());

    private final Map<String, Position> positions;

    private Snapshot(Map<String, Position> positions) {
        this.positions = positions;
    }

    public static Snapshot empty() {
        return EMPTY;
    }

    /**
     * Build a snapshot from a raw position list, dropping zero-size entries.
     * A symbol listed twice keeps the later entry.
     */
    public static Snapshot of(List<Position> rawPositions) {
        if (rawPositions == null || rawPositions.isEmpty()) {
            return EMPTY;
        }

        var bySymbol = new LinkedHashMap<String, Position>();
        for (Position position : rawPositions) {
            if (position == null || !position.isOpen()) {
                continue;
            }
            Position replaced = bySymbol.put(position.symbol(), position);
            if (replaced != null) {
                logger.warn("Duplicate position for {} in one poll - keeping the later entry", position.symbol());
            }
        }
        return bySymbol.isEmpty() ? EMPTY : new Snapshot(Collections.unmodifiableMap(bySymbol));
    }

    public Optional<Position> get(String symbol) {
        return Optional.ofNullable(positions.get(symbol));
    }

    public boolean contains(String symbol) {
        return positions.containsKey(symbol);
    }

    public Set<String> symbols() {
        return positions.keySet();
    }

    public Collection<Position> positions() {
        return positions.values();
    }

    public int size() {
        return positions.size();
    }

    public boolean isEmpty() {
        return positions.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Snapshot other)) return false;
        return positions.equals(other.positions);
    }

    @Override
    public int hashCode() {
        return positions.hashCode();
    }

    @Override
    public String toString() {
        return "Snapshot" + positions.keySet();
    }
}
