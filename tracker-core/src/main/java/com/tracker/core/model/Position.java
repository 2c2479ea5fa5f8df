package com.tracker.core.model;

/**
 * Immutable record representing one open derivative position as reported by the venue.
 * Venue-specific payloads are normalized into this shape before they reach the differ.
 *
 * <p>Equality is structural: any field change between two polls counts as a change.
 */
public record Position(
    String symbol,
    PositionSide side,
    double entryPrice,
    double markPrice,   // 0 when the venue does not report one
    double size,        // signed or unsigned, zero means no position
    double leverage
) {
    public Position {
        if (symbol == null || symbol.isBlank()) {
            throw new IllegalArgumentException("Symbol is required");
        }
        if (side == null) {
            throw new IllegalArgumentException("Side is required for " + symbol);
        }
        if (entryPrice < 0 || markPrice < 0) {
            throw new IllegalArgumentException("Prices must not be negative for " + symbol);
        }
        if (leverage < 1) {
            throw new IllegalArgumentException("Leverage must be at least 1 for " + symbol);
        }
    }

    /**
     * Magnitude of the position, ignoring the sign convention of the venue.
     */
    public double absoluteSize() {
        return Math.abs(size);
    }

    public boolean isOpen() {
        return size != 0;
    }

    public boolean hasMarkPrice() {
        return markPrice > 0;
    }
}
