package com.tracker.core.model;

/**
 * Reference price used for a PnL reading, together with where it came from.
 */
public record PriceQuote(double price, Origin origin) {

    public enum Origin {
        /** Freshly fetched from the venue's ticker. */
        LIVE,
        /** Ticker unavailable, fell back to the position's last mark price. */
        MARK,
        /** Ticker failed at close; last live price seen while the position was open. */
        LAST_KNOWN,
        /** No usable price; PnL reads as 0. */
        UNAVAILABLE
    }

    private static final PriceQuote UNAVAILABLE_QUOTE = new PriceQuote(0.0, Origin.UNAVAILABLE);

    public PriceQuote {
        if (origin == null) {
            throw new IllegalArgumentException("Origin is required");
        }
        if (origin != Origin.UNAVAILABLE && !(price > 0)) {
            throw new IllegalArgumentException("Available quote must carry a positive price, got " + price);
        }
    }

    public static PriceQuote live(double price) {
        return new PriceQuote(price, Origin.LIVE);
    }

    public static PriceQuote mark(double price) {
        return new PriceQuote(price, Origin.MARK);
    }

    public static PriceQuote lastKnown(double price) {
        return new PriceQuote(price, Origin.LAST_KNOWN);
    }

    public static PriceQuote unavailable() {
        return UNAVAILABLE_QUOTE;
    }

    public boolean isAvailable() {
        return origin != Origin.UNAVAILABLE;
    }
}
