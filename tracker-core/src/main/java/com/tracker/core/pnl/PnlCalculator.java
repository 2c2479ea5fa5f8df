package com.tracker.core.pnl;

import com.tracker.core.model.Position;
import com.tracker.core.model.PositionSide;
import com.tracker.core.model.PriceQuote;

/**
 * Leveraged percentage return of a position against a reference price.
 *
 * <p>An unusable input (zero entry price, missing or zero reference price) reads as 0.
 * Callers that must tell "unknown" apart from "exactly flat" check {@link #isMeasurable} first.
 */
public final class PnlCalculator {

    private PnlCalculator() {
    }

    /**
     * LONG: (ref - entry) / entry * 100 * leverage.
     * SHORT: (entry - ref) / entry * 100 * leverage.
     */
    public static double pnlPercent(Position position, double referencePrice) {
        if (!isMeasurable(position, referencePrice)) {
            return 0.0;
        }

        double entry = position.entryPrice();
        double priceChangePct = position.side() == PositionSide.LONG
            ? (referencePrice - entry) / entry * 100.0
            : (entry - referencePrice) / entry * 100.0;

        return priceChangePct * position.leverage();
    }

    public static double pnlPercent(Position position, PriceQuote quote) {
        return quote.isAvailable() ? pnlPercent(position, quote.price()) : 0.0;
    }

    public static boolean isMeasurable(Position position, double referencePrice) {
        return position != null
            && position.entryPrice() > 0
            && referencePrice > 0
            && Double.isFinite(referencePrice);
    }

    public static boolean isMeasurable(Position position, PriceQuote quote) {
        return quote.isAvailable() && isMeasurable(position, quote.price());
    }
}
