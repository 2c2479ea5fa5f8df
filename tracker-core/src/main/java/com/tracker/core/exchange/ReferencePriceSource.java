package com.tracker.core.exchange;

import com.tracker.core.model.Position;
import com.tracker.core.model.PriceQuote;

/**
 * Supplies the reference price used for a position's PnL reading. Never fails.
 */
@FunctionalInterface
public interface ReferencePriceSource {

    PriceQuote quoteFor(Position position);
}
