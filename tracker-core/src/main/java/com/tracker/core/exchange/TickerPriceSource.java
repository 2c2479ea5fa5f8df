package com.tracker.core.exchange;

import com.tracker.core.model.Position;
import com.tracker.core.model.PriceQuote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fetches a fresh ticker price for each position and falls back to the position's last
 * mark price when the ticker is unavailable.
 */
public final class TickerPriceSource implements ReferencePriceSource {
    private static final Logger logger = LoggerFactory.getLogger(TickerPriceSource.class);

    private final ExchangeGateway gateway;

    public TickerPriceSource(ExchangeGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public PriceQuote quoteFor(Position position) {
        String symbol = position.symbol();
        try {
            double price = gateway.fetchReferencePrice(symbol);
            if (price > 0 && Double.isFinite(price)) {
                return PriceQuote.live(price);
            }
            logger.warn("Could not get price for {} (ticker returned {})", symbol, price);
        } catch (FetchException e) {
            logger.warn("Error getting current price for {}: {}", symbol, e.getMessage());
        }

        if (position.hasMarkPrice()) {
            logger.debug("Using last mark price {} for {}", position.markPrice(), symbol);
            return PriceQuote.mark(position.markPrice());
        }
        return PriceQuote.unavailable();
    }
}
