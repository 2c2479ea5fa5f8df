package com.tracker.core.diff;

import com.tracker.core.event.PositionEvent;
import com.tracker.core.event.ResizeDirection;
import com.tracker.core.exchange.ReferencePriceSource;
import com.tracker.core.model.Position;
import com.tracker.core.model.PriceQuote;
import com.tracker.core.model.Snapshot;
import com.tracker.core.pnl.PnlCalculator;
import com.tracker.core.pnl.PositionExtremes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns two consecutive position snapshots into discrete trade events.
 *
 * <p>Single pass per cycle, keyed by symbol:
 * <ul>
 *   <li>in current only: {@link PositionEvent.Opened}, start time recorded</li>
 *   <li>in both with any field changed: {@link PositionEvent.Resized}</li>
 *   <li>in previous only: {@link PositionEvent.Closed} from the last known record</li>
 * </ul>
 * Extremes are updated for every present symbol whose PnL is measurable, and for the final
 * reading of a closed one.
 *
 * <p>Stateless apart from its collaborators; all mutable state lives in the {@link TrackingLedger}.
 */
public final class SnapshotDiffer {
    private static final Logger logger = LoggerFactory.getLogger(SnapshotDiffer.class);

    private final ReferencePriceSource prices;
    private final Clock clock;

    public SnapshotDiffer(ReferencePriceSource prices, Clock clock) {
        this.prices = prices;
        this.clock = clock;
    }

    /**
     * Compare the previous snapshot with a fresh position list.
     * The returned {@link DiffResult#next()} replaces {@code previous} for the following cycle.
     */
    public DiffResult diff(Snapshot previous, List<Position> currentRaw, TrackingLedger ledger) {
        Instant now = clock.instant();
        Snapshot current = Snapshot.of(currentRaw);
        var events = new ArrayList<PositionEvent>();

        for (Position position : current.positions()) {
            String symbol = position.symbol();
            PriceQuote quote = prices.quoteFor(position);
            double pnl = trackPnl(position, quote, ledger);

            Optional<Position> before = previous.get(symbol);
            if (before.isEmpty()) {
                ledger.recordStart(symbol, now);
                events.add(new PositionEvent.Opened(position, quote, pnl, now, false));
                logger.info("New position detected: {} {} ({}x)", symbol, position.side(), fmtLeverage(position));
            } else if (!before.get().equals(position)) {
                var direction = ResizeDirection.classify(before.get().size(), position.size());
                events.add(new PositionEvent.Resized(position, before.get(), direction, quote, pnl, now));
                logger.info("Position updated: {} - {} ({} -> {})",
                    symbol, direction, before.get().size(), position.size());
            }
        }

        for (Position last : previous.positions()) {
            if (!current.contains(last.symbol())) {
                events.add(close(last, ledger, now));
            }
        }

        return new DiffResult(events, current);
    }

    /**
     * Seed state from the first successful poll of a bot lifetime.
     *
     * <p>Every position is reported as {@code Opened} with {@code alreadyOpenAtStartup} set and
     * extremes start from the current reading. No start time is recorded because the opening
     * was never observed, so these symbols later close with {@code startedUnknown}.
     */
    public DiffResult baseline(List<Position> currentRaw, TrackingLedger ledger) {
        Instant now = clock.instant();
        Snapshot current = Snapshot.of(currentRaw);
        var events = new ArrayList<PositionEvent>();

        for (Position position : current.positions()) {
            PriceQuote quote = prices.quoteFor(position);
            double pnl = trackPnl(position, quote, ledger);
            events.add(new PositionEvent.Opened(position, quote, pnl, now, true));
        }

        ledger.markBaselineEstablished();
        logger.info("📋 Baseline established with {} open position(s): {}", current.size(), current.symbols());
        return new DiffResult(events, current);
    }

    private double trackPnl(Position position, PriceQuote quote, TrackingLedger ledger) {
        double pnl = PnlCalculator.pnlPercent(position, quote);
        if (PnlCalculator.isMeasurable(position, quote)) {
            ledger.extremes().update(position.symbol(), pnl);
            if (quote.origin() == PriceQuote.Origin.LIVE) {
                ledger.recordPrice(position.symbol(), quote.price());
            }
        } else {
            logger.debug("PnL for {} not measurable this cycle (price origin {})", position.symbol(), quote.origin());
        }
        return pnl;
    }

    private PositionEvent.Closed close(Position last, TrackingLedger ledger, Instant now) {
        String symbol = last.symbol();
        PriceQuote quote = closingQuote(last, ledger);
        double finalPnl = PnlCalculator.pnlPercent(last, quote);
        if (PnlCalculator.isMeasurable(last, quote)) {
            ledger.extremes().update(symbol, finalPnl);
        }

        Optional<Instant> startedAt = ledger.startTime(symbol);
        boolean startedUnknown = startedAt.isEmpty();
        Duration duration = startedAt
            .map(start -> Duration.between(start, now))
            .filter(d -> !d.isNegative())
            .orElse(Duration.ZERO);

        PositionExtremes extremes = ledger.extremes().get(symbol)
            .orElse(PositionExtremes.initial(finalPnl));

        ledger.forget(symbol);

        logger.info("Position closed: {} - Duration: {}s, Final PnL: {}%{}",
            symbol, duration.toSeconds(), String.format("%+.2f", finalPnl),
            startedUnknown ? " (opened while offline)" : "");

        return new PositionEvent.Closed(last, quote, finalPnl, duration,
            extremes.maxProfitPct(), extremes.maxDrawdownPct(), startedUnknown, now);
    }

    private PriceQuote closingQuote(Position last, TrackingLedger ledger) {
        PriceQuote quote = prices.quoteFor(last);
        if (quote.isAvailable()) {
            return quote;
        }
        return ledger.lastPrice(last.symbol())
            .map(price -> {
                logger.warn("No price for closed {}, using last live price {}", last.symbol(), price);
                return PriceQuote.lastKnown(price);
            })
            .orElse(quote);
    }

    private static String fmtLeverage(Position position) {
        return String.valueOf((int) position.leverage());
    }
}
