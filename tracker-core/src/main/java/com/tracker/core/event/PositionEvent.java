package com.tracker.core.event;

import com.tracker.core.model.Position;
import com.tracker.core.model.PriceQuote;

import java.time.Duration;
import java.time.Instant;

/**
 * Sealed interface representing a discrete trade transition detected between two snapshots.
 * Every event carries its computed PnL figures so all recipients see the same numbers.
 */
public sealed interface PositionEvent permits PositionEvent.Opened, PositionEvent.Resized, PositionEvent.Closed {

    enum Kind {
        OPENED,
        RESIZED,
        CLOSED
    }

    Kind kind();

    /** The position this event describes (for closes, the last known record). */
    Position position();

    PriceQuote referencePrice();

    double pnlPercent();

    Instant detectedAt();

    default String symbol() {
        return position().symbol();
    }

    /**
     * A symbol appeared that was absent from the previous snapshot.
     *
     * @param alreadyOpenAtStartup true when the symbol was part of the first snapshot after
     *                             (re)start, so its real opening time is not known
     */
    record Opened(
        Position position,
        PriceQuote referencePrice,
        double pnlPercent,
        Instant detectedAt,
        boolean alreadyOpenAtStartup
    ) implements PositionEvent {
        @Override
        public Kind kind() {
            return Kind.OPENED;
        }
    }

    record Resized(
        Position position,
        Position previousPosition,
        ResizeDirection direction,
        PriceQuote referencePrice,
        double pnlPercent,
        Instant detectedAt
    ) implements PositionEvent {
        @Override
        public Kind kind() {
            return Kind.RESIZED;
        }
    }

    /**
     * A symbol disappeared from the venue's report.
     *
     * @param startedUnknown true when no start time was recorded for the symbol (opened while the
     *                       tracker was offline); duration is then zero
     */
    record Closed(
        Position position,
        PriceQuote referencePrice,
        double pnlPercent,
        Duration duration,
        double maxProfitPct,
        double maxDrawdownPct,
        boolean startedUnknown,
        Instant detectedAt
    ) implements PositionEvent {
        @Override
        public Kind kind() {
            return Kind.CLOSED;
        }
    }
}
