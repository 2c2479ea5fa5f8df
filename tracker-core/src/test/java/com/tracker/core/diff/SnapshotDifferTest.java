package com.tracker.core.diff;

import com.tracker.core.event.PositionEvent;
import com.tracker.core.event.ResizeDirection;
import com.tracker.core.model.Position;
import com.tracker.core.model.PositionSide;
import com.tracker.core.model.PriceQuote;
import com.tracker.core.model.Snapshot;
import com.tracker.core.testing.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

@DisplayName("SnapshotDiffer Tests")
class SnapshotDifferTest {

    private static final double DELTA = 0.0001;

    private final Map<String, PriceQuote> quotes = new HashMap<>();
    private MutableClock clock;
    private SnapshotDiffer differ;
    private TrackingLedger ledger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T09:00:00Z"));
        differ = new SnapshotDiffer(p -> quotes.getOrDefault(p.symbol(), PriceQuote.unavailable()), clock);
        ledger = new TrackingLedger();
    }

    private static Position btc(double size) {
        return new Position("BTC", PositionSide.LONG, 100, 0, size, 5);
    }

    private static Set<String> symbolsOf(DiffResult result, PositionEvent.Kind kind) {
        return result.events().stream()
            .filter(e -> e.kind() == kind)
            .map(PositionEvent::symbol)
            .collect(Collectors.toSet());
    }

    @Nested
    @DisplayName("Scenarios")
    class ScenarioTests {

        @Test
        @DisplayName("New then close: extremes pinned at the single reading, start time known")
        void testNewThenClose() {
            quotes.put("BTC", PriceQuote.live(110));

            var opened = differ.diff(Snapshot.empty(), List.of(btc(1)), ledger);

            assertThat(opened.events()).hasSize(1);
            var open = (PositionEvent.Opened) opened.events().get(0);
            assertThat(open.pnlPercent()).isCloseTo(50.0, within(DELTA));
            assertThat(open.alreadyOpenAtStartup()).isFalse();

            clock.advance(Duration.ofMinutes(12).plusSeconds(5));
            var closed = differ.diff(opened.next(), List.of(), ledger);

            assertThat(closed.events()).hasSize(1);
            var close = (PositionEvent.Closed) closed.events().get(0);
            assertThat(close.maxProfitPct()).isCloseTo(50.0, within(DELTA));
            assertThat(close.maxDrawdownPct()).isCloseTo(50.0, within(DELTA));
            assertThat(close.startedUnknown()).isFalse();
            assertThat(close.duration()).isEqualTo(Duration.ofSeconds(725));
            assertThat(closed.next().isEmpty()).isTrue();
            assertThat(ledger.extremes().get("BTC")).isEmpty();
            assertThat(ledger.startTime("BTC")).isEmpty();
        }

        @Test
        @DisplayName("Resize classification follows absolute size")
        void testResizeClassification() {
            quotes.put("BTC", PriceQuote.live(100));
            var one = Snapshot.of(List.of(btc(1)));

            var increased = differ.diff(one, List.of(btc(2)), ledger);
            assertThat(((PositionEvent.Resized) increased.events().get(0)).direction())
                .isEqualTo(ResizeDirection.INCREASED);

            var reduced = differ.diff(increased.next(), List.of(btc(1)), ledger);
            assertThat(((PositionEvent.Resized) reduced.events().get(0)).direction())
                .isEqualTo(ResizeDirection.REDUCED);
        }

        @Test
        @DisplayName("Entry price move without size change is UNCHANGED_BUT_CHANGED")
        void testEntryMoveOnly() {
            quotes.put("BTC", PriceQuote.live(100));
            var before = Snapshot.of(List.of(btc(-3)));
            var after = new Position("BTC", PositionSide.LONG, 98, 0, 3, 5);

            var result = differ.diff(before, List.of(after), ledger);

            var resized = (PositionEvent.Resized) result.events().get(0);
            assertThat(resized.direction()).isEqualTo(ResizeDirection.UNCHANGED_BUT_CHANGED);
            assertThat(resized.previousPosition().size()).isEqualTo(-3);
        }

        @Test
        @DisplayName("Restart mid-trade: baseline positions close as started unknown")
        void testRestartMidTrade() {
            quotes.put("BTC", PriceQuote.live(104));

            var baseline = differ.baseline(List.of(btc(1)), ledger);
            var opened = (PositionEvent.Opened) baseline.events().get(0);
            assertThat(opened.alreadyOpenAtStartup()).isTrue();
            assertThat(ledger.isBaselineEstablished()).isTrue();
            assertThat(ledger.startTime("BTC")).isEmpty();

            clock.advance(Duration.ofHours(3));
            quotes.put("BTC", PriceQuote.live(96));
            var closed = differ.diff(baseline.next(), List.of(), ledger);

            var close = (PositionEvent.Closed) closed.events().get(0);
            assertThat(close.startedUnknown()).isTrue();
            assertThat(close.duration()).isEqualTo(Duration.ZERO);
            assertThat(close.pnlPercent()).isCloseTo(-20.0, within(DELTA));
            assertThat(close.maxProfitPct()).isCloseTo(20.0, within(DELTA));
            assertThat(close.maxDrawdownPct()).isCloseTo(-20.0, within(DELTA));
        }
    }

    @Nested
    @DisplayName("Final reading")
    class FinalReadingTests {

        @Test
        @DisplayName("Close below every earlier reading deepens the drawdown")
        void testCloseDeepensDrawdown() {
            quotes.put("BTC", PriceQuote.live(110));
            var opened = differ.diff(Snapshot.empty(), List.of(btc(1)), ledger);

            quotes.put("BTC", PriceQuote.live(90));
            var closed = differ.diff(opened.next(), List.of(), ledger);

            var close = (PositionEvent.Closed) closed.events().get(0);
            assertThat(close.pnlPercent()).isCloseTo(-50.0, within(DELTA));
            assertThat(close.maxProfitPct()).isCloseTo(50.0, within(DELTA));
            assertThat(close.maxDrawdownPct()).isCloseTo(-50.0, within(DELTA));
        }

        @Test
        @DisplayName("Close above every earlier reading raises the max profit")
        void testCloseRaisesProfit() {
            quotes.put("BTC", PriceQuote.live(98));
            var opened = differ.diff(Snapshot.empty(), List.of(btc(1)), ledger);

            quotes.put("BTC", PriceQuote.mark(106));
            var closed = differ.diff(opened.next(), List.of(), ledger);

            var close = (PositionEvent.Closed) closed.events().get(0);
            assertThat(close.maxProfitPct()).isCloseTo(30.0, within(DELTA));
            assertThat(close.maxDrawdownPct()).isCloseTo(-10.0, within(DELTA));
        }
    }

    @Nested
    @DisplayName("Diff correctness")
    class PartitionTests {

        @Test
        @DisplayName("Events partition symmetric difference plus changed symbols")
        void testPartition() {
            quotes.put("A", PriceQuote.live(10));
            quotes.put("B", PriceQuote.live(10));
            quotes.put("C", PriceQuote.live(10));
            quotes.put("D", PriceQuote.live(10));

            var previous = Snapshot.of(List.of(
                new Position("A", PositionSide.LONG, 10, 0, 1, 1),
                new Position("B", PositionSide.LONG, 10, 0, 1, 1),
                new Position("C", PositionSide.SHORT, 10, 0, 1, 1)
            ));
            var current = List.of(
                new Position("B", PositionSide.LONG, 10, 0, 4, 1),
                new Position("C", PositionSide.SHORT, 10, 0, 1, 1),
                new Position("D", PositionSide.SHORT, 10, 0, 2, 2),
                new Position("E", PositionSide.LONG, 10, 0, 0, 2)
            );

            var result = differ.diff(previous, current, ledger);

            assertThat(symbolsOf(result, PositionEvent.Kind.OPENED)).containsExactly("D");
            assertThat(symbolsOf(result, PositionEvent.Kind.RESIZED)).containsExactly("B");
            assertThat(symbolsOf(result, PositionEvent.Kind.CLOSED)).containsExactly("A");
            assertThat(result.events()).hasSize(3);
            assertThat(result.next().symbols()).containsExactlyInAnyOrder("B", "C", "D");
        }

        @Test
        @DisplayName("Unchanged positions produce no event but still update extremes")
        void testUnchangedUpdatesExtremes() {
            quotes.put("BTC", PriceQuote.live(110));
            var first = differ.diff(Snapshot.empty(), List.of(btc(1)), ledger);

            quotes.put("BTC", PriceQuote.live(90));
            var second = differ.diff(first.next(), List.of(btc(1)), ledger);

            assertThat(second.events()).isEmpty();
            assertThat(ledger.extremes().get("BTC")).hasValueSatisfying(e -> {
                assertThat(e.maxProfitPct()).isCloseTo(50.0, within(DELTA));
                assertThat(e.maxDrawdownPct()).isCloseTo(-50.0, within(DELTA));
            });
        }

        @Test
        @DisplayName("Re-opened symbol starts with fresh extremes")
        void testReopenStartsFresh() {
            quotes.put("BTC", PriceQuote.live(120));
            var opened = differ.diff(Snapshot.empty(), List.of(btc(1)), ledger);
            var closed = differ.diff(opened.next(), List.of(), ledger);

            quotes.put("BTC", PriceQuote.live(101));
            differ.diff(closed.next(), List.of(btc(1)), ledger);

            assertThat(ledger.extremes().get("BTC")).hasValueSatisfying(e ->
                assertThat(e.maxProfitPct()).isCloseTo(5.0, within(DELTA)));
        }
    }

    @Nested
    @DisplayName("Unavailable prices")
    class UnavailablePriceTests {

        @Test
        @DisplayName("Unknown readings do not pin extremes at zero")
        void testUnknownReadingsSkipped() {
            var opened = differ.diff(Snapshot.empty(), List.of(btc(1)), ledger);
            assertThat(opened.events().get(0).pnlPercent()).isZero();
            assertThat(ledger.extremes().get("BTC")).isEmpty();

            quotes.put("BTC", PriceQuote.live(102));
            var later = differ.diff(opened.next(), List.of(btc(1)), ledger);

            assertThat(ledger.extremes().get("BTC")).hasValueSatisfying(e -> {
                assertThat(e.maxProfitPct()).isCloseTo(10.0, within(DELTA));
                assertThat(e.maxDrawdownPct()).isCloseTo(10.0, within(DELTA));
            });

            quotes.remove("BTC");
            var closed = differ.diff(later.next(), List.of(), ledger);
            var close = (PositionEvent.Closed) closed.events().get(0);
            assertThat(close.referencePrice()).isEqualTo(PriceQuote.lastKnown(102));
            assertThat(close.maxDrawdownPct()).isCloseTo(10.0, within(DELTA));
        }

        @Test
        @DisplayName("Failed ticker at close falls back to the last live price")
        void testCloseUsesLastLivePrice() {
            quotes.put("BTC", PriceQuote.live(110));
            var opened = differ.diff(Snapshot.empty(), List.of(btc(1)), ledger);
            assertThat(ledger.lastPrice("BTC")).contains(110.0);

            quotes.put("BTC", PriceQuote.unavailable());
            var closed = differ.diff(opened.next(), List.of(), ledger);

            var close = (PositionEvent.Closed) closed.events().get(0);
            assertThat(close.referencePrice().origin()).isEqualTo(PriceQuote.Origin.LAST_KNOWN);
            assertThat(close.referencePrice().price()).isEqualTo(110.0);
            assertThat(close.pnlPercent()).isCloseTo(50.0, within(DELTA));
            assertThat(close.maxProfitPct()).isCloseTo(50.0, within(DELTA));
            assertThat(ledger.lastPrice("BTC")).isEmpty();
        }

        @Test
        @DisplayName("Mark readings are not remembered as live prices")
        void testMarkNotRemembered() {
            quotes.put("BTC", PriceQuote.mark(104));
            var opened = differ.diff(Snapshot.empty(), List.of(btc(1)), ledger);
            assertThat(ledger.lastPrice("BTC")).isEmpty();

            quotes.remove("BTC");
            var closed = differ.diff(opened.next(), List.of(), ledger);

            var close = (PositionEvent.Closed) closed.events().get(0);
            assertThat(close.referencePrice().isAvailable()).isFalse();
            assertThat(close.pnlPercent()).isZero();
            assertThat(close.maxProfitPct()).isCloseTo(20.0, within(DELTA));
        }

        @Test
        @DisplayName("Close without any measurable reading reports final PnL as both extremes")
        void testCloseWithoutExtremes() {
            var opened = differ.diff(Snapshot.empty(), List.of(btc(1)), ledger);

            quotes.put("BTC", PriceQuote.mark(95));
            var closed = differ.diff(opened.next(), List.of(), ledger);

            var close = (PositionEvent.Closed) closed.events().get(0);
            assertThat(close.referencePrice().origin()).isEqualTo(PriceQuote.Origin.MARK);
            assertThat(close.pnlPercent()).isCloseTo(-25.0, within(DELTA));
            assertThat(close.maxProfitPct()).isCloseTo(-25.0, within(DELTA));
            assertThat(close.maxDrawdownPct()).isCloseTo(-25.0, within(DELTA));
        }
    }
}
