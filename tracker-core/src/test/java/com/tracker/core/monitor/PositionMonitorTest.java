package com.tracker.core.monitor;

import com.tracker.core.diff.SnapshotDiffer;
import com.tracker.core.event.PositionEvent;
import com.tracker.core.exchange.ExchangeGateway;
import com.tracker.core.exchange.FetchException;
import com.tracker.core.model.Position;
import com.tracker.core.model.PositionSide;
import com.tracker.core.model.PriceQuote;
import com.tracker.core.notify.FanOutDispatcher;
import com.tracker.core.notify.Platform;
import com.tracker.core.notify.Recipient;
import com.tracker.core.notify.RecordingChannel;
import com.tracker.core.notify.format.TelegramMessageFormatter;
import com.tracker.core.testing.MutableClock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("PositionMonitor Tests")
class PositionMonitorTest {

    private static final Position BTC = new Position("BTC_USDT", PositionSide.LONG, 100, 0, 1, 5);
    private static final Position ETH = new Position("ETH_USDT", PositionSide.SHORT, 2000, 0, 2, 10);

    @Mock
    private ExchangeGateway gateway;

    private final List<PositionEvent> observed = new ArrayList<>();
    private final MonitorListener recordingListener = new MonitorListener() {
        @Override
        public void onEvent(PositionEvent event) {
            observed.add(event);
        }
    };

    private MutableClock clock;
    private RecordingChannel channel;
    private FanOutDispatcher dispatcher;
    private ControlChannel control;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T09:00:00Z"));
        channel = new RecordingChannel(Platform.TELEGRAM);
        dispatcher = new FanOutDispatcher(List.of(channel),
            List.of(new TelegramMessageFormatter(ZoneOffset.UTC)),
            List.of(new Recipient(Platform.TELEGRAM, "-1", "Desk", null)),
            1, Duration.ofSeconds(5));
        control = new ControlChannel();
    }

    @AfterEach
    void tearDown() {
        dispatcher.close();
    }

    private PositionMonitor monitor(MonitorSettings settings, MonitorListener listener) {
        var differ = new SnapshotDiffer(p -> PriceQuote.live(p.entryPrice()), clock);
        return new PositionMonitor(gateway, differ, dispatcher, control, settings, listener, clock);
    }

    private PositionMonitor monitor() {
        return monitor(MonitorSettings.defaults(), recordingListener);
    }

    @Nested
    @DisplayName("Cycles")
    class CycleTests {

        @Test
        @DisplayName("First poll announces existing positions as baseline")
        void testBaselineAnnounced() throws Exception {
            when(gateway.fetchPositions()).thenReturn(List.of(BTC, ETH));
            var monitor = monitor();

            monitor.runCycle();

            assertThat(observed).hasSize(2)
                .allSatisfy(e -> assertThat(((PositionEvent.Opened) e).alreadyOpenAtStartup()).isTrue());
            assertThat(channel.sent()).hasSize(2);
            assertThat(monitor.status().activeSymbols()).containsExactlyInAnyOrder("BTC_USDT", "ETH_USDT");
            assertThat(monitor.status().baselineEstablished()).isTrue();
        }

        @Test
        @DisplayName("Baseline can be seeded silently")
        void testBaselineSilent() throws Exception {
            when(gateway.fetchPositions()).thenReturn(List.of(BTC)).thenReturn(List.of());
            var monitor = monitor(new MonitorSettings(Duration.ofSeconds(10), 3, false), recordingListener);

            monitor.runCycle();
            assertThat(channel.sent()).isEmpty();

            monitor.runCycle();
            assertThat(channel.sent()).singleElement()
                .satisfies(s -> assertThat(s.text()).contains("POSITION CLOSED").contains("offline"));
        }

        @Test
        @DisplayName("Failed fetch produces no events and keeps the previous snapshot")
        void testFetchFailure() throws Exception {
            when(gateway.fetchPositions())
                .thenReturn(List.of(BTC))
                .thenThrow(new FetchException("HTTP 502"))
                .thenReturn(List.of(BTC));
            var monitor = monitor();

            monitor.runCycle();
            observed.clear();

            monitor.runCycle();
            assertThat(observed).isEmpty();
            assertThat(monitor.status().activeSymbols()).containsExactly("BTC_USDT");

            monitor.runCycle();
            assertThat(observed).isEmpty();
            assertThat(monitor.status().cyclesCompleted()).isEqualTo(2);
        }

        @Test
        @DisplayName("Position opened after startup closes with a known duration")
        void testObservedOpenAndClose() throws Exception {
            when(gateway.fetchPositions())
                .thenReturn(List.of())
                .thenReturn(List.of(BTC))
                .thenReturn(List.of());
            var monitor = monitor();

            monitor.runCycle();
            monitor.runCycle();
            clock.advance(Duration.ofMinutes(3));
            monitor.runCycle();

            assertThat(observed).extracting(PositionEvent::kind)
                .containsExactly(PositionEvent.Kind.OPENED, PositionEvent.Kind.CLOSED);
            var closed = (PositionEvent.Closed) observed.get(1);
            assertThat(closed.startedUnknown()).isFalse();
            assertThat(closed.duration()).isEqualTo(Duration.ofMinutes(3));
        }

        @Test
        @DisplayName("Pending stop abandons the cycle before diffing")
        void testAbandonOnPendingStop() throws Exception {
            when(gateway.fetchPositions()).thenReturn(List.of(BTC));
            var monitor = monitor();
            control.requestStop();

            monitor.runCycle();

            assertThat(observed).isEmpty();
            assertThat(monitor.status().baselineEstablished()).isFalse();
        }
    }

    @Nested
    @DisplayName("Loop")
    class LoopTests {

        @Test
        @DisplayName("Stop ends the loop after the current cycle")
        void testStop() throws Exception {
            when(gateway.fetchPositions()).thenAnswer(inv -> {
                control.requestStop();
                return List.of(BTC);
            });
            var monitor = monitor(new MonitorSettings(Duration.ofMillis(10), 3, true), MonitorListener.NONE);

            ControlIntent intent = monitor.run();

            assertThat(intent).isEqualTo(ControlIntent.STOP);
            assertThat(monitor.status().state()).isEqualTo(MonitorState.STOPPED);
            verify(gateway, times(1)).fetchPositions();
        }

        @Test
        @DisplayName("Unexpected error is survived and the loop honours a later restart")
        void testSurvivesErrorThenRestarts() throws Exception {
            var errors = new ArrayList<Exception>();
            var listener = new MonitorListener() {
                @Override
                public void onCycleError(Exception error) {
                    errors.add(error);
                }
            };
            when(gateway.fetchPositions())
                .thenThrow(new IllegalStateException("unexpected payload"))
                .thenAnswer(inv -> {
                    control.requestRestart();
                    return List.of();
                });
            var monitor = monitor(new MonitorSettings(Duration.ofMillis(10), 3, true), listener);

            ControlIntent intent = monitor.run();

            assertThat(intent).isEqualTo(ControlIntent.RESTART);
            assertThat(errors).singleElement().isInstanceOf(IllegalStateException.class);
            verify(gateway, times(2)).fetchPositions();
        }

        @Test
        @DisplayName("Status reports interval and recipients")
        void testStatus() {
            var monitor = monitor();

            var status = monitor.status();

            assertThat(status.state()).isEqualTo(MonitorState.RUNNING);
            assertThat(status.interval()).isEqualTo(Duration.ofSeconds(10));
            assertThat(status.recipients()).extracting(Recipient::displayName).containsExactly("Desk");
            assertThat(status.lastCycleAt()).isNull();
        }
    }

    @Test
    @DisplayName("Back-off is never shorter than three intervals")
    void testBackoffFloor() {
        var settings = new MonitorSettings(Duration.ofSeconds(10), 1, true);

        assertThat(settings.errorBackoff()).isEqualTo(Duration.ofSeconds(30));
    }
}
