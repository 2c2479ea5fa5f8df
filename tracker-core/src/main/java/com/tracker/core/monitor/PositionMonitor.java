package com.tracker.core.monitor;

import com.tracker.core.diff.DiffResult;
import com.tracker.core.diff.SnapshotDiffer;
import com.tracker.core.diff.TrackingLedger;
import com.tracker.core.event.PositionEvent;
import com.tracker.core.exchange.ExchangeGateway;
import com.tracker.core.exchange.FetchException;
import com.tracker.core.model.Position;
import com.tracker.core.model.Snapshot;
import com.tracker.core.notify.DispatchReport;
import com.tracker.core.notify.FanOutDispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Drives poll, diff and dispatch on a fixed cadence until a control intent arrives.
 *
 * <p>All domain state (the previous snapshot and the {@link TrackingLedger}) belongs to the
 * thread calling {@link #run()}. Other threads only see {@link #status()} and talk to the loop
 * through the {@link ControlChannel}.
 *
 * <p>A failed position fetch skips the cycle and leaves the previous snapshot untouched.
 * Any other error is logged and followed by an extended back-off; the loop never exits on
 * its own.
 */
public final class PositionMonitor {
    private static final Logger logger = LoggerFactory.getLogger(PositionMonitor.class);

    private final ExchangeGateway gateway;
    private final SnapshotDiffer differ;
    private final FanOutDispatcher dispatcher;
    private final ControlChannel control;
    private final MonitorSettings settings;
    private final MonitorListener listener;
    private final Clock clock;

    private final TrackingLedger ledger = new TrackingLedger();
    private Snapshot previous = Snapshot.empty();
    private long cyclesCompleted;
    private Instant lastCycleAt;

    private volatile StatusSnapshot status;

    public PositionMonitor(ExchangeGateway gateway,
                           SnapshotDiffer differ,
                           FanOutDispatcher dispatcher,
                           ControlChannel control,
                           MonitorSettings settings,
                           MonitorListener listener,
                           Clock clock) {
        this.gateway = gateway;
        this.differ = differ;
        this.dispatcher = dispatcher;
        this.control = control;
        this.settings = settings;
        this.listener = listener;
        this.clock = clock;
        publishStatus(MonitorState.RUNNING);
    }

    /**
     * Run until a stop or restart intent is received. Blocks the calling thread.
     *
     * @return the intent that ended the loop; {@link ControlIntent#STOP} if the thread was interrupted
     */
    public ControlIntent run() {
        logger.info("🔭 Position monitoring STARTED on {} - polling every {}s",
            gateway.name(), settings.interval().toSeconds());

        ControlIntent intent = null;
        try {
            while (intent == null) {
                Duration pause = settings.interval();
                try {
                    runCycle();
                } catch (Exception e) {
                    logger.error("❌ Error in monitoring loop: {}", e.getMessage(), e);
                    listener.onCycleError(e);
                    pause = settings.errorBackoff();
                    logger.info("Backing off for {}s", pause.toSeconds());
                }
                intent = control.awaitIntent(pause).orElse(null);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Monitoring loop interrupted");
            intent = ControlIntent.STOP;
        }

        publishStatus(MonitorState.STOPPING);
        logger.info("🛑 Position monitoring stopping ({})", intent);
        publishStatus(MonitorState.STOPPED);
        return intent;
    }

    /**
     * One poll: fetch, diff against the previous snapshot, dispatch the resulting events.
     */
    void runCycle() {
        Instant started = clock.instant();

        List<Position> positions;
        try {
            positions = gateway.fetchPositions();
        } catch (FetchException e) {
            logger.warn("⚠️ Error fetching positions, skipping cycle: {}", e.getMessage());
            listener.onFetchFailed(e);
            return;
        }

        if (control.isPending()) {
            logger.info("Control request pending - abandoning cycle before diff");
            return;
        }

        boolean baseline = !ledger.isBaselineEstablished();
        DiffResult result = baseline
            ? differ.baseline(positions, ledger)
            : differ.diff(previous, positions, ledger);
        previous = result.next();

        for (PositionEvent event : result.events()) {
            listener.onEvent(event);
            if (baseline && !settings.announceExistingPositions()) {
                continue;
            }
            DispatchReport report = dispatcher.dispatch(event);
            listener.onDispatch(report);
        }

        cyclesCompleted++;
        lastCycleAt = clock.instant();
        listener.onCycleCompleted(Duration.between(started, lastCycleAt), previous.size());
        publishStatus(MonitorState.RUNNING);

        if (!result.events().isEmpty()) {
            logger.debug("Cycle {} produced {} event(s); tracking {}", cyclesCompleted, result.events().size(), previous.symbols());
        }
    }

    public StatusSnapshot status() {
        return status;
    }

    public ControlChannel control() {
        return control;
    }

    private void publishStatus(MonitorState state) {
        this.status = new StatusSnapshot(
            state,
            previous.symbols(),
            settings.interval(),
            dispatcher.recipients(),
            cyclesCompleted,
            lastCycleAt,
            ledger.isBaselineEstablished()
        );
    }
}
