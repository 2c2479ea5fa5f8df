package com.tracker.metrics;

import com.tracker.core.event.PositionEvent;
import com.tracker.core.exchange.FetchException;
import com.tracker.core.monitor.MonitorListener;
import com.tracker.core.notify.DeliveryResult;
import com.tracker.core.notify.DispatchReport;

import java.time.Duration;

/**
 * Feeds monitor callbacks into {@link TrackerMetrics}.
 */
public final class MetricsMonitorListener implements MonitorListener {

    private final TrackerMetrics metrics;

    public MetricsMonitorListener(TrackerMetrics metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onCycleCompleted(Duration elapsed, int openPositions) {
        metrics.recordCycle(elapsed, openPositions);
    }

    @Override
    public void onFetchFailed(FetchException error) {
        metrics.incrementFetchFailures();
    }

    @Override
    public void onEvent(PositionEvent event) {
        metrics.incrementEvents(event.kind());
        if (event instanceof PositionEvent.Closed closed) {
            metrics.recordPnl(closed.pnlPercent());
        }
    }

    @Override
    public void onDispatch(DispatchReport report) {
        for (DeliveryResult result : report.results()) {
            metrics.recordDelivery(result.recipient().platform(), result.delivered());
        }
    }

    @Override
    public void onCycleError(Exception error) {
        metrics.incrementCycleErrors(error.getClass().getSimpleName());
    }
}
