package com.tracker.core.monitor;

import com.tracker.core.event.PositionEvent;
import com.tracker.core.exchange.FetchException;
import com.tracker.core.notify.DispatchReport;

import java.time.Duration;

/**
 * Observation hooks for metrics. Called on the monitor thread; implementations must be quick.
 */
public interface MonitorListener {

    MonitorListener NONE = new MonitorListener() {
    };

    default void onCycleCompleted(Duration elapsed, int openPositions) {
    }

    default void onFetchFailed(FetchException error) {
    }

    default void onEvent(PositionEvent event) {
    }

    default void onDispatch(DispatchReport report) {
    }

    default void onCycleError(Exception error) {
    }
}
