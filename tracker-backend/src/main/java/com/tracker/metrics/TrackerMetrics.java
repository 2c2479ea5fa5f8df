package com.tracker.metrics;

import com.tracker.core.event.PositionEvent;
import com.tracker.core.notify.Platform;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Prometheus metrics for the tracker.
 *
 * Lazily created through the Initialization-on-Demand Holder idiom:
 *   var metrics = TrackerMetrics.getInstance();
 *   metrics.incrementEvents(PositionEvent.Kind.CLOSED);
 */
public final class TrackerMetrics {
    private static final Logger logger = LoggerFactory.getLogger(TrackerMetrics.class);

    private final PrometheusMeterRegistry registry;
    private final AtomicInteger openPositions = new AtomicInteger();

    TrackerMetrics(PrometheusMeterRegistry registry) {
        this.registry = registry;
        registry.gauge("tracker.positions.open", openPositions);
    }

    private TrackerMetrics() {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
        logger.info("TrackerMetrics initialized with Prometheus registry");
    }

    private static class Holder {
        private static final TrackerMetrics INSTANCE = new TrackerMetrics();
    }

    public static TrackerMetrics getInstance() {
        return Holder.INSTANCE;
    }

    public MeterRegistry registry() {
        return registry;
    }

    /**
     * Prometheus text exposition for scraping.
     */
    public String scrape() {
        return registry.scrape();
    }

    public void incrementEvents(PositionEvent.Kind kind) {
        registry.counter("tracker.events", "kind", kind.name().toLowerCase()).increment();
    }

    public void recordDelivery(Platform platform, boolean delivered) {
        registry.counter("tracker.notifications",
            "platform", platform.name().toLowerCase(),
            "outcome", delivered ? "delivered" : "failed").increment();
    }

    public void incrementFetchFailures() {
        registry.counter("tracker.fetch.failures").increment();
    }

    public void incrementCycleErrors(String error) {
        registry.counter("tracker.cycle.errors", "error", error).increment();
    }

    public void recordCycle(Duration elapsed, int open) {
        registry.timer("tracker.cycle.duration").record(elapsed);
        openPositions.set(open);
    }

    public void recordPnl(double pnlPercent) {
        registry.summary("tracker.position.final_pnl").record(pnlPercent);
    }

    public int openPositions() {
        return openPositions.get();
    }
}
