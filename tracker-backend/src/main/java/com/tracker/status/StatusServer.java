package com.tracker.status;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.tracker.core.monitor.MonitorState;
import com.tracker.core.monitor.StatusSnapshot;
import com.tracker.metrics.TrackerMetrics;
import io.javalin.Javalin;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Read-only HTTP surface: liveness, monitor status and Prometheus metrics.
 */
public final class StatusServer {
    private static final Logger logger = LoggerFactory.getLogger(StatusServer.class);

    private final Javalin app;
    private final int port;

    public StatusServer(int port, Supplier<StatusSnapshot> status, TrackerMetrics metrics) {
        this.port = port;

        var objectMapper = new ObjectMapper();
        objectMapper.registerModule(new JavaTimeModule());
        objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        this.app = Javalin.create(config -> {
            config.showJavalinBanner = false;
            config.jsonMapper(new JavalinJackson(objectMapper, false));
        });

        app.get("/healthz", ctx -> {
            StatusSnapshot snapshot = status.get();
            boolean running = snapshot != null && snapshot.state() == MonitorState.RUNNING;
            ctx.status(running ? 200 : 503);
            ctx.json(Map.of("status", running ? "UP" : "DOWN"));
        });

        app.get("/api/status", ctx -> {
            StatusSnapshot snapshot = status.get();
            if (snapshot == null) {
                ctx.status(503);
                ctx.json(Map.of("error", "monitor not started"));
                return;
            }
            ctx.json(StatusView.from(snapshot));
        });

        app.get("/metrics", ctx -> {
            ctx.contentType("text/plain; version=0.0.4");
            ctx.result(metrics.scrape());
        });
    }

    public void start() {
        app.start(port);
        logger.info("🚀 Status server started at http://localhost:{}", app.port());
        logger.info("   Status: http://localhost:{}/api/status", app.port());
        logger.info("   Metrics: http://localhost:{}/metrics", app.port());
    }

    public int port() {
        return app.port();
    }

    public void stop() {
        app.stop();
        logger.info("Status server stopped");
    }
}
