package com.tracker.bot;

import com.tracker.config.ConfigurationException;
import com.tracker.config.TrackerConfig;
import com.tracker.console.OperatorConsole;
import com.tracker.core.monitor.ControlChannel;
import com.tracker.core.monitor.ControlIntent;
import com.tracker.core.monitor.StatusSnapshot;
import com.tracker.metrics.TrackerMetrics;
import com.tracker.status.StatusServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point. Runs bot lifetimes back to back while the operator asks for restarts.
 */
public class TrackerApplication {
    private static final Logger logger = LoggerFactory.getLogger(TrackerApplication.class);
    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(30);

    private final TrackerConfig config;
    private final TrackerMetrics metrics;
    private final ControlChannel control = new ControlChannel();
    private final AtomicReference<TrackerBot> current = new AtomicReference<>();
    private final CountDownLatch finished = new CountDownLatch(1);

    TrackerApplication(TrackerConfig config, TrackerMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
    }

    public static void main(String[] args) {
        TrackerConfig config;
        try {
            config = TrackerConfig.getInstance();
        } catch (ConfigurationException e) {
            logger.error("❌ {}", e.getMessage());
            System.exit(1);
            return;
        }

        var application = new TrackerApplication(config, TrackerMetrics.getInstance());

        Runtime.getRuntime().addShutdownHook(new Thread(application::shutdown, "shutdown-hook"));

        System.out.println("Commands: 'restart', 'stop', 'status'");
        new OperatorConsole(
            new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
            System.out,
            application::control,
            application::status
        ).startDaemon();

        application.run();
    }

    /**
     * Run until a stop intent. Each restart builds a fresh {@link TrackerBot}.
     */
    void run() {
        StatusServer statusServer = null;
        if (config.statusServerEnabled()) {
            statusServer = new StatusServer(config.statusServerPort(), this::status, metrics);
            statusServer.start();
        }

        try {
            ControlIntent intent = ControlIntent.RESTART;
            while (intent == ControlIntent.RESTART) {
                intent = runOnce();
                if (intent == ControlIntent.RESTART) {
                    logger.info("🔄 Restarting bot in {} seconds...", config.restartDelay().toSeconds());
                    if (control.awaitIntent(config.restartDelay()).orElse(null) == ControlIntent.STOP) {
                        intent = ControlIntent.STOP;
                    }
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Interrupted during restart delay");
        } finally {
            if (statusServer != null) {
                statusServer.stop();
            }
            logger.info("🛑 Bot stopped");
            finished.countDown();
        }
    }

    private ControlIntent runOnce() {
        try (var bot = createBot()) {
            current.set(bot);
            return bot.run();
        } catch (RuntimeException e) {
            // Construction or startup failed; a monitor that is running never throws.
            logger.error("❌ Bot error: {}", e.getMessage(), e);
            return ControlIntent.STOP;
        }
    }

    TrackerBot createBot() {
        return new TrackerBot(config, metrics, control);
    }

    ControlChannel control() {
        return control;
    }

    StatusSnapshot status() {
        TrackerBot bot = current.get();
        return bot == null ? null : bot.status();
    }

    /**
     * Shutdown hook: request a stop and give the loop a bounded time to wind down.
     */
    void shutdown() {
        if (finished.getCount() == 0) {
            return;
        }
        logger.info("Shutdown signal received, stopping monitor...");
        // A stop displaces a pending restart, so one request is enough.
        control.requestStop();
        try {
            if (!finished.await(SHUTDOWN_WAIT.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.warn("Monitor did not stop within {}s", SHUTDOWN_WAIT.toSeconds());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
