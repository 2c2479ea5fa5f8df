package com.tracker.bot;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tracker.config.TrackerConfig;
import com.tracker.core.diff.SnapshotDiffer;
import com.tracker.core.exchange.ExchangeGateway;
import com.tracker.core.exchange.TickerPriceSource;
import com.tracker.core.monitor.ControlChannel;
import com.tracker.core.monitor.ControlIntent;
import com.tracker.core.monitor.MonitorSettings;
import com.tracker.core.monitor.PositionMonitor;
import com.tracker.core.monitor.StatusSnapshot;
import com.tracker.core.notify.DispatchReport;
import com.tracker.core.notify.FanOutDispatcher;
import com.tracker.core.notify.NotificationChannel;
import com.tracker.core.notify.StartupNotice;
import com.tracker.core.notify.format.DiscordMessageFormatter;
import com.tracker.core.notify.format.NotificationFormatter;
import com.tracker.core.notify.format.TelegramMessageFormatter;
import com.tracker.exchange.ResilientExchangeGateway;
import com.tracker.exchange.mexc.MexcFuturesClient;
import com.tracker.metrics.MetricsMonitorListener;
import com.tracker.metrics.TrackerMetrics;
import com.tracker.notifications.DiscordChannel;
import com.tracker.notifications.TelegramChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * One bot lifetime: everything built from configuration, the startup announcement and the
 * monitoring loop. A restart throws the whole instance away and builds a new one.
 */
public final class TrackerBot implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TrackerBot.class);

    private final TrackerConfig config;
    private final ExchangeGateway gateway;
    private final FanOutDispatcher dispatcher;
    private final PositionMonitor monitor;
    private final Clock clock;

    public TrackerBot(TrackerConfig config, TrackerMetrics metrics, ControlChannel control) {
        this(config, new ResilientExchangeGateway(new MexcFuturesClient(config), metrics.registry()),
            channelsFor(config), metrics, control, Clock.systemUTC());
    }

    TrackerBot(TrackerConfig config, ExchangeGateway gateway, List<NotificationChannel> channels,
               TrackerMetrics metrics, ControlChannel control, Clock clock) {
        this.config = config;
        this.gateway = gateway;
        this.clock = clock;

        List<NotificationFormatter> formatters = List.of(
            new DiscordMessageFormatter(config.displayZone()),
            new TelegramMessageFormatter(config.displayZone()));

        this.dispatcher = new FanOutDispatcher(channels, formatters, config.recipients(),
            config.dispatchParallelism(), config.requestTimeout().multipliedBy(2));

        var settings = new MonitorSettings(config.monitoringInterval(),
            config.errorBackoffMultiplier(), config.announceExistingPositions());

        this.monitor = new PositionMonitor(gateway,
            new SnapshotDiffer(new TickerPriceSource(gateway), clock),
            dispatcher, control, settings, new MetricsMonitorListener(metrics), clock);

        logger.info("🤖 Tracker bot assembled for {} with {} recipient(s)",
            gateway.name(), dispatcher.recipients().size());
    }

    private static List<NotificationChannel> channelsFor(TrackerConfig config) {
        var httpClient = HttpClient.newBuilder()
            .connectTimeout(config.requestTimeout())
            .build();
        var objectMapper = new ObjectMapper();

        var channels = new ArrayList<NotificationChannel>();
        if (config.discordEnabled()) {
            channels.add(new DiscordChannel(httpClient, objectMapper,
                config.discordApiUrl(), config.discordBotToken(), config.requestTimeout()));
        }
        if (config.telegramEnabled()) {
            channels.add(new TelegramChannel(httpClient, objectMapper,
                config.telegramApiUrl(), config.telegramBotToken(), config.requestTimeout()));
        }
        return channels;
    }

    /**
     * Announce startup, then monitor until a control intent arrives.
     */
    public ControlIntent run() {
        DispatchReport report = dispatcher.announceStartup(
            new StartupNotice(gateway.name(), config.enabledPlatforms(), clock.instant()));
        logger.info("✅ Startup notice delivered to {}/{} recipient(s)",
            report.delivered(), report.results().size());
        return monitor.run();
    }

    public StatusSnapshot status() {
        return monitor.status();
    }

    @Override
    public void close() {
        dispatcher.close();
        logger.info("Tracker bot resources released");
    }
}
