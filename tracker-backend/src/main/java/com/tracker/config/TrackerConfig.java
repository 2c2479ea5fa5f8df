package com.tracker.config;

import com.tracker.core.notify.Platform;
import com.tracker.core.notify.Recipient;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Position tracker configuration.
 *
 * <p>Loaded from {@code config.properties} (working directory first, then classpath).
 * An environment variable with the same name as a key overrides the file value.
 * Malformed numbers fall back to their default with a warning; missing credentials or an
 * enabled platform without a token raise {@link ConfigurationException}.
 */
public final class TrackerConfig {
    private static final Logger logger = LoggerFactory.getLogger(TrackerConfig.class);
    private static final String CONFIG_FILE = "config.properties";
    private static final int MAX_RECIPIENTS_PER_PLATFORM = 50;

    private static final AtomicReference<TrackerConfig> instanceRef = new AtomicReference<>();

    private final Properties properties;
    private final Map<String, String> environment;

    @NotBlank(message = "EXCHANGE_NAME must not be blank")
    private final String exchangeName;

    @NotBlank(message = "MEXC_API_KEY is required")
    private final String apiKey;

    @NotBlank(message = "MEXC_SECRET_KEY is required")
    private final String secretKey;

    @NotBlank(message = "MEXC_BASE_URL is required")
    @Pattern(regexp = "^https://.*", message = "MEXC_BASE_URL must use HTTPS")
    private final String baseUrl;

    @Min(value = 1, message = "MONITORING_INTERVAL_SECONDS must be at least 1")
    private final long monitoringIntervalSeconds;

    @Min(value = 3, message = "ERROR_BACKOFF_MULTIPLIER must be at least 3")
    private final long errorBackoffMultiplier;

    @Min(value = 0, message = "RESTART_DELAY_SECONDS must not be negative")
    private final long restartDelaySeconds;

    @Min(value = 1, message = "REQUEST_TIMEOUT_SECONDS must be at least 1")
    @Max(value = 60, message = "REQUEST_TIMEOUT_SECONDS must be at most 60")
    private final long requestTimeoutSeconds;

    @Min(value = 1, message = "DISPATCH_PARALLELISM must be at least 1")
    @Max(value = 32, message = "DISPATCH_PARALLELISM must be at most 32")
    private final long dispatchParallelism;

    private final boolean announceExistingPositions;
    private final ZoneId displayZone;

    private final boolean discordEnabled;
    private final String discordBotToken;
    @Pattern(regexp = "^https?://.*", message = "DISCORD_API_URL must be an http(s) URL")
    private final String discordApiUrl;

    private final boolean telegramEnabled;
    private final String telegramBotToken;
    @Pattern(regexp = "^https?://.*", message = "TELEGRAM_API_URL must be an http(s) URL")
    private final String telegramApiUrl;

    private final List<Recipient> recipients;

    private final boolean statusServerEnabled;
    @Min(value = 1, message = "STATUS_SERVER_PORT must be between 1 and 65535")
    @Max(value = 65535, message = "STATUS_SERVER_PORT must be between 1 and 65535")
    private final long statusServerPort;

    private TrackerConfig(Properties properties, Map<String, String> environment) {
        this.properties = properties;
        this.environment = environment;

        this.exchangeName = value("EXCHANGE_NAME", "MEXC");
        this.apiKey = value("MEXC_API_KEY", null);
        this.secretKey = value("MEXC_SECRET_KEY", null);
        this.baseUrl = value("MEXC_BASE_URL", "https://contract.mexc.com");

        this.monitoringIntervalSeconds = parseLong("MONITORING_INTERVAL_SECONDS", 10);
        this.errorBackoffMultiplier = parseLong("ERROR_BACKOFF_MULTIPLIER", 3);
        this.restartDelaySeconds = parseLong("RESTART_DELAY_SECONDS", 2);
        this.requestTimeoutSeconds = parseLong("REQUEST_TIMEOUT_SECONDS", 15);
        this.dispatchParallelism = parseLong("DISPATCH_PARALLELISM", 4);
        this.announceExistingPositions = parseBoolean("ANNOUNCE_EXISTING_POSITIONS", true);
        this.displayZone = parseZone("DISPLAY_ZONE");

        this.discordEnabled = parseBoolean("DISCORD_ENABLED", false);
        this.discordBotToken = value("DISCORD_BOT_TOKEN", null);
        this.discordApiUrl = value("DISCORD_API_URL", "https://discord.com/api/v10");

        this.telegramEnabled = parseBoolean("TELEGRAM_ENABLED", false);
        this.telegramBotToken = value("TELEGRAM_BOT_TOKEN", null);
        this.telegramApiUrl = value("TELEGRAM_API_URL", "https://api.telegram.org");

        this.recipients = loadRecipients();

        this.statusServerEnabled = parseBoolean("STATUS_SERVER_ENABLED", false);
        this.statusServerPort = parseLong("STATUS_SERVER_PORT", 8080);

        validate();
        logSummary();
    }

    // ========== Loading ==========

    /**
     * Get the shared instance, loading it on first use.
     */
    public static TrackerConfig getInstance() {
        return instanceRef.updateAndGet(existing -> existing != null ? existing : load());
    }

    /**
     * Load from config.properties with environment overrides.
     *
     * @throws ConfigurationException if required settings are missing or invalid
     */
    public static TrackerConfig load() {
        Properties props = new Properties();

        Path configPath = Path.of(CONFIG_FILE);
        if (Files.exists(configPath)) {
            try (InputStream is = Files.newInputStream(configPath)) {
                props.load(is);
                logger.info("Loaded config from: {}", configPath.toAbsolutePath());
                return new TrackerConfig(props, System.getenv());
            } catch (IOException e) {
                logger.warn("Failed to load config.properties from filesystem: {}", e.getMessage());
            }
        }

        try (InputStream is = TrackerConfig.class.getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded config from classpath");
                return new TrackerConfig(props, System.getenv());
            }
        } catch (IOException e) {
            logger.warn("Failed to load config.properties from classpath: {}", e.getMessage());
        }

        logger.warn("No config.properties found, relying on environment variables");
        return new TrackerConfig(props, System.getenv());
    }

    /**
     * Build an instance from explicit properties, ignoring the process environment.
     */
    public static TrackerConfig forTest(Properties testProps) {
        return new TrackerConfig(testProps, Map.of());
    }

    public static TrackerConfig forTest(Properties testProps, Map<String, String> environment) {
        return new TrackerConfig(testProps, environment);
    }

    public static void reset() {
        instanceRef.set(null);
    }

    // ========== Parsing ==========

    private String value(String key, String defaultValue) {
        String env = environment.get(key);
        if (env != null && !env.isBlank()) {
            return env.trim();
        }
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return value.trim();
    }

    private long parseLong(String key, long defaultValue) {
        String value = value(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            logger.warn("Invalid {} value '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    private boolean parseBoolean(String key, boolean defaultValue) {
        String value = value(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value);
    }

    private ZoneId parseZone(String key) {
        String value = value(key, null);
        if (value == null) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(value);
        } catch (DateTimeException e) {
            logger.warn("Invalid {} value '{}', using system zone {}", key, value, ZoneId.systemDefault());
            return ZoneId.systemDefault();
        }
    }

    /**
     * DISCORD_SERVER_{n}_CHANNEL_ID / _NAME / _ROLE_ID and TELEGRAM_CHAT_{n}_ID / _NAME / _TAG,
     * numbered from 1. Gaps in the numbering are skipped. Only enabled platforms contribute.
     */
    private List<Recipient> loadRecipients() {
        var result = new ArrayList<Recipient>();
        if (discordEnabled) {
            for (int n = 1; n <= MAX_RECIPIENTS_PER_PLATFORM; n++) {
                String prefix = "DISCORD_SERVER_" + n;
                String channelId = value(prefix + "_CHANNEL_ID", null);
                if (channelId != null) {
                    result.add(new Recipient(Platform.DISCORD, channelId,
                        value(prefix + "_NAME", "Discord server " + n), value(prefix + "_ROLE_ID", null)));
                }
            }
        }
        if (telegramEnabled) {
            for (int n = 1; n <= MAX_RECIPIENTS_PER_PLATFORM; n++) {
                String prefix = "TELEGRAM_CHAT_" + n;
                String chatId = value(prefix + "_ID", null);
                if (chatId != null) {
                    result.add(new Recipient(Platform.TELEGRAM, chatId,
                        value(prefix + "_NAME", "Telegram chat " + n), value(prefix + "_TAG", null)));
                }
            }
        }
        return List.copyOf(result);
    }

    // ========== Validation ==========

    /**
     * Bean Validation plus the cross-field rules it cannot express.
     *
     * @throws ConfigurationException listing every violation
     */
    private void validate() {
        var errors = new ArrayList<String>();

        try (ValidatorFactory factory = Validation.buildDefaultValidatorFactory()) {
            Validator validator = factory.getValidator();
            for (ConstraintViolation<TrackerConfig> v : validator.validate(this)) {
                errors.add(v.getMessage());
            }
        }

        if (discordEnabled && isBlank(discordBotToken)) {
            errors.add("DISCORD_BOT_TOKEN is required when DISCORD_ENABLED=true");
        }
        if (telegramEnabled && isBlank(telegramBotToken)) {
            errors.add("TELEGRAM_BOT_TOKEN is required when TELEGRAM_ENABLED=true");
        }

        if (!errors.isEmpty()) {
            errors.sort(String::compareTo);
            throw new ConfigurationException("Configuration validation failed: " + String.join(", ", errors));
        }

        if (recipients.isEmpty()) {
            logger.warn("⚠️ No notification recipients configured - bot will not post messages");
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private void logSummary() {
        logger.info("📊 Tracker Configuration Loaded:");
        logger.info("   Exchange: {} ({})", exchangeName, baseUrl);
        logger.info("   Interval: {}s, Error back-off: {}x, Restart delay: {}s",
            monitoringIntervalSeconds, errorBackoffMultiplier, restartDelaySeconds);
        logger.info("   Discord: {}, Telegram: {}, Recipients: {}",
            discordEnabled ? "ENABLED" : "DISABLED", telegramEnabled ? "ENABLED" : "DISABLED", recipients.size());
        logger.info("   Status server: {}", statusServerEnabled ? "port " + statusServerPort : "DISABLED");
    }

    // ========== Getters ==========

    public String exchangeName() {
        return exchangeName;
    }

    public String apiKey() {
        return apiKey;
    }

    public String secretKey() {
        return secretKey;
    }

    public String baseUrl() {
        return baseUrl;
    }

    public Duration monitoringInterval() {
        return Duration.ofSeconds(monitoringIntervalSeconds);
    }

    public int errorBackoffMultiplier() {
        return (int) errorBackoffMultiplier;
    }

    public Duration restartDelay() {
        return Duration.ofSeconds(restartDelaySeconds);
    }

    public Duration requestTimeout() {
        return Duration.ofSeconds(requestTimeoutSeconds);
    }

    public int dispatchParallelism() {
        return (int) dispatchParallelism;
    }

    public boolean announceExistingPositions() {
        return announceExistingPositions;
    }

    public ZoneId displayZone() {
        return displayZone;
    }

    public boolean discordEnabled() {
        return discordEnabled;
    }

    public String discordBotToken() {
        return discordBotToken;
    }

    public String discordApiUrl() {
        return discordApiUrl;
    }

    public boolean telegramEnabled() {
        return telegramEnabled;
    }

    public String telegramBotToken() {
        return telegramBotToken;
    }

    public String telegramApiUrl() {
        return telegramApiUrl;
    }

    public Set<Platform> enabledPlatforms() {
        var platforms = EnumSet.noneOf(Platform.class);
        if (discordEnabled) platforms.add(Platform.DISCORD);
        if (telegramEnabled) platforms.add(Platform.TELEGRAM);
        return platforms;
    }

    public List<Recipient> recipients() {
        return recipients;
    }

    public boolean statusServerEnabled() {
        return statusServerEnabled;
    }

    public int statusServerPort() {
        return (int) statusServerPort;
    }
}
