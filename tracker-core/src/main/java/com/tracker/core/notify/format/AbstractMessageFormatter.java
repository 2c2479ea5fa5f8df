package com.tracker.core.notify.format;

import com.tracker.core.event.PositionEvent;
import com.tracker.core.model.Position;
import com.tracker.core.model.PositionSide;
import com.tracker.core.notify.Recipient;
import com.tracker.core.notify.StartupNotice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/**
 * Shared labels, emoji and number formatting for the platform formatters.
 * Subclasses only decide markup.
 */
public abstract class AbstractMessageFormatter implements NotificationFormatter {
    private static final Logger logger = LoggerFactory.getLogger(AbstractMessageFormatter.class);

    static final String FALLBACK_PREFIX = "❌ Error formatting trade data for ";

    private final DateTimeFormatter clockFormat;

    protected AbstractMessageFormatter(ZoneId zone) {
        this.clockFormat = DateTimeFormatter.ofPattern("HH:mm:ss").withZone(zone);
    }

    @Override
    public final String format(PositionEvent event, Recipient recipient) {
        try {
            return switch (event.kind()) {
                case OPENED -> renderOpened((PositionEvent.Opened) event, recipient);
                case RESIZED -> renderResized((PositionEvent.Resized) event, recipient);
                case CLOSED -> renderClosed((PositionEvent.Closed) event, recipient);
            };
        } catch (RuntimeException e) {
            logger.error("Error formatting {} message for {}: {}", platform(), symbolOf(event), e.toString());
            return FALLBACK_PREFIX + symbolOf(event);
        }
    }

    @Override
    public final String formatStartup(StartupNotice notice, Recipient recipient) {
        try {
            return renderStartup(notice, recipient);
        } catch (RuntimeException e) {
            logger.error("Error formatting {} startup message: {}", platform(), e.toString());
            return "🤖 Position tracker online";
        }
    }

    protected abstract String renderOpened(PositionEvent.Opened event, Recipient recipient);

    protected abstract String renderResized(PositionEvent.Resized event, Recipient recipient);

    protected abstract String renderClosed(PositionEvent.Closed event, Recipient recipient);

    protected abstract String renderStartup(StartupNotice notice, Recipient recipient);

    // --- Labels ---

    protected static String tradeLabel(PositionEvent event) {
        if (event instanceof PositionEvent.Opened opened) {
            return opened.alreadyOpenAtStartup() ? "EXISTING POSITION" : "NEW POSITION";
        }
        if (event instanceof PositionEvent.Resized resized) {
            return switch (resized.direction()) {
                case INCREASED -> "POSITION INCREASED (DCA)";
                case REDUCED -> "POSITION REDUCED";
                case UNCHANGED_BUT_CHANGED -> "POSITION UPDATED";
            };
        }
        return "POSITION CLOSED";
    }

    protected static String headerEmoji(PositionEvent event) {
        if (event instanceof PositionEvent.Opened opened) {
            return opened.alreadyOpenAtStartup() ? "📋" : "🚀";
        }
        if (event instanceof PositionEvent.Resized resized) {
            return switch (resized.direction()) {
                case INCREASED -> "📈";
                case REDUCED -> "📉";
                case UNCHANGED_BUT_CHANGED -> "📋";
            };
        }
        return "🔒";
    }

    protected static String accentEmoji(PositionEvent event) {
        if (event instanceof PositionEvent.Opened) {
            return event.position().side() == PositionSide.LONG ? "🟢" : "🔴";
        }
        if (event instanceof PositionEvent.Resized resized) {
            return switch (resized.direction()) {
                case INCREASED -> "🔵";
                case REDUCED -> "🟡";
                case UNCHANGED_BUT_CHANGED -> "⚪";
            };
        }
        return "⚪";
    }

    protected static String pnlEmoji(double pnlPercent) {
        if (pnlPercent > 0) return "🟢";
        if (pnlPercent < 0) return "🔴";
        return "🟡";
    }

    protected static String resultEmoji(double pnlPercent) {
        if (pnlPercent > 0) return "🎉";
        if (pnlPercent < 0) return "💔";
        return "😐";
    }

    // --- Numbers and time ---

    protected static String price(double value) {
        return String.format(Locale.US, "$%.4f", value);
    }

    protected static String percent(double value) {
        return String.format(Locale.US, "%+.2f%%", value);
    }

    protected static String leverage(Position position) {
        return plain(position.leverage()) + "x";
    }

    protected static String plain(double value) {
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    protected String clock(Instant instant) {
        return clockFormat.format(instant);
    }

    private static String symbolOf(PositionEvent event) {
        if (event == null || event.position() == null) {
            return "UNKNOWN";
        }
        return event.position().symbol();
    }
}
