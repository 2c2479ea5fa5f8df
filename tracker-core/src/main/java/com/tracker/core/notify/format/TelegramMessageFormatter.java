package com.tracker.core.notify.format;

import com.tracker.core.event.PositionEvent;
import com.tracker.core.model.Position;
import com.tracker.core.model.PriceQuote;
import com.tracker.core.notify.Platform;
import com.tracker.core.notify.Recipient;
import com.tracker.core.notify.StartupNotice;

import java.time.ZoneId;

/**
 * Telegram HTML ({@code parse_mode=HTML}). A recipient's tag is printed as-is on the first line.
 */
public final class TelegramMessageFormatter extends AbstractMessageFormatter {

    public TelegramMessageFormatter(ZoneId zone) {
        super(zone);
    }

    @Override
    public Platform platform() {
        return Platform.TELEGRAM;
    }

    @Override
    protected String renderOpened(PositionEvent.Opened event, Recipient recipient) {
        return tradeBody(event, recipient, null);
    }

    @Override
    protected String renderResized(PositionEvent.Resized event, Recipient recipient) {
        String sizeLine = "📦 Size: <code>" + plain(event.previousPosition().absoluteSize())
            + " → " + plain(event.position().absoluteSize()) + "</code>\n";
        return tradeBody(event, recipient, sizeLine);
    }

    private String tradeBody(PositionEvent event, Recipient recipient, String extraLine) {
        Position position = event.position();
        var sb = new StringBuilder();
        tag(sb, recipient);
        sb.append(headerEmoji(event)).append(" <b>").append(tradeLabel(event)).append("</b>\n\n");
        sb.append("<b>").append(escape(position.symbol())).append("</b> • <b>")
            .append(position.side()).append("</b> (").append(leverage(position)).append(")\n\n");
        sb.append("💰 Entry: <code>").append(price(position.entryPrice())).append("</code>\n");
        sb.append("📈 Current: ").append(currentPrice(event.referencePrice())).append("\n");
        if (extraLine != null) {
            sb.append(extraLine);
        }
        sb.append(pnlEmoji(event.pnlPercent())).append(" PnL: <code>").append(percent(event.pnlPercent())).append("</code>");
        if (!event.referencePrice().isAvailable()) {
            sb.append(" <i>(price unavailable)</i>");
        }
        sb.append("\n\n");
        sb.append("⏰ ").append(clock(event.detectedAt()));
        return sb.toString();
    }

    @Override
    protected String renderClosed(PositionEvent.Closed event, Recipient recipient) {
        double pnl = event.pnlPercent();
        var sb = new StringBuilder();
        tag(sb, recipient);
        sb.append("🔒 <b>POSITION CLOSED</b> ").append(resultEmoji(pnl)).append("\n\n");
        sb.append(pnlEmoji(pnl)).append(" <b>").append(escape(event.symbol())).append("</b> • <b>")
            .append(event.position().side()).append("</b> (").append(leverage(event.position())).append(")")
            .append(" • Final: <b>").append(percent(pnl)).append("</b>\n\n");
        sb.append("📊 <b>Performance:</b>\n");
        sb.append("• Entry: <code>").append(price(event.position().entryPrice())).append("</code>\n");
        sb.append("• Exit: ").append(currentPrice(event.referencePrice())).append("\n");
        sb.append("• Max Profit: <code>").append(percent(event.maxProfitPct())).append("</code>\n");
        sb.append("• Max Drawdown: <code>").append(percent(event.maxDrawdownPct())).append("</code>\n");
        sb.append("• Duration: <code>").append(DurationFormat.format(event.duration())).append("</code>\n\n");
        sb.append("⏰ Closed at ").append(clock(event.detectedAt()));
        if (event.startedUnknown()) {
            sb.append("\n⚠️ <i>Position opened while the bot was offline</i>");
        }
        return sb.toString();
    }

    @Override
    protected String renderStartup(StartupNotice notice, Recipient recipient) {
        var sb = new StringBuilder();
        sb.append("🤖 <b>POSITION TRACKER ONLINE</b>\n\n");
        sb.append("✅ <b>Connected &amp; Ready</b>\n\n");
        sb.append("• <b>Exchange:</b> ").append(escape(notice.exchangeName())).append("\n");
        for (Platform platform : Platform.values()) {
            if (notice.platforms().contains(platform)) {
                sb.append("• <b>").append(platform.displayName()).append(":</b> Notifications active\n");
            }
        }
        sb.append("• <b>Status:</b> Monitoring positions\n");
        sb.append("• <b>Started:</b> ").append(clock(notice.startedAt())).append("\n\n");
        sb.append("🚀 <b>Ready to track your trades!</b>");
        return sb.toString();
    }

    private static void tag(StringBuilder sb, Recipient recipient) {
        recipient.tag().ifPresent(tag -> sb.append(escape(tag)).append("\n\n"));
    }

    private static String currentPrice(PriceQuote quote) {
        if (!quote.isAvailable()) {
            return "<code>n/a</code>";
        }
        String text = "<code>" + price(quote.price()) + "</code>";
        return switch (quote.origin()) {
            case MARK -> text + " <i>(mark)</i>";
            case LAST_KNOWN -> text + " <i>(last known)</i>";
            default -> text;
        };
    }

    static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }
}
