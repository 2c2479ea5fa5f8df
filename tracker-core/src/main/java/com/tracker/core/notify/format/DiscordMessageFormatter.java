package com.tracker.core.notify.format;

import com.tracker.core.event.PositionEvent;
import com.tracker.core.model.Position;
import com.tracker.core.model.PriceQuote;
import com.tracker.core.notify.Platform;
import com.tracker.core.notify.Recipient;
import com.tracker.core.notify.StartupNotice;

import java.time.ZoneId;

/**
 * Discord markdown. A recipient's role id becomes a {@code <@&role>} mention on the first line.
 */
public final class DiscordMessageFormatter extends AbstractMessageFormatter {

    public DiscordMessageFormatter(ZoneId zone) {
        super(zone);
    }

    @Override
    public Platform platform() {
        return Platform.DISCORD;
    }

    @Override
    protected String renderOpened(PositionEvent.Opened event, Recipient recipient) {
        return tradeBody(event, recipient, null);
    }

    @Override
    protected String renderResized(PositionEvent.Resized event, Recipient recipient) {
        String sizeLine = "**📦 Size:** `" + plain(event.previousPosition().absoluteSize())
            + " → " + plain(event.position().absoluteSize()) + "`\n";
        return tradeBody(event, recipient, sizeLine);
    }

    private String tradeBody(PositionEvent event, Recipient recipient, String extraLine) {
        Position position = event.position();
        var sb = new StringBuilder();
        mention(sb, recipient);
        sb.append("## ").append(headerEmoji(event)).append(" **").append(tradeLabel(event)).append("**\n\n");
        sb.append(accentEmoji(event)).append(" **").append(position.symbol()).append("** • **")
            .append(position.side()).append("** (").append(leverage(position)).append(")\n\n");
        sb.append("**💰 Entry Price:** `").append(price(position.entryPrice())).append("`\n");
        sb.append("**📈 Current Price:** ").append(currentPrice(event.referencePrice())).append("\n");
        if (extraLine != null) {
            sb.append(extraLine);
        }
        sb.append("**").append(pnlEmoji(event.pnlPercent())).append(" PnL:** `")
            .append(percent(event.pnlPercent())).append("`");
        if (!event.referencePrice().isAvailable()) {
            sb.append(" *(price unavailable)*");
        }
        sb.append("\n\n");
        sb.append("⏰ ").append(clock(event.detectedAt()));
        return sb.toString();
    }

    @Override
    protected String renderClosed(PositionEvent.Closed event, Recipient recipient) {
        double pnl = event.pnlPercent();
        var sb = new StringBuilder();
        mention(sb, recipient);
        sb.append("## 🔒 **POSITION CLOSED** ").append(resultEmoji(pnl)).append("\n\n");
        sb.append(pnlEmoji(pnl)).append(" **").append(event.symbol()).append("** • **")
            .append(event.position().side()).append("** (").append(leverage(event.position())).append(")")
            .append(" • Final Result: **").append(percent(pnl)).append("**\n\n");
        sb.append("**📊 Performance Summary:**\n");
        sb.append("• **Entry Price:** `").append(price(event.position().entryPrice())).append("`\n");
        sb.append("• **Exit Price:** ").append(currentPrice(event.referencePrice())).append("\n");
        sb.append("• **Max Profit:** `").append(percent(event.maxProfitPct())).append("`\n");
        sb.append("• **Max Drawdown:** `").append(percent(event.maxDrawdownPct())).append("`\n");
        sb.append("• **Duration:** `").append(DurationFormat.format(event.duration())).append("`\n\n");
        sb.append("⏰ Closed at ").append(clock(event.detectedAt()));
        if (event.startedUnknown()) {
            sb.append("\n⚠️ *Position opened while the bot was offline*");
        }
        return sb.toString();
    }

    @Override
    protected String renderStartup(StartupNotice notice, Recipient recipient) {
        var sb = new StringBuilder();
        sb.append("## 🤖 **POSITION TRACKER ONLINE**\n\n");
        sb.append("✅ **Connected & Ready**\n\n");
        sb.append("• **Exchange:** ").append(notice.exchangeName()).append("\n");
        for (Platform platform : Platform.values()) {
            if (notice.platforms().contains(platform)) {
                sb.append("• **").append(platform.displayName()).append(":** Notifications active\n");
            }
        }
        sb.append("• **Status:** Monitoring positions\n");
        sb.append("• **Started:** ").append(clock(notice.startedAt())).append("\n\n");
        sb.append("🚀 **Ready to track your trades!**");
        return sb.toString();
    }

    private static void mention(StringBuilder sb, Recipient recipient) {
        recipient.tag().ifPresent(role -> sb.append("<@&").append(role).append(">\n\n"));
    }

    private static String currentPrice(PriceQuote quote) {
        if (!quote.isAvailable()) {
            return "`n/a`";
        }
        String text = "`" + price(quote.price()) + "`";
        return switch (quote.origin()) {
            case MARK -> text + " *(mark)*";
            case LAST_KNOWN -> text + " *(last known)*";
            default -> text;
        };
    }
}
