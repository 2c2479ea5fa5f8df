package com.tracker.core.notify.format;

import com.tracker.core.event.PositionEvent;
import com.tracker.core.model.PriceQuote;
import com.tracker.core.notify.Platform;
import com.tracker.core.notify.Recipient;
import com.tracker.core.notify.StartupNotice;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneOffset;
import java.util.Set;

import static com.tracker.core.notify.format.FormatterFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("DiscordMessageFormatter Tests")
class DiscordMessageFormatterTest {

    private final DiscordMessageFormatter formatter = new DiscordMessageFormatter(ZoneOffset.UTC);
    private final Recipient trading = new Recipient(Platform.DISCORD, "111", "Trading", "999");
    private final Recipient plain = new Recipient(Platform.DISCORD, "222", "Plain", null);

    @Nested
    @DisplayName("Trade messages")
    class TradeMessageTests {

        @Test
        @DisplayName("New position mentions the role and carries all figures")
        void testOpened() {
            String text = formatter.format(opened(), trading);

            assertThat(text).startsWith("<@&999>\n\n## 🚀 **NEW POSITION**");
            assertThat(text)
                .contains("🟢 **BTC_USDT** • **LONG** (5x)")
                .contains("**💰 Entry Price:** `$100.0000`")
                .contains("**📈 Current Price:** `$110.0000`")
                .contains("**🟢 PnL:** `+50.00%`")
                .endsWith("⏰ 12:00:00");
        }

        @Test
        @DisplayName("No role means no mention line")
        void testNoRole() {
            assertThat(formatter.format(opened(), plain)).startsWith("## 🚀 **NEW POSITION**");
        }

        @Test
        @DisplayName("Increase is labelled as DCA with the size change")
        void testIncreased() {
            String text = formatter.format(increased(), plain);

            assertThat(text)
                .contains("## 📈 **POSITION INCREASED (DCA)**")
                .contains("🔵 **BTC_USDT**")
                .contains("**📦 Size:** `1 → 2`");
        }

        @Test
        @DisplayName("Existing position found at startup has its own label")
        void testExisting() {
            var event = new PositionEvent.Opened(BTC, PriceQuote.live(110), 50.0, NOON, true);

            assertThat(formatter.format(event, plain)).contains("**EXISTING POSITION**");
        }

        @Test
        @DisplayName("Unavailable price is called out")
        void testUnavailablePrice() {
            var event = new PositionEvent.Opened(BTC, PriceQuote.unavailable(), 0.0, NOON, false);

            assertThat(formatter.format(event, plain))
                .contains("**📈 Current Price:** `n/a`")
                .contains("**🟡 PnL:** `+0.00%` *(price unavailable)*");
        }
    }

    @Nested
    @DisplayName("Close messages")
    class CloseMessageTests {

        @Test
        @DisplayName("Close summary with extremes and duration")
        void testClosed() {
            String text = formatter.format(closed(false), trading);

            assertThat(text)
                .startsWith("<@&999>\n\n## 🔒 **POSITION CLOSED** 💔")
                .contains("Final Result: **-12.50%**")
                .contains("• **Max Profit:** `+50.00%`")
                .contains("• **Max Drawdown:** `-20.00%`")
                .contains("• **Duration:** `12m 5s`")
                .contains("⏰ Closed at 12:00:00")
                .doesNotContain("offline");
        }

        @Test
        @DisplayName("Offline annotation when the opening was not observed")
        void testStartedUnknown() {
            String text = formatter.format(closed(true), plain);

            assertThat(text)
                .contains("• **Duration:** `0s`")
                .endsWith("⚠️ *Position opened while the bot was offline*");
        }
    }

    @Test
    @DisplayName("Exit price from the last live reading is labelled")
    void testLastKnownExit() {
        var event = new PositionEvent.Closed(BTC, PriceQuote.lastKnown(97.5), -12.5, Duration.ZERO,
            50.0, -20.0, false, NOON);

        assertThat(formatter.format(event, plain))
            .contains("• **Exit Price:** `$97.5000` *(last known)*");
    }

    @Test
    @DisplayName("Recipients only differ in presentation")
    void testSameFiguresForAllRecipients() {
        String withRole = formatter.format(closed(false), trading);
        String withoutRole = formatter.format(closed(false), plain);

        assertThat(withRole).isEqualTo("<@&999>\n\n" + withoutRole);
    }

    @Test
    @DisplayName("Broken event degrades to the fallback line")
    void testFallback() {
        var broken = new PositionEvent.Resized(BTC, null, null, PriceQuote.live(110), 50.0, NOON);

        assertThat(formatter.format(broken, plain)).isEqualTo("❌ Error formatting trade data for BTC_USDT");
        assertThat(formatter.format(null, plain)).isEqualTo("❌ Error formatting trade data for UNKNOWN");
    }

    @Test
    @DisplayName("Startup announcement lists exchange and active platforms")
    void testStartup() {
        var notice = new StartupNotice("MEXC", Set.of(Platform.DISCORD, Platform.TELEGRAM), NOON);

        assertThat(formatter.formatStartup(notice, trading))
            .startsWith("## 🤖 **POSITION TRACKER ONLINE**")
            .contains("• **Exchange:** MEXC")
            .contains("• **Discord:** Notifications active")
            .contains("• **Telegram:** Notifications active")
            .contains("• **Started:** 12:00:00");
    }
}
