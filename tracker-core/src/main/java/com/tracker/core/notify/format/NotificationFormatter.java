package com.tracker.core.notify.format;

import com.tracker.core.event.PositionEvent;
import com.tracker.core.notify.Platform;
import com.tracker.core.notify.Recipient;
import com.tracker.core.notify.StartupNotice;

/**
 * Renders events as platform-specific message text.
 *
 * <p>Implementations never throw: a rendering failure degrades to a minimal fallback line
 * naming the symbol. The recipient only affects presentation (mentions, tags), never the
 * figures in the message.
 */
public interface NotificationFormatter {

    Platform platform();

    String format(PositionEvent event, Recipient recipient);

    String formatStartup(StartupNotice notice, Recipient recipient);
}
