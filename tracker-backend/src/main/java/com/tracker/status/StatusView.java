package com.tracker.status;

import com.tracker.core.monitor.StatusSnapshot;
import com.tracker.core.notify.Recipient;

import java.time.Instant;
import java.util.List;
import java.util.TreeSet;

/**
 * JSON shape of {@code /api/status}.
 */
public record StatusView(
    String state,
    List<String> activeSymbols,
    long intervalSeconds,
    long cyclesCompleted,
    Instant lastCycleAt,
    boolean baselineEstablished,
    List<RecipientView> recipients
) {

    public record RecipientView(String platform, String name) {
    }

    public static StatusView from(StatusSnapshot status) {
        return new StatusView(
            status.state().name(),
            List.copyOf(new TreeSet<>(status.activeSymbols())),
            status.interval().toSeconds(),
            status.cyclesCompleted(),
            status.lastCycleAt(),
            status.baselineEstablished(),
            status.recipients().stream()
                .map(StatusView::view)
                .toList()
        );
    }

    private static RecipientView view(Recipient recipient) {
        return new RecipientView(recipient.platform().displayName(), recipient.displayName());
    }
}
