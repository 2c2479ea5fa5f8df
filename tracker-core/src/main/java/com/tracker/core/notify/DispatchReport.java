package com.tracker.core.notify;

import java.util.List;

/**
 * Per-recipient results of one fan-out.
 */
public record DispatchReport(List<DeliveryResult> results) {

    private static final DispatchReport EMPTY = new DispatchReport(List.of());

    public DispatchReport {
        results = List.copyOf(results);
    }

    public static DispatchReport empty() {
        return EMPTY;
    }

    public long delivered() {
        return results.stream().filter(DeliveryResult::delivered).count();
    }

    public List<DeliveryResult> failures() {
        return results.stream().filter(r -> !r.delivered()).toList();
    }

    public boolean allDelivered() {
        return results.stream().allMatch(DeliveryResult::delivered);
    }
}
