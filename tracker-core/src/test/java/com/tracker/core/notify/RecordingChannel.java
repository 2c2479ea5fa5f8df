package com.tracker.core.notify;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory channel that records deliveries and can be told to reject some destinations.
 */
public final class RecordingChannel implements NotificationChannel {

    public record Sent(Recipient recipient, String text) {
    }

    private final Platform platform;
    private final List<Sent> sent = new CopyOnWriteArrayList<>();
    private final Set<String> rejected = ConcurrentHashMap.newKeySet();

    public RecordingChannel(Platform platform) {
        this.platform = platform;
    }

    public void reject(String destinationId) {
        rejected.add(destinationId);
    }

    public List<Sent> sent() {
        return sent;
    }

    @Override
    public Platform platform() {
        return platform;
    }

    @Override
    public void deliver(Recipient recipient, String text) throws DeliveryException {
        if (rejected.contains(recipient.destinationId())) {
            throw new DeliveryException("chat not found: " + recipient.destinationId());
        }
        sent.add(new Sent(recipient, text));
    }
}
