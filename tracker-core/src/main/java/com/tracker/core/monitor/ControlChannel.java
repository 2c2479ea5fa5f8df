package com.tracker.core.monitor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single-slot handoff from control surfaces (console, shutdown hook) to the monitoring loop.
 *
 * <p>The first intent placed wins until the loop consumes it, with one exception: a stop
 * replaces a pending restart. A stop request therefore always lands.
 * The loop sleeps by waiting on this channel, so a request wakes it immediately.
 */
public final class ControlChannel {
    private static final Logger logger = LoggerFactory.getLogger(ControlChannel.class);

    private final BlockingQueue<ControlIntent> slot = new ArrayBlockingQueue<>(1);

    /**
     * Producers are serialized; the loop only ever removes from the slot.
     *
     * @return false if the request was ignored because another intent is pending
     */
    public synchronized boolean request(ControlIntent intent) {
        if (slot.offer(intent)) {
            logger.info("{} requested", intent);
            return true;
        }
        ControlIntent pending = slot.peek();
        if (intent == ControlIntent.STOP && pending != ControlIntent.STOP) {
            slot.clear();
            slot.offer(ControlIntent.STOP);
            logger.info("STOP requested - replaces pending {}", pending);
            return true;
        }
        logger.info("{} ignored - {} already pending", intent, pending);
        return false;
    }

    public boolean requestStop() {
        return request(ControlIntent.STOP);
    }

    public boolean requestRestart() {
        return request(ControlIntent.RESTART);
    }

    public boolean isPending() {
        return slot.peek() != null;
    }

    /**
     * Consume the pending intent, if any, without waiting.
     */
    public Optional<ControlIntent> poll() {
        return Optional.ofNullable(slot.poll());
    }

    /**
     * Wait up to {@code timeout} for an intent and consume it.
     */
    public Optional<ControlIntent> awaitIntent(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(slot.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
    }
}
