package com.tracker.core.notify;

/**
 * Transport for one messaging platform.
 * Implementations must be safe to call from several dispatch workers at once.
 */
public interface NotificationChannel {

    Platform platform();

    /**
     * Deliver already formatted text to one recipient. Blocks until the platform answers
     * or the transport timeout elapses.
     */
    void deliver(Recipient recipient, String text) throws DeliveryException;
}
