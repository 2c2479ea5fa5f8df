package com.tracker.core.notify;

/**
 * Outcome of delivering one message to one recipient.
 */
public record DeliveryResult(Recipient recipient, boolean delivered, String error) {

    public static DeliveryResult success(Recipient recipient) {
        return new DeliveryResult(recipient, true, null);
    }

    public static DeliveryResult failure(Recipient recipient, String error) {
        return new DeliveryResult(recipient, false, error);
    }
}
