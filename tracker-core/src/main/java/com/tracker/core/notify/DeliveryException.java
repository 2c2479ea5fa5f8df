package com.tracker.core.notify;

/**
 * A single delivery to a single recipient failed.
 */
public class DeliveryException extends Exception {

    public DeliveryException(String message) {
        super(message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
