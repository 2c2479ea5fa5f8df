package com.tracker.core.exchange;

/**
 * Position or price retrieval from the venue failed.
 */
public class FetchException extends Exception {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
