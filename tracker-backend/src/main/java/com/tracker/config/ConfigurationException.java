package com.tracker.config;

/**
 * Missing or invalid configuration detected at startup. Fatal: the application exits
 * instead of retrying.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
