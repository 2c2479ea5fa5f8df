package com.tracker.core.notify;

/**
 * Messaging platforms alerts can be delivered to.
 */
public enum Platform {
    DISCORD("Discord"),
    TELEGRAM("Telegram");

    private final String displayName;

    Platform(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
