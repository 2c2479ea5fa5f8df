package com.tracker.core.notify;

import java.util.Optional;

/**
 * One configured destination on one platform.
 *
 * @param destinationId Discord channel id or Telegram chat id
 * @param displayName   human readable name used in logs
 * @param roleOrTag     Discord role id to mention, or Telegram tag text; may be null
 */
public record Recipient(Platform platform, String destinationId, String displayName, String roleOrTag) {

    public Recipient {
        if (platform == null) {
            throw new IllegalArgumentException("Platform is required");
        }
        if (destinationId == null || destinationId.isBlank()) {
            throw new IllegalArgumentException("Destination id is required for " + platform);
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = destinationId;
        }
        if (roleOrTag != null && roleOrTag.isBlank()) {
            roleOrTag = null;
        }
    }

    public Optional<String> tag() {
        return Optional.ofNullable(roleOrTag);
    }

    @Override
    public String toString() {
        return platform.displayName() + "/" + displayName;
    }
}
