package com.tracker.core.monitor;

/**
 * Out-of-band requests handed to the monitoring loop.
 */
public enum ControlIntent {
    /** Leave the loop and shut the bot down. */
    STOP,
    /** Leave the loop, then rebuild the bot from the same configuration. */
    RESTART
}
