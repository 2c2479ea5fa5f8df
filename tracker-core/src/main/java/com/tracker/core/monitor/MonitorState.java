package com.tracker.core.monitor;

public enum MonitorState {
    RUNNING,
    STOPPING,
    STOPPED
}
