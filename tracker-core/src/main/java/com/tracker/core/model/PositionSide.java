package com.tracker.core.model;

/**
 * Direction of a derivative exposure.
 */
public enum PositionSide {
    LONG,
    SHORT
}
