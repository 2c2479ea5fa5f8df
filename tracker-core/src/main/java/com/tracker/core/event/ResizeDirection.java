package com.tracker.core.event;

/**
 * How a still-open position changed between two polls.
 */
public enum ResizeDirection {
    INCREASED,
    REDUCED,
    /** Size magnitude unchanged but another field (entry, mark, leverage, side) moved. */
    UNCHANGED_BUT_CHANGED;

    public static ResizeDirection classify(double oldSize, double newSize) {
        double oldMagnitude = Math.abs(oldSize);
        double newMagnitude = Math.abs(newSize);
        if (newMagnitude > oldMagnitude) {
            return INCREASED;
        }
        if (newMagnitude < oldMagnitude) {
            return REDUCED;
        }
        return UNCHANGED_BUT_CHANGED;
    }
}
