package com.beamcut.engine;

public enum StopReason {
    MAX_GENERATIONS,
    STALLED,
    LOWER_BOUND_REACHED,
    CANCELLED,
    TIME_LIMIT;

    /** Stopped from outside rather than by the search itself. */
    public boolean isEarlyTermination() {
        return this == CANCELLED || this == TIME_LIMIT;
    }
}
