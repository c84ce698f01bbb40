package com.beamcut.domain;

public final class Lengths {

    private Lengths() {
    }

    /** Whole lengths print without a fraction: 50 rather than 50.0. */
    public static String format(double length) {
        if (length == Math.rint(length) && Math.abs(length) < 1e15) {
            return Long.toString((long) length);
        }
        return Double.toString(length);
    }
}
