package com.reservealert.common.reserve;

/**
 * Fixed numeric tolerance used at every threshold comparison in the engine.
 *
 * <p>Reserve thresholds are usually derived from raw reference samples, so a series sitting exactly
 * on a boundary must compare identically on every code path. All comparisons go through this class;
 * the tolerance is not configurable per call.
 */
public final class Tolerance {

    /** Absolute tolerance applied to every reserve / delta comparison. */
    public static final double EPSILON = 1e-9;

    private Tolerance() {}

    /** {@code value <= bound} within tolerance. */
    public static boolean atOrBelow(double value, double bound) {
        return value <= bound + EPSILON;
    }

    /** {@code value >= bound} within tolerance. */
    public static boolean atOrAbove(double value, double bound) {
        return value >= bound - EPSILON;
    }

    /** {@code value > bound} by more than the tolerance. */
    public static boolean exceeds(double value, double bound) {
        return value > bound + EPSILON;
    }

    /** {@code value == 0} within tolerance. */
    public static boolean isZero(double value) {
        return Math.abs(value) <= EPSILON;
    }
}
