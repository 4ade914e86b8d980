package com.reservealert.common.reserve;

/**
 * Step-to-step change of reserve.
 *
 * <p>{@code delta} and {@code deterioration} are {@code null} on the first step of a series.
 * {@code deterioration} is never negative when present.
 */
public record DeltaMeasure(
    Double  delta,
    Double  deterioration,
    boolean flat
) {
    public static DeltaMeasure initial() {
        return new DeltaMeasure(null, null, false);
    }

    public boolean isInitial() {
        return delta == null;
    }
}
