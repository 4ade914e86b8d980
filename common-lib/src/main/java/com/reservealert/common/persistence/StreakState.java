package com.reservealert.common.persistence;

/**
 * Snapshot of the two streak counters after a step's update.
 * Each counter is the length of the current unbroken run of steps inside its band.
 */
public record StreakState(
    int critical,
    int caution
) {
    public static final StreakState EMPTY = new StreakState(0, 0);
}
