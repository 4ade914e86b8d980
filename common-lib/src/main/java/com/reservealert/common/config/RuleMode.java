package com.reservealert.common.config;

/**
 * Named rule-set revisions supported by the decision engine.
 *
 * <p>Both modes share normalization, delta tracking, persistence tracking and row emission.
 * They differ only in how the floor rule asserts and in which timers exist.
 *
 * <ul>
 *   <li>{@link #STREAK_DUAL_HOLD}: floor asserts {@code ON*} every floor step and force-clears
 *                                         all streak and hold state. Critical and caution
 *                                         persistence arm holds of different lengths.</li>
 *   <li>{@link #FLOOR_WINDOW_REMINDER}: floor arms a multi-minute {@code ON*} window. When the window
 *                                         expires while reserve is still inside the critical band, a
 *                                         reminder cooldown counts down and re-arms the window.</li>
 * </ul>
 */
public enum RuleMode {
    STREAK_DUAL_HOLD,
    FLOOR_WINDOW_REMINDER
}
