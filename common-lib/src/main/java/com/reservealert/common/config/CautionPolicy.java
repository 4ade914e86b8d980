package com.reservealert.common.config;

/**
 * Controls when the caution-persistence rule is allowed to fire.
 *
 * <ul>
 *   <li>{@link #OUTSIDE_CRITICAL_BAND}: fires on the exact hit only when the step is not inside the
 *                                         critical band (default).</li>
 *   <li>{@link #ALWAYS}: fires on the exact hit regardless of the critical band.</li>
 *   <li>{@link #DISABLED}: the caution rule never fires and caution counting is not
 *                                         annotated.</li>
 * </ul>
 */
public enum CautionPolicy {
    OUTSIDE_CRITICAL_BAND,
    ALWAYS,
    DISABLED
}
