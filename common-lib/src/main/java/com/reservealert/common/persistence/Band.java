package com.reservealert.common.persistence;

import com.reservealert.common.config.RuleConfig;
import com.reservealert.common.reserve.Tolerance;

/**
 * Severity band of a reserve value. The critical band is nested inside the caution band.
 *
 * <pre>
 *   reserve ≤ criticalMax               → CRITICAL
 *   criticalMax &lt; reserve ≤ cautionMax → CAUTION
 *   reserve &gt; cautionMax               → CLEAR
 * </pre>
 */
public enum Band {
    CRITICAL,
    CAUTION,
    CLEAR;

    public static Band classify(double reserve, RuleConfig config) {
        if (Tolerance.atOrBelow(reserve, config.criticalMax())) return CRITICAL;
        if (Tolerance.atOrBelow(reserve, config.cautionMax()))  return CAUTION;
        return CLEAR;
    }

    /** True for both CRITICAL and CAUTION. */
    public boolean withinCaution() {
        return this != CLEAR;
    }
}
