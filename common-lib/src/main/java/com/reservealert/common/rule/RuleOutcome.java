package com.reservealert.common.rule;

import com.reservealert.common.model.AlertLevel;
import com.reservealert.common.model.ReasonCode;

/**
 * Alert decision produced by the first matching rule of a step.
 */
public record RuleOutcome(
    AlertLevel alert,
    ReasonCode reason
) {
    private static final RuleOutcome NO_TRIGGER = new RuleOutcome(AlertLevel.OFF, ReasonCode.NO_TRIGGER);

    public static RuleOutcome noTrigger() {
        return NO_TRIGGER;
    }

    public static RuleOutcome on(ReasonCode reason) {
        return new RuleOutcome(AlertLevel.ON, reason);
    }

    public static RuleOutcome floor() {
        return new RuleOutcome(AlertLevel.ON_STAR, ReasonCode.FLOOR_LIMIT);
    }
}
