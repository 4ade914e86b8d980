package com.reservealert.common.rule;

import com.reservealert.common.model.ReasonCode;

import java.util.Optional;

/**
 * Priority 3: critical streak hits its trigger length on this step.
 *
 * <p>Exact hit only: a streak that keeps climbing past the trigger never re-fires.
 */
public final class CriticalPersistenceRule implements AlertRule {

    @Override
    public Optional<RuleOutcome> apply(StepContext step) {
        if (step.streaks().critical() != step.config().criticalTriggerLen()) {
            return Optional.empty();
        }
        step.hold().arm(ReasonCode.CRITICAL_PERSIST, step.config().criticalHoldLen());
        return Optional.of(RuleOutcome.on(ReasonCode.CRITICAL_PERSIST));
    }

    @Override
    public String ruleName() {
        return "CRITICAL_PERSISTENCE";
    }
}
