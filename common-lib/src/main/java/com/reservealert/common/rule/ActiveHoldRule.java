package com.reservealert.common.rule;

import com.reservealert.common.hold.HoldTimer;
import com.reservealert.common.model.AlertLevel;
import com.reservealert.common.model.ReasonCode;

import java.util.Optional;

/**
 * Priority 5: no new trigger, but a hold is still armed: keep the alert asserted under the held
 * reason. Floor windows stay {@code ON*}.
 */
public final class ActiveHoldRule implements AlertRule {

    @Override
    public Optional<RuleOutcome> apply(StepContext step) {
        HoldTimer hold = step.hold();
        if (!hold.isActive()) {
            return Optional.empty();
        }
        step.note(String.format("holding ON (%d min left)", hold.onLeft()));
        AlertLevel level = hold.reason() == ReasonCode.FLOOR_LIMIT ? AlertLevel.ON_STAR : AlertLevel.ON;
        return Optional.of(new RuleOutcome(level, hold.reason()));
    }

    @Override
    public String ruleName() {
        return "ACTIVE_HOLD";
    }
}
