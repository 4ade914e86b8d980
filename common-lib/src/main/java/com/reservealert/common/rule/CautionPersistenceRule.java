package com.reservealert.common.rule;

import com.reservealert.common.config.CautionPolicy;
import com.reservealert.common.model.ReasonCode;
import com.reservealert.common.persistence.Band;

import java.util.Optional;

/**
 * Priority 4: caution streak hits its trigger length on this step, subject to
 * {@link CautionPolicy}.
 */
public final class CautionPersistenceRule implements AlertRule {

    @Override
    public Optional<RuleOutcome> apply(StepContext step) {
        CautionPolicy policy = step.config().cautionPolicy();
        if (policy == CautionPolicy.DISABLED) {
            return Optional.empty();
        }
        if (step.streaks().caution() != step.config().cautionTriggerLen()) {
            return Optional.empty();
        }
        if (policy == CautionPolicy.OUTSIDE_CRITICAL_BAND && step.band() == Band.CRITICAL) {
            return Optional.empty();
        }
        step.hold().arm(ReasonCode.CAUTION_PERSIST, step.config().cautionHoldLen());
        return Optional.of(RuleOutcome.on(ReasonCode.CAUTION_PERSIST));
    }

    @Override
    public String ruleName() {
        return "CAUTION_PERSISTENCE";
    }
}
