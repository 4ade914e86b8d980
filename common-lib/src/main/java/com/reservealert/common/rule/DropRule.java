package com.reservealert.common.rule;

import com.reservealert.common.model.ReasonCode;
import com.reservealert.common.reserve.Tolerance;

import java.util.Optional;

/**
 * Priority 2: acute deterioration above {@code dropThreshold}.
 *
 * <p>With {@code dropHoldLen > 0} the event arms (or refreshes) a drop hold of that length;
 * otherwise it asserts for its own step only and leaves any armed hold paused.
 */
public final class DropRule implements AlertRule {

    @Override
    public Optional<RuleOutcome> apply(StepContext step) {
        Double deterioration = step.measure().deterioration();
        if (deterioration == null || !Tolerance.exceeds(deterioration, step.config().dropThreshold())) {
            return Optional.empty();
        }
        int holdLen = step.config().dropHoldLen();
        if (holdLen > 0) {
            step.hold().arm(ReasonCode.DROP_EVENT, holdLen);
            step.note(String.format("drop window armed (%d min)", holdLen));
        }
        return Optional.of(RuleOutcome.on(ReasonCode.DROP_EVENT));
    }

    @Override
    public String ruleName() {
        return "DROP";
    }
}
