package com.reservealert.common.rule;

import com.reservealert.common.hold.HoldTimer;
import com.reservealert.common.model.ReasonCode;
import com.reservealert.common.reserve.Tolerance;

import java.util.Optional;

/**
 * Priority 1: reserve at the floor.
 *
 * <p>Streak mode: {@code ON*} on every floor step and all hold state is cleared (streaks are already
 * zeroed by the persistence reset override). The floor marks a new worst-case episode.
 *
 * <p>Floor-window mode: the first floor step arms a window of {@code floorWindowLen} minutes; later
 * floor steps continue the armed window. While a reminder cooldown is pending the rule does not
 * match, so a persisting floor is re-notified only when the reminder fires.
 */
public final class FloorRule implements AlertRule {

    @Override
    public Optional<RuleOutcome> apply(StepContext step) {
        if (!Tolerance.isZero(step.reserve())) {
            return Optional.empty();
        }
        HoldTimer hold = step.hold();

        if (!step.config().floorWindowed()) {
            if (hold.isActive()) {
                step.note("hold cleared (floor)");
            }
            hold.clear();
            return Optional.of(RuleOutcome.floor());
        }

        if (hold.isHolding(ReasonCode.FLOOR_LIMIT)) {
            step.note(String.format("floor window (%d min left)", hold.onLeft()));
            return Optional.of(RuleOutcome.floor());
        }
        if (hold.coolingDown()) {
            return Optional.empty();
        }
        int window = step.config().floorWindowLen();
        hold.arm(ReasonCode.FLOOR_LIMIT, window);
        step.note(String.format("floor window armed (%d min)", window));
        return Optional.of(RuleOutcome.floor());
    }

    @Override
    public String ruleName() {
        return "FLOOR";
    }
}
