package com.reservealert.common.rule;

import com.reservealert.common.config.RuleConfig;
import com.reservealert.common.hold.HoldTimer;
import com.reservealert.common.persistence.Band;
import com.reservealert.common.persistence.StreakState;
import com.reservealert.common.reserve.DeltaMeasure;

import java.util.List;

/**
 * Everything a rule may read for one step, plus the two things it may change: the run's
 * {@link HoldTimer} and the step's annotation list.
 *
 * <p>{@code reserve} is full precision; rounding happens only when the row is emitted.
 */
public record StepContext(
    int          step,
    double       reserve,
    DeltaMeasure measure,
    Band         band,
    StreakState  streaks,
    HoldTimer    hold,
    RuleConfig   config,
    List<String> notes
) {
    public void note(String annotation) {
        notes.add(annotation);
    }
}
