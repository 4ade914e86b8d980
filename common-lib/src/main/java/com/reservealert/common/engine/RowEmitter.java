package com.reservealert.common.engine;

import com.reservealert.common.model.AlertRow;
import com.reservealert.common.reserve.DeltaMeasure;
import com.reservealert.common.rule.RuleOutcome;

import java.util.List;

/**
 * Assembles the immutable {@link AlertRow} of a step.
 *
 * <p>Rounding applies to the emitted copy only; the engine keeps comparing at full precision.
 */
public final class RowEmitter {

    static final String NOTE_SEPARATOR = "; ";

    private RowEmitter() {}

    public static AlertRow emit(int step, int raw, double reserve, DeltaMeasure measure,
                                RuleOutcome outcome, List<String> notes) {
        return new AlertRow(
            step,
            raw,
            round(reserve),
            measure.delta() == null ? null : round(measure.delta()),
            measure.deterioration() == null ? null : round(measure.deterioration()),
            outcome.alert(),
            outcome.reason(),
            String.join(NOTE_SEPARATOR, notes)
        );
    }

    /** Rounds to 4 decimals (half up). */
    public static double round(double value) {
        return Math.round(value * 10_000.0) / 10_000.0;
    }
}
