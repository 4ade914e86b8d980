package com.reservealert.common.engine;

import com.reservealert.common.config.RuleConfig;
import com.reservealert.common.hold.HoldTimer;
import com.reservealert.common.model.AlertRow;
import com.reservealert.common.persistence.Band;
import com.reservealert.common.persistence.PersistenceTracker;
import com.reservealert.common.persistence.StreakState;
import com.reservealert.common.reserve.DeltaMeasure;
import com.reservealert.common.reserve.DeltaTracker;
import com.reservealert.common.reserve.ReserveNormalizer;
import com.reservealert.common.rule.RuleEvaluator;
import com.reservealert.common.rule.RuleOutcome;
import com.reservealert.common.rule.StepContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Single-pass alert decision engine: one {@link AlertRow} per raw sample, in input order.
 *
 * <h3>Step pipeline</h3>
 * <ol>
 *   <li>Normalize the raw sample to reserve.</li>
 *   <li>Measure delta / deterioration against the previous step.</li>
 *   <li>Update the hold / reminder timers (recovery and band-exit cancellation, reminder tick).</li>
 *   <li>Update the streak counters (recovery and floor reset first).</li>
 *   <li>Resolve the rule list; the winning rule may arm or clear holds.</li>
 *   <li>Use up one minute of the hold reported this step, then emit the row.</li>
 * </ol>
 *
 * <p>The engine instance holds only the immutable config and stateless collaborators, so it can be
 * shared. Every {@link #evaluate(List)} call creates its own streak and hold state, which is never
 * visible outside the call. No I/O, no logging.
 */
public final class AlertDecisionEngine {

    private final RuleConfig        config;
    private final ReserveNormalizer normalizer;
    private final RuleEvaluator     evaluator;

    public AlertDecisionEngine(RuleConfig config) {
        this(config, RuleEvaluator.standard());
    }

    public AlertDecisionEngine(RuleConfig config, RuleEvaluator evaluator) {
        this.config     = Objects.requireNonNull(config, "config");
        this.evaluator  = Objects.requireNonNull(evaluator, "evaluator");
        this.normalizer = new ReserveNormalizer(config);
    }

    public static List<AlertRow> evaluate(List<Integer> series, RuleConfig config) {
        return new AlertDecisionEngine(config).evaluate(series);
    }

    /**
     * @param series raw samples, one per minute; must not contain {@code null}
     * @return one row per sample; empty for an empty series
     */
    public List<AlertRow> evaluate(List<Integer> series) {
        Objects.requireNonNull(series, "series");

        PersistenceTracker persistence = new PersistenceTracker(config);
        HoldTimer hold = new HoldTimer(config);
        List<AlertRow> rows = new ArrayList<>(series.size());
        Double previousReserve = null;

        for (int i = 0; i < series.size(); i++) {
            int step = i + 1;
            int raw = series.get(i);
            List<String> notes = new ArrayList<>();

            double reserve = normalizer.reserve(raw);
            DeltaMeasure measure = DeltaTracker.measure(reserve, previousReserve, config.flatThreshold());
            if (measure.isInitial()) {
                notes.add("first sample");
            } else if (measure.flat()) {
                notes.add("flat (|delta|<=p)");
            }

            Band band = Band.classify(reserve, config);
            hold.update(reserve, band, notes);
            StreakState streaks = persistence.update(reserve, band, notes);

            StepContext context = new StepContext(step, reserve, measure, band, streaks, hold, config, notes);
            RuleOutcome outcome = evaluator.evaluate(context);
            hold.consume(outcome.reason(), band, notes);

            rows.add(RowEmitter.emit(step, raw, reserve, measure, outcome, notes));
            previousReserve = reserve;
        }
        return List.copyOf(rows);
    }

    public RuleConfig config() {
        return config;
    }
}
