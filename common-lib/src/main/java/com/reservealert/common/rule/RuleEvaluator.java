package com.reservealert.common.rule;

import java.util.List;
import java.util.Optional;

/**
 * Applies a fixed-priority rule list to a step: first match wins, no match means
 * {@code OFF / NO_TRIGGER}.
 *
 * <h3>Standard priority order</h3>
 * <ol>
 *   <li>{@link FloorRule}: reserve at floor → {@code ON*}</li>
 *   <li>{@link DropRule}: deterioration above drop threshold → {@code ON}</li>
 *   <li>{@link CriticalPersistenceRule}: critical streak exact hit → {@code ON}, arms critical hold</li>
 *   <li>{@link CautionPersistenceRule}: caution streak exact hit → {@code ON}, arms caution hold</li>
 *   <li>{@link ActiveHoldRule}: armed hold → held reason</li>
 * </ol>
 *
 * <p>Recovery is not a rule: it is applied by the persistence tracker and hold timer before this
 * list runs. Stateless and thread-safe.
 */
public final class RuleEvaluator {

    private final List<AlertRule> rules;

    public RuleEvaluator(List<AlertRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static RuleEvaluator standard() {
        return new RuleEvaluator(List.of(
            new FloorRule(),
            new DropRule(),
            new CriticalPersistenceRule(),
            new CautionPersistenceRule(),
            new ActiveHoldRule()
        ));
    }

    public RuleOutcome evaluate(StepContext step) {
        for (AlertRule rule : rules) {
            Optional<RuleOutcome> outcome = rule.apply(step);
            if (outcome.isPresent()) {
                return outcome.get();
            }
        }
        return RuleOutcome.noTrigger();
    }

    /** Rules in priority order. */
    public List<AlertRule> rules() {
        return rules;
    }
}
