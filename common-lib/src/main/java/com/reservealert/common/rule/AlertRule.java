package com.reservealert.common.rule;

import java.util.Optional;

/**
 * One entry of the prioritised rule list evaluated by {@link RuleEvaluator}.
 *
 * <p>Implementations must be stateless: all per-run state lives in the {@link StepContext}'s
 * hold timer. A rule that matches may arm or clear holds before returning its outcome; a rule that
 * does not match must leave the context untouched.
 */
public interface AlertRule {

    /**
     * @return the step's outcome if this rule fires, otherwise empty so the next rule is tried
     */
    Optional<RuleOutcome> apply(StepContext step);

    String ruleName();
}
