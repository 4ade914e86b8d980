package com.reservealert.evaluation.parser;

import java.util.List;

/**
 * Integers accepted from a raw series string.
 *
 * @param values        accepted samples, in input order, at most {@code maxPoints}
 * @param truncated     true when integer tokens beyond {@code maxPoints} were dropped
 * @param skippedTokens non-integer tokens that were ignored
 */
public record ParsedSeries(List<Integer> values, boolean truncated, int skippedTokens) {

    public ParsedSeries {
        values = List.copyOf(values);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
