package com.reservealert.common.config;

/**
 * Raised when a {@link RuleConfig} violates one of its construction invariants.
 * Always thrown before any series is evaluated.
 */
public class RuleConfigException extends RuntimeException {
    private final String field;

    public RuleConfigException(String field, String message) {
        super("[" + field + "] " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
