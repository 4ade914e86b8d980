package com.reservealert.common.model;

/**
 * Which rule produced a step's alert decision.
 */
public enum ReasonCode {

    /** Reserve at the absolute floor (0). */
    FLOOR_LIMIT("Reserve at floor (0): ON* with highest priority"),

    /** Deterioration since the previous step exceeded the drop threshold. */
    DROP_EVENT("Reserve dropped by more than the drop threshold since the previous minute"),

    /** Critical-band streak reached its trigger length. */
    CRITICAL_PERSIST("Critical-band streak reached its trigger length; held ON for the critical hold"),

    /** Caution-band streak reached its trigger length. */
    CAUTION_PERSIST("Caution-band streak reached its trigger length; held ON for the caution hold"),

    NO_TRIGGER("No rule fired");

    private final String description;

    ReasonCode(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
