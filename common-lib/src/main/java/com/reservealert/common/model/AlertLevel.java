package com.reservealert.common.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Per-step alert decision.
 *
 * <ul>
 *   <li>{@link #ON_STAR} ({@code ON*}): floor condition, highest priority</li>
 *   <li>{@link #ON}: event or persistence alert, or an active hold</li>
 *   <li>{@link #OFF}: no rule asserted</li>
 * </ul>
 */
public enum AlertLevel {
    ON_STAR("ON*"),
    ON("ON"),
    OFF("OFF");

    private final String label;

    AlertLevel(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean asserted() {
        return this != OFF;
    }
}
