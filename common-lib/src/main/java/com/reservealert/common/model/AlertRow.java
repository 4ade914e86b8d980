package com.reservealert.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable per-step output of the decision engine.
 *
 * <p>{@code reserve}, {@code delta} and {@code deterioration} are rounded to 4 decimals for display.
 * {@code delta} and {@code deterioration} are {@code null} on the first step.
 * {@code note} joins the step's annotations with {@code "; "} in the order they were produced.
 */
public record AlertRow(
    @JsonProperty("step")          int        step,
    @JsonProperty("raw")           int        raw,
    @JsonProperty("reserve")       double     reserve,
    @JsonProperty("delta")         Double     delta,
    @JsonProperty("deterioration") Double     deterioration,
    @JsonProperty("alert")         AlertLevel alert,
    @JsonProperty("reason")        ReasonCode reason,
    @JsonProperty("note")          String     note
) {}
