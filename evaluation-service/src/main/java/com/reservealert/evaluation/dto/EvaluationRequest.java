package com.reservealert.evaluation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for {@code POST /api/v1/evaluate}: one sample per minute, as free-form text.
 */
public record EvaluationRequest(
    @JsonProperty("series") String series
) {}
