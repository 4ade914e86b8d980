package com.reservealert.evaluation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservealert.common.config.RuleMode;
import com.reservealert.common.model.AlertRow;

import java.time.Instant;
import java.util.List;

public record EvaluationResponse(
    @JsonProperty("evaluationId")  String         evaluationId,
    @JsonProperty("mode")          RuleMode       mode,
    @JsonProperty("inputCount")    int            inputCount,
    @JsonProperty("truncated")     boolean        truncated,
    @JsonProperty("skippedTokens") int            skippedTokens,
    @JsonProperty("evaluatedAt")   Instant        evaluatedAt,
    @JsonProperty("rows")          List<AlertRow> rows
) {}
