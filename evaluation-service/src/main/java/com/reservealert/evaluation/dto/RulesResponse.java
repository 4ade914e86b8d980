package com.reservealert.evaluation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservealert.common.config.RuleConfig;
import com.reservealert.common.model.AlertLevel;
import com.reservealert.common.model.ReasonCode;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Active rule set plus a legend for reading evaluation rows.
 */
public record RulesResponse(
    @JsonProperty("config")      RuleConfig          config,
    @JsonProperty("reasonCodes") Map<String, String> reasonCodes,
    @JsonProperty("alertLevels") List<String>        alertLevels
) {

    public static RulesResponse of(RuleConfig config) {
        Map<String, String> legend = new LinkedHashMap<>();
        for (ReasonCode code : ReasonCode.values()) {
            legend.put(code.name(), code.description());
        }
        List<String> levels = Arrays.stream(AlertLevel.values()).map(AlertLevel::label).toList();
        return new RulesResponse(config, legend, levels);
    }
}
