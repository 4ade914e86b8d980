package com.reservealert.evaluation.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.reservealert.common.config.CautionPolicy;
import com.reservealert.common.config.RuleConfig;
import com.reservealert.common.config.RuleMode;
import com.reservealert.common.engine.AlertDecisionEngine;
import com.reservealert.evaluation.parser.SeriesParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the decision engine from {@code reserve-alert.*} properties.
 *
 * <p>Thresholds default to raw reference samples (SpO₂ 92 / 89 / 91). Setting one of the
 * {@code *-max} / {@code recovery-threshold} keys overrides the matching sample with an explicit
 * reserve value. An inconsistent rule set fails start-up with a
 * {@link com.reservealert.common.config.RuleConfigException} naming the field.
 */
@Configuration
public class EvaluationConfig {

    private static final Logger log = LoggerFactory.getLogger(EvaluationConfig.class);

    @Value("${reserve-alert.rules.mode:STREAK_DUAL_HOLD}")
    private RuleMode mode;

    @Value("${reserve-alert.rules.good:100}")
    private double good;

    @Value("${reserve-alert.rules.bad:88}")
    private double bad;

    @Value("${reserve-alert.rules.clamp-min:50}")
    private int clampMin;

    @Value("${reserve-alert.rules.clamp-max:100}")
    private int clampMax;

    @Value("${reserve-alert.rules.drop-threshold:0.30}")
    private double dropThreshold;

    @Value("${reserve-alert.rules.flat-threshold:0.01}")
    private double flatThreshold;

    @Value("${reserve-alert.rules.recovery-sample:92}")
    private int recoverySample;

    @Value("${reserve-alert.rules.critical-sample:89}")
    private int criticalSample;

    @Value("${reserve-alert.rules.caution-sample:91}")
    private int cautionSample;

    @Value("${reserve-alert.rules.recovery-threshold:#{null}}")
    private Double recoveryThreshold;

    @Value("${reserve-alert.rules.critical-max:#{null}}")
    private Double criticalMax;

    @Value("${reserve-alert.rules.caution-max:#{null}}")
    private Double cautionMax;

    @Value("${reserve-alert.rules.critical-trigger-len:3}")
    private int criticalTriggerLen;

    @Value("${reserve-alert.rules.caution-trigger-len:5}")
    private int cautionTriggerLen;

    @Value("${reserve-alert.rules.critical-hold-len:5}")
    private int criticalHoldLen;

    @Value("${reserve-alert.rules.caution-hold-len:3}")
    private int cautionHoldLen;

    @Value("${reserve-alert.rules.floor-window-len:0}")
    private int floorWindowLen;

    @Value("${reserve-alert.rules.reminder-cooldown-len:0}")
    private int reminderCooldownLen;

    @Value("${reserve-alert.rules.drop-hold-len:0}")
    private int dropHoldLen;

    @Value("${reserve-alert.rules.caution-policy:OUTSIDE_CRITICAL_BAND}")
    private CautionPolicy cautionPolicy;

    @Value("${reserve-alert.input.max-points:100}")
    private int maxPoints;

    @Bean
    public RuleConfig ruleConfig() {
        RuleConfig.Builder builder = RuleConfig.builder()
            .mode(mode)
            .good(good)
            .bad(bad)
            .clamp(clampMin, clampMax)
            .dropThreshold(dropThreshold)
            .flatThreshold(flatThreshold)
            .recoveryAtSample(recoverySample)
            .criticalAtSample(criticalSample)
            .cautionAtSample(cautionSample)
            .criticalTriggerLen(criticalTriggerLen)
            .cautionTriggerLen(cautionTriggerLen)
            .criticalHoldLen(criticalHoldLen)
            .cautionHoldLen(cautionHoldLen)
            .floorWindowLen(floorWindowLen)
            .reminderCooldownLen(reminderCooldownLen)
            .dropHoldLen(dropHoldLen)
            .cautionPolicy(cautionPolicy);
        if (recoveryThreshold != null) builder.recoveryThreshold(recoveryThreshold);
        if (criticalMax != null)       builder.criticalMax(criticalMax);
        if (cautionMax != null)        builder.cautionMax(cautionMax);

        RuleConfig config = builder.build();
        log.info("Rule set loaded: mode={} criticalMax={} cautionMax={} recovery={} policy={}",
            config.mode(), config.criticalMax(), config.cautionMax(), config.recoveryThreshold(),
            config.cautionPolicy());
        return config;
    }

    @Bean
    public AlertDecisionEngine alertDecisionEngine(RuleConfig ruleConfig) {
        return new AlertDecisionEngine(ruleConfig);
    }

    @Bean
    public SeriesParser seriesParser() {
        return new SeriesParser(maxPoints);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
