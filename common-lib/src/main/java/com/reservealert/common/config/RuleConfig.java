package com.reservealert.common.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.reservealert.common.reserve.ReserveNormalizer;

/**
 * Immutable rule set consumed by the decision engine.
 *
 * <p>All invariants are checked in the canonical constructor, so an instance that exists is
 * always safe to evaluate a series with. Violations raise {@link RuleConfigException}.
 *
 * <h3>Thresholds</h3>
 * <p>{@code criticalMax}, {@code cautionMax} and {@code recoveryThreshold} are reserve values in
 * [0, 1]. The {@link Builder} can derive them from raw reference samples instead
 * ({@link Builder#criticalAtSample(int)} etc.), which keeps a series sitting on a reference sample
 * exactly on the boundary.
 *
 * <h3>Optional lengths</h3>
 * <p>{@code floorWindowLen}, {@code reminderCooldownLen} and {@code dropHoldLen} use {@code 0} for
 * "not used". A drop hold of 0 means drop events assert for their own step only.
 */
public record RuleConfig(
    @JsonProperty("mode")                RuleMode      mode,
    @JsonProperty("good")                double        good,
    @JsonProperty("bad")                 double        bad,
    @JsonProperty("clampMin")            int           clampMin,
    @JsonProperty("clampMax")            int           clampMax,
    @JsonProperty("dropThreshold")       double        dropThreshold,
    @JsonProperty("flatThreshold")       double        flatThreshold,
    @JsonProperty("recoveryThreshold")   double        recoveryThreshold,
    @JsonProperty("criticalMax")         double        criticalMax,
    @JsonProperty("cautionMax")          double        cautionMax,
    @JsonProperty("criticalTriggerLen")  int           criticalTriggerLen,
    @JsonProperty("cautionTriggerLen")   int           cautionTriggerLen,
    @JsonProperty("criticalHoldLen")     int           criticalHoldLen,
    @JsonProperty("cautionHoldLen")      int           cautionHoldLen,
    @JsonProperty("floorWindowLen")      int           floorWindowLen,
    @JsonProperty("reminderCooldownLen") int           reminderCooldownLen,
    @JsonProperty("dropHoldLen")         int           dropHoldLen,
    @JsonProperty("cautionPolicy")       CautionPolicy cautionPolicy
) {

    public RuleConfig {
        if (mode == null) {
            throw new RuleConfigException("mode", "must be set");
        }
        if (cautionPolicy == null) {
            throw new RuleConfigException("cautionPolicy", "must be set");
        }
        if (!(good > bad)) {
            throw new RuleConfigException("good",
                String.format("must be greater than bad (good=%s, bad=%s)", good, bad));
        }
        if (clampMin > clampMax) {
            throw new RuleConfigException("clampMin",
                String.format("must not exceed clampMax (clampMin=%d, clampMax=%d)", clampMin, clampMax));
        }
        requireUnit("criticalMax", criticalMax);
        requireUnit("cautionMax", cautionMax);
        requireUnit("recoveryThreshold", recoveryThreshold);
        if (criticalMax > cautionMax) {
            throw new RuleConfigException("criticalMax",
                String.format("must not exceed cautionMax (criticalMax=%.4f, cautionMax=%.4f)",
                    criticalMax, cautionMax));
        }
        if (recoveryThreshold < cautionMax) {
            throw new RuleConfigException("recoveryThreshold",
                String.format("must be at least cautionMax (recoveryThreshold=%.4f, cautionMax=%.4f)",
                    recoveryThreshold, cautionMax));
        }
        if (recoveryThreshold <= 0.0) {
            throw new RuleConfigException("recoveryThreshold", "must be above the floor (0)");
        }
        requireNonNegative("dropThreshold", dropThreshold);
        requireNonNegative("flatThreshold", flatThreshold);
        requirePositive("criticalTriggerLen", criticalTriggerLen);
        requirePositive("cautionTriggerLen", cautionTriggerLen);
        requirePositive("criticalHoldLen", criticalHoldLen);
        requirePositive("cautionHoldLen", cautionHoldLen);
        requireNonNegative("floorWindowLen", floorWindowLen);
        requireNonNegative("reminderCooldownLen", reminderCooldownLen);
        requireNonNegative("dropHoldLen", dropHoldLen);
        if (mode == RuleMode.FLOOR_WINDOW_REMINDER && floorWindowLen <= 0) {
            throw new RuleConfigException("floorWindowLen",
                "must be positive in FLOOR_WINDOW_REMINDER mode");
        }
        if (mode == RuleMode.STREAK_DUAL_HOLD && (floorWindowLen > 0 || reminderCooldownLen > 0)) {
            throw new RuleConfigException(floorWindowLen > 0 ? "floorWindowLen" : "reminderCooldownLen",
                "only applies to FLOOR_WINDOW_REMINDER mode");
        }
    }

    /** Floor is windowed and may be re-armed by a reminder. */
    public boolean floorWindowed() {
        return mode == RuleMode.FLOOR_WINDOW_REMINDER;
    }

    /**
     * SpO₂ rule set with streak-based dual holds: good 100, bad 88, drop 0.30, flat 0.01,
     * critical / caution / recovery boundaries at SpO₂ 89 / 91 / 92, triggers 3 / 5, holds 5 / 3.
     */
    public static RuleConfig spo2StreakProfile() {
        return builder().build();
    }

    /**
     * SpO₂ rule set in floor-window mode: the floor asserts for a 3-minute window, re-armed every
     * 5 minutes while reserve stays in the critical band. Drop events hold for 2 minutes and the
     * caution rule is off.
     */
    public static RuleConfig spo2FloorWindowProfile() {
        return builder()
            .mode(RuleMode.FLOOR_WINDOW_REMINDER)
            .floorWindowLen(3)
            .reminderCooldownLen(5)
            .dropHoldLen(2)
            .cautionPolicy(CautionPolicy.DISABLED)
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .mode(mode).good(good).bad(bad).clamp(clampMin, clampMax)
            .dropThreshold(dropThreshold).flatThreshold(flatThreshold)
            .recoveryThreshold(recoveryThreshold).criticalMax(criticalMax).cautionMax(cautionMax)
            .criticalTriggerLen(criticalTriggerLen).cautionTriggerLen(cautionTriggerLen)
            .criticalHoldLen(criticalHoldLen).cautionHoldLen(cautionHoldLen)
            .floorWindowLen(floorWindowLen).reminderCooldownLen(reminderCooldownLen)
            .dropHoldLen(dropHoldLen).cautionPolicy(cautionPolicy);
    }

    private static void requireUnit(String field, double value) {
        if (!(value >= 0.0 && value <= 1.0)) {
            throw new RuleConfigException(field, "must be within [0, 1] but was " + value);
        }
    }

    private static void requireNonNegative(String field, double value) {
        if (!(value >= 0.0)) {
            throw new RuleConfigException(field, "must not be negative but was " + value);
        }
    }

    private static void requirePositive(String field, int value) {
        if (value <= 0) {
            throw new RuleConfigException(field, "must be positive but was " + value);
        }
    }

    /**
     * Fluent builder, pre-populated with the SpO₂ streak profile.
     *
     * <p>Sample-based thresholds are resolved in {@link #build()} against the final
     * {@code good}/{@code bad} pair, so call order does not matter. Setting a reserve value directly
     * replaces a previously set sample and vice versa.
     */
    public static final class Builder {
        private RuleMode mode = RuleMode.STREAK_DUAL_HOLD;
        private double good = 100.0;
        private double bad = 88.0;
        private int clampMin = 50;
        private int clampMax = 100;
        private double dropThreshold = 0.30;
        private double flatThreshold = 0.01;
        private Double recoveryThreshold;
        private Double criticalMax;
        private Double cautionMax;
        private Integer recoverySample = 92;
        private Integer criticalSample = 89;
        private Integer cautionSample = 91;
        private int criticalTriggerLen = 3;
        private int cautionTriggerLen = 5;
        private int criticalHoldLen = 5;
        private int cautionHoldLen = 3;
        private int floorWindowLen;
        private int reminderCooldownLen;
        private int dropHoldLen;
        private CautionPolicy cautionPolicy = CautionPolicy.OUTSIDE_CRITICAL_BAND;

        private Builder() {}

        public Builder mode(RuleMode mode) { this.mode = mode; return this; }
        public Builder good(double good) { this.good = good; return this; }
        public Builder bad(double bad) { this.bad = bad; return this; }
        public Builder clamp(int min, int max) { this.clampMin = min; this.clampMax = max; return this; }
        public Builder dropThreshold(double value) { this.dropThreshold = value; return this; }
        public Builder flatThreshold(double value) { this.flatThreshold = value; return this; }
        public Builder criticalTriggerLen(int value) { this.criticalTriggerLen = value; return this; }
        public Builder cautionTriggerLen(int value) { this.cautionTriggerLen = value; return this; }
        public Builder criticalHoldLen(int value) { this.criticalHoldLen = value; return this; }
        public Builder cautionHoldLen(int value) { this.cautionHoldLen = value; return this; }
        public Builder floorWindowLen(int value) { this.floorWindowLen = value; return this; }
        public Builder reminderCooldownLen(int value) { this.reminderCooldownLen = value; return this; }
        public Builder dropHoldLen(int value) { this.dropHoldLen = value; return this; }
        public Builder cautionPolicy(CautionPolicy policy) { this.cautionPolicy = policy; return this; }

        public Builder recoveryThreshold(double reserve) {
            this.recoveryThreshold = reserve;
            this.recoverySample = null;
            return this;
        }

        public Builder criticalMax(double reserve) {
            this.criticalMax = reserve;
            this.criticalSample = null;
            return this;
        }

        public Builder cautionMax(double reserve) {
            this.cautionMax = reserve;
            this.cautionSample = null;
            return this;
        }

        public Builder recoveryAtSample(int sample) {
            this.recoverySample = sample;
            this.recoveryThreshold = null;
            return this;
        }

        public Builder criticalAtSample(int sample) {
            this.criticalSample = sample;
            this.criticalMax = null;
            return this;
        }

        public Builder cautionAtSample(int sample) {
            this.cautionSample = sample;
            this.cautionMax = null;
            return this;
        }

        public RuleConfig build() {
            return new RuleConfig(mode, good, bad, clampMin, clampMax, dropThreshold, flatThreshold,
                resolve(recoveryThreshold, recoverySample),
                resolve(criticalMax, criticalSample),
                resolve(cautionMax, cautionSample),
                criticalTriggerLen, cautionTriggerLen, criticalHoldLen, cautionHoldLen,
                floorWindowLen, reminderCooldownLen, dropHoldLen, cautionPolicy);
        }

        private double resolve(Double reserve, Integer sample) {
            if (sample != null && good > bad) {
                return ReserveNormalizer.reserveOf(sample, good, bad);
            }
            // good <= bad is reported by the constructor; NaN keeps the threshold check from masking it
            return reserve != null ? reserve : Double.NaN;
        }
    }
}
