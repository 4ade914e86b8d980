package com.reservealert.common.reserve;

import com.reservealert.common.config.RuleConfig;

/**
 * Maps a raw sample to the bounded reserve metric in [0, 1].
 *
 * <pre>
 *   s       = clamp(raw, clampMin, clampMax)
 *   t       = clamp((good − s) / (good − bad), 0, 1)
 *   reserve = 1 − t²
 * </pre>
 *
 * <p>The quadratic keeps mild deviations close to 1 and depresses reserve sharply near {@code bad}.
 * Samples at or below {@code bad} map to exactly 0, samples at or above {@code good} to exactly 1.
 *
 * <p>Stateless and thread-safe.
 */
public final class ReserveNormalizer {

    private final int clampMin;
    private final int clampMax;
    private final double good;
    private final double bad;

    public ReserveNormalizer(RuleConfig config) {
        this.clampMin = config.clampMin();
        this.clampMax = config.clampMax();
        this.good     = config.good();
        this.bad      = config.bad();
    }

    /** Clamps a raw sample into the plausible measurement range. */
    public int clamp(int raw) {
        return Math.max(clampMin, Math.min(clampMax, raw));
    }

    public double reserve(int raw) {
        return reserveOf(clamp(raw), good, bad);
    }

    /**
     * Unclamped reserve of a sample for the given reference points. Requires {@code good > bad}.
     */
    public static double reserveOf(double sample, double good, double bad) {
        double t = (good - sample) / (good - bad);
        if (t < 0.0) {
            t = 0.0;
        } else if (t > 1.0) {
            t = 1.0;
        }
        return 1.0 - t * t;
    }
}
