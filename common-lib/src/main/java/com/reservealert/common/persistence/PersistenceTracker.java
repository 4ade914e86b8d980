package com.reservealert.common.persistence;

import com.reservealert.common.config.CautionPolicy;
import com.reservealert.common.config.RuleConfig;
import com.reservealert.common.reserve.Tolerance;

import java.util.List;

/**
 * Maintains the critical and caution streak counters for one series run.
 *
 * <h3>Update order (once per step)</h3>
 * <ol>
 *   <li>Reset override: reserve ≥ recovery threshold, or reserve at the floor, forces both streaks
 *       to 0 regardless of band.</li>
 *   <li>CRITICAL band increments both streaks (critical implies caution).</li>
 *   <li>CAUTION band increments the caution streak and zeroes the critical streak.</li>
 *   <li>CLEAR band zeroes both.</li>
 * </ol>
 *
 * <p>Not thread-safe; owned by a single engine run.
 */
public final class PersistenceTracker {

    private final RuleConfig config;

    private int criticalStreak;
    private int cautionStreak;

    public PersistenceTracker(RuleConfig config) {
        this.config = config;
    }

    /**
     * Applies one step and appends reset / counting annotations to {@code notes}.
     *
     * @return the streaks after this step
     */
    public StreakState update(double reserve, Band band, List<String> notes) {
        if (Tolerance.atOrAbove(reserve, config.recoveryThreshold())) {
            reset();
            notes.add("reset (reserve>=recovery)");
            return snapshot();
        }
        if (Tolerance.isZero(reserve)) {
            reset();
            notes.add("reset (reserve at floor)");
            return snapshot();
        }

        switch (band) {
            case CRITICAL -> {
                criticalStreak++;
                cautionStreak++;
            }
            case CAUTION -> {
                criticalStreak = 0;
                cautionStreak++;
            }
            case CLEAR -> reset();
        }

        if (band == Band.CRITICAL && criticalStreak < config.criticalTriggerLen()) {
            notes.add(String.format("counting critical persistence (%d/%d)",
                criticalStreak, config.criticalTriggerLen()));
        } else if (band == Band.CAUTION
                && config.cautionPolicy() != CautionPolicy.DISABLED
                && cautionStreak < config.cautionTriggerLen()) {
            notes.add(String.format("counting caution persistence (%d/%d)",
                cautionStreak, config.cautionTriggerLen()));
        }
        return snapshot();
    }

    public void reset() {
        criticalStreak = 0;
        cautionStreak = 0;
    }

    public StreakState snapshot() {
        return new StreakState(criticalStreak, cautionStreak);
    }
}
