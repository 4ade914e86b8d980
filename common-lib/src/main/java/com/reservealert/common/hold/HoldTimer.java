package com.reservealert.common.hold;

import com.reservealert.common.config.RuleConfig;
import com.reservealert.common.model.ReasonCode;
import com.reservealert.common.persistence.Band;
import com.reservealert.common.reserve.Tolerance;

import java.util.List;

/**
 * Hold and reminder timers for one series run.
 *
 * <p>State: {@code onLeft} (minutes the current alert must stay asserted), {@code reason} (the rule
 * holding it) and {@code cooldownLeft} (minutes until a floor reminder re-arms). A single hold slot
 * is shared by all rules; a newly fired rule replaces whatever was armed.
 *
 * <h3>Per-step lifecycle</h3>
 * <ol>
 *   <li>{@link #update} before rule evaluation: recovery cancels everything, leaving the arming band
 *       cancels the hold, and a pending reminder cooldown ticks (re-arming the floor window at 0).</li>
 *   <li>Rules may {@link #arm} or {@link #clear}.</li>
 *   <li>{@link #consume} after the step is decided: if the step was reported under the held reason,
 *       one minute is used up.</li>
 * </ol>
 *
 * <p>Invariants: {@code onLeft > 0 ⇒ reason != null}; {@code cooldownLeft > 0 ⇒ onLeft == 0}.
 * Not thread-safe.
 */
public final class HoldTimer {

    private final RuleConfig config;

    private int        onLeft;
    private ReasonCode reason;
    private int        cooldownLeft;

    public HoldTimer(RuleConfig config) {
        this.config = config;
    }

    public int onLeft() {
        return onLeft;
    }

    /** The holding rule, or {@code null} when no hold is armed. */
    public ReasonCode reason() {
        return reason;
    }

    public int cooldownLeft() {
        return cooldownLeft;
    }

    public boolean isActive() {
        return onLeft > 0;
    }

    public boolean isHolding(ReasonCode candidate) {
        return onLeft > 0 && reason == candidate;
    }

    public boolean coolingDown() {
        return cooldownLeft > 0;
    }

    /** Arms a fresh hold, replacing any armed hold or pending reminder. */
    public void arm(ReasonCode holdReason, int length) {
        this.onLeft = length;
        this.reason = holdReason;
        this.cooldownLeft = 0;
    }

    public void clear() {
        onLeft = 0;
        reason = null;
        cooldownLeft = 0;
    }

    /**
     * Timer phase of a step, run after streaks are updated and before rules are evaluated.
     */
    public void update(double reserve, Band band, List<String> notes) {
        if (Tolerance.atOrAbove(reserve, config.recoveryThreshold())) {
            if (onLeft > 0) {
                notes.add("hold cancelled (reserve>=recovery)");
            }
            if (cooldownLeft > 0) {
                notes.add("reminder cancelled (reserve>=recovery)");
            }
            clear();
            return;
        }

        if (onLeft > 0 && leftArmingBand(band)) {
            notes.add(reason == ReasonCode.CAUTION_PERSIST
                ? "hold ended early (reserve>caution)"
                : "hold ended early (reserve>critical)");
            clear();
        }

        if (cooldownLeft > 0) {
            if (band != Band.CRITICAL) {
                notes.add("reminder cancelled (reserve>critical)");
                cooldownLeft = 0;
                return;
            }
            cooldownLeft--;
            if (cooldownLeft == 0) {
                arm(ReasonCode.FLOOR_LIMIT, config.floorWindowLen());
                notes.add(String.format("reminder armed (%d min window)", config.floorWindowLen()));
            } else {
                notes.add(String.format("reminder in %d min", cooldownLeft));
            }
        }
    }

    /**
     * Uses up one minute of the hold when the step was reported under the held reason.
     * A floor window expiring inside the critical band starts the reminder cooldown when one is
     * configured.
     */
    public void consume(ReasonCode reported, Band band, List<String> notes) {
        if (onLeft <= 0 || reason != reported) {
            return;
        }
        onLeft--;
        if (onLeft > 0) {
            return;
        }
        ReasonCode expired = reason;
        reason = null;
        if (expired == ReasonCode.FLOOR_LIMIT
                && config.reminderCooldownLen() > 0
                && band == Band.CRITICAL) {
            cooldownLeft = config.reminderCooldownLen();
            notes.add(String.format("hold completed -> reminder in %d min", cooldownLeft));
        } else {
            notes.add("hold completed -> next OFF unless retrigger");
        }
    }

    private boolean leftArmingBand(Band band) {
        return switch (reason) {
            case CRITICAL_PERSIST, FLOOR_LIMIT -> band != Band.CRITICAL;
            case CAUTION_PERSIST -> !band.withinCaution();
            case DROP_EVENT, NO_TRIGGER -> false;
        };
    }
}
