package com.reservealert.common.reserve;

/**
 * Computes the change of reserve against the previous step.
 *
 * <p>Pure function of two inputs. The {@code flat} flag is informational and never feeds the
 * alert decision.
 */
public final class DeltaTracker {

    private DeltaTracker() {}

    /**
     * @param reserve         current reserve
     * @param previousReserve reserve of the previous step, {@code null} on the first step
     * @param flatThreshold   {@code |delta|} at or below this is flagged flat
     * @return the measure; {@link DeltaMeasure#initial()} when there is no previous step
     */
    public static DeltaMeasure measure(double reserve, Double previousReserve, double flatThreshold) {
        if (previousReserve == null) {
            return DeltaMeasure.initial();
        }
        double delta = reserve - previousReserve;
        double deterioration = Math.max(0.0, -delta);
        boolean flat = Tolerance.atOrBelow(Math.abs(delta), flatThreshold);
        return new DeltaMeasure(delta, deterioration, flat);
    }
}
