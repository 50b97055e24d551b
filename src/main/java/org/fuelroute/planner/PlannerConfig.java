package org.fuelroute.planner;

import lombok.Builder;
import lombok.Value;

/**
 * Fuel margins shared by both planners.
 */
@Value
@Builder
public class PlannerConfig {
    public static final double DEFAULT_RESERVE_FRACTION = 0.10d;
    public static final double DEFAULT_GREEDY_SAFETY_MARGIN = 0.15d;

    /**
     * Fraction of the tank never planned as used.
     */
    @Builder.Default
    double reserveFraction = DEFAULT_RESERVE_FRACTION;
    /**
     * Fraction of the tank the greedy planner leaves empty when topping up.
     */
    @Builder.Default
    double greedySafetyMargin = DEFAULT_GREEDY_SAFETY_MARGIN;

    public static PlannerConfig defaults() {
        return builder().build();
    }

    public PlannerConfig validate() {
        if (!Double.isFinite(reserveFraction) || reserveFraction < 0.0d || reserveFraction >= 1.0d) {
            throw new IllegalArgumentException("reserveFraction must be within [0, 1), got " + reserveFraction);
        }
        if (!Double.isFinite(greedySafetyMargin) || greedySafetyMargin < 0.0d || greedySafetyMargin >= 1.0d) {
            throw new IllegalArgumentException("greedySafetyMargin must be within [0, 1), got " + greedySafetyMargin);
        }
        return this;
    }

    public double reserveLiters(VehicleProfile vehicle) {
        return vehicle.getTankCapacityLiters() * reserveFraction;
    }
}
