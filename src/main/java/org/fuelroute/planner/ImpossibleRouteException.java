package org.fuelroute.planner;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.fuelroute.core.FuelRouteException;

import java.util.Locale;

/**
 * No refueling plan reaches the destination with the given stations and vehicle.
 */
@Getter
@Accessors(fluent = true)
public final class ImpossibleRouteException extends FuelRouteException {
    public static final String REASON_ROUTE_INFEASIBLE = "ROUTE_INFEASIBLE";

    /**
     * Furthest along-path distance the vehicle can physically reach, in meters.
     */
    private final double furthestReachableMeters;
    private final double routeLengthMeters;

    public ImpossibleRouteException(double furthestReachableMeters, double routeLengthMeters, String detail) {
        super(REASON_ROUTE_INFEASIBLE, String.format(Locale.ROOT,
                "destination at %.1f km cannot be reached; furthest reachable point is km %.1f (%s)",
                routeLengthMeters / 1000.0d, furthestReachableMeters / 1000.0d, detail));
        this.furthestReachableMeters = furthestReachableMeters;
        this.routeLengthMeters = routeLengthMeters;
    }

    public double furthestReachableKm() {
        return furthestReachableMeters / 1000.0d;
    }
}
