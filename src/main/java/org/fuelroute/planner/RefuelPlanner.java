package org.fuelroute.planner;

import org.fuelroute.station.CandidateStation;
import org.fuelroute.station.FuelType;

import java.util.List;

/**
 * Produces a refueling plan over corridor candidates.
 */
public interface RefuelPlanner {

    /**
     * @param candidates corridor stations in any order; unpriced ones are ignored.
     * @param routeLengthMeters along-path distance of the destination.
     * @throws ImpossibleRouteException when the destination cannot be reached.
     */
    RefuelingPlan plan(List<CandidateStation> candidates, double routeLengthMeters, FuelType fuelType, VehicleProfile vehicle);
}
