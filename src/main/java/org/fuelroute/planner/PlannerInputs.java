package org.fuelroute.planner;

import lombok.experimental.UtilityClass;
import org.fuelroute.station.CandidateStation;
import org.fuelroute.station.FuelType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

@UtilityClass
class PlannerInputs {
    static final double EPSILON_LITERS = 1e-9d;

    /**
     * Priced stations lying on {@code [0, routeLengthMeters]}, ordered by position.
     */
    static List<CandidateStation> stationsOnRoute(List<CandidateStation> candidates, double routeLengthMeters, FuelType fuelType) {
        Objects.requireNonNull(candidates, "candidates");
        Objects.requireNonNull(fuelType, "fuelType");
        requireRouteLength(routeLengthMeters);
        List<CandidateStation> stations = new ArrayList<>(candidates.size());
        for (CandidateStation candidate : candidates) {
            if (candidate.record().sells(fuelType) && candidate.distanceAlongMeters() <= routeLengthMeters) {
                stations.add(candidate);
            }
        }
        stations.sort(Comparator.comparingDouble(CandidateStation::distanceAlongMeters).thenComparing(CandidateStation::id));
        return stations;
    }

    static void requireRouteLength(double routeLengthMeters) {
        if (!Double.isFinite(routeLengthMeters) || routeLengthMeters <= 0.0d) {
            throw new IllegalArgumentException("routeLengthMeters must be finite and > 0, got " + routeLengthMeters);
        }
    }
}
