package org.fuelroute.planner;

import org.fuelroute.station.CandidateStation;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Ordered refueling itinerary with its total cost.
 */
public record RefuelingPlan(String strategy, List<RefuelStop> stops, double routeLengthMeters, double finalFuelLiters) {
    public RefuelingPlan {
        Objects.requireNonNull(strategy, "strategy");
        stops = List.copyOf(Objects.requireNonNull(stops, "stops"));
    }

    public double totalCost() {
        double total = 0.0d;
        for (RefuelStop stop : stops) {
            total += stop.cost();
        }
        return total;
    }

    public double totalLiters() {
        double total = 0.0d;
        for (RefuelStop stop : stops) {
            total += stop.litersPurchased();
        }
        return total;
    }

    public List<CandidateStation> stations() {
        List<CandidateStation> stations = new ArrayList<>(stops.size());
        for (RefuelStop stop : stops) {
            stations.add(stop.station());
        }
        return stations;
    }

    public boolean isEmpty() {
        return stops.isEmpty();
    }
}
