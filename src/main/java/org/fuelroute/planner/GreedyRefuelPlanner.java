package org.fuelroute.planner;

import lombok.extern.slf4j.Slf4j;
import org.fuelroute.station.CandidateStation;
import org.fuelroute.station.FuelType;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Sequential planner that refuels only when the next leg cannot be covered.
 *
 * <p>Stations are visited in path order. When the tank cannot cover the leg to the next
 * station (or the destination) while keeping the reserve, it is topped up to the useful
 * maximum, {@code capacity × (1 − safetyMargin)}, or to the leg need when that is higher.
 * It fails only when some leg exceeds a full tank, but it never compares prices.</p>
 */
@Slf4j
public final class GreedyRefuelPlanner implements RefuelPlanner {
    public static final String STRATEGY = "greedy";

    private final PlannerConfig config;

    public GreedyRefuelPlanner() {
        this(PlannerConfig.defaults());
    }

    public GreedyRefuelPlanner(PlannerConfig config) {
        this.config = Objects.requireNonNull(config, "config").validate();
    }

    @Override
    public RefuelingPlan plan(List<CandidateStation> candidates, double routeLengthMeters, FuelType fuelType, VehicleProfile vehicle) {
        Objects.requireNonNull(vehicle, "vehicle").validate();
        List<CandidateStation> stations = PlannerInputs.stationsOnRoute(candidates, routeLengthMeters, fuelType);

        double capacity = vehicle.getTankCapacityLiters();
        double reserve = config.reserveLiters(vehicle);
        double usefulMaximum = capacity * (1.0d - config.getGreedySafetyMargin());

        double fuel = vehicle.getInitialFuelLiters();
        double previous = 0.0d;
        double firstLeg = stations.isEmpty() ? routeLengthMeters : stations.get(0).distanceAlongMeters();
        if (vehicle.litersFor(firstLeg) + reserve > fuel + PlannerInputs.EPSILON_LITERS) {
            throw new ImpossibleRouteException(
                    Math.min(routeLengthMeters, vehicle.initialRangeMeters()),
                    routeLengthMeters,
                    "initial fuel does not cover the first leg of " + Math.round(firstLeg / 1000.0d) + " km"
            );
        }

        List<RefuelStop> stops = new ArrayList<>();
        for (int i = 0; i < stations.size(); i++) {
            CandidateStation station = stations.get(i);
            double position = station.distanceAlongMeters();
            fuel -= vehicle.litersFor(position - previous);
            previous = position;

            double next = i + 1 < stations.size() ? stations.get(i + 1).distanceAlongMeters() : routeLengthMeters;
            double need = vehicle.litersFor(next - position) + reserve;
            if (fuel + PlannerInputs.EPSILON_LITERS >= need) {
                continue;
            }
            if (need > capacity + PlannerInputs.EPSILON_LITERS) {
                throw new ImpossibleRouteException(
                        Math.min(routeLengthMeters, position + vehicle.fullTankRangeMeters()),
                        routeLengthMeters,
                        "gap of " + Math.round((next - position) / 1000.0d) + " km after station " + station.id()
                                + " exceeds a full tank"
                );
            }
            double target = Math.min(capacity, Math.max(usefulMaximum, need));
            double liters = target - fuel;
            double price = station.requirePrice(fuelType);
            stops.add(new RefuelStop(station, liters, price, liters * price, fuel, target));
            fuel = target;
        }
        double finalFuel = fuel - vehicle.litersFor(routeLengthMeters - previous);

        RefuelingPlan plan = new RefuelingPlan(STRATEGY, stops, routeLengthMeters, finalFuel);
        log.info("Greedy plan: {} stops, {} L, cost {}", stops.size(),
                Math.round(plan.totalLiters() * 10.0d) / 10.0d,
                Math.round(plan.totalCost() * 100.0d) / 100.0d);
        return plan;
    }
}
