package org.fuelroute.planner;

import org.fuelroute.station.CandidateStation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

import static org.fuelroute.testutil.FuelRouteFixtures.DIESEL;
import static org.fuelroute.testutil.FuelRouteFixtures.candidate;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("CostMinimalRefuelPlanner Tests")
class CostMinimalRefuelPlannerTest {
    private static final double EPSILON = 1e-9d;

    private final CostMinimalRefuelPlanner planner = new CostMinimalRefuelPlanner();

    @Nested
    @DisplayName("Hand-computed scenarios")
    class Scenarios {

        @Test
        @DisplayName("Skips the expensive early station and buys just enough at the cheap one")
        void testCheapestChain() {
            VehicleProfile vehicle = VehicleProfile.of(50.0d, 10.0d, 0.4d);
            List<CandidateStation> stations = List.of(
                    candidate("A", 100.0d, 1.60d),
                    candidate("B", 140.0d, 1.20d),
                    candidate("C", 500.0d, 1.50d));

            RefuelingPlan plan = planner.plan(stations, 700_000.0d, DIESEL, vehicle);

            assertEquals(CostMinimalRefuelPlanner.STRATEGY, plan.strategy());
            assertEquals(List.of("B", "C"), plan.stations().stream().map(CandidateStation::id).toList());
            assertEquals(35.0d, plan.stops().get(0).litersPurchased(), 1e-9);
            assertEquals(20.0d, plan.stops().get(1).litersPurchased(), 1e-9);
            assertEquals(72.0d, plan.totalCost(), 1e-9);
            assertEquals(5.0d, plan.finalFuelLiters(), 1e-9);
            PlanAssertions.assertFeasible(plan, vehicle, 5.0d);
        }

        @Test
        @DisplayName("Passes a station it can skip and refuels once near the end")
        void testSingleLateStop() {
            VehicleProfile vehicle = VehicleProfile.of(50.0d, 10.0d, 1.0d);
            List<CandidateStation> stations = List.of(candidate("km300", 300.0d, 1.5d), candidate("km450", 450.0d, 1.4d));

            RefuelingPlan plan = planner.plan(stations, 600_000.0d, DIESEL, vehicle);

            assertEquals(1, plan.stops().size());
            assertEquals("km450", plan.stops().get(0).station().id());
            assertEquals(15.0d, plan.totalLiters(), 1e-9);
            assertEquals(21.0d, plan.totalCost(), 1e-9);
        }

        @Test
        @DisplayName("Initial fuel covering the route yields an empty plan")
        void testNoStop() {
            VehicleProfile vehicle = VehicleProfile.of(50.0d, 5.0d, 1.0d);
            RefuelingPlan plan = planner.plan(List.of(candidate("a", 10.0d, 1.0d)), 500_000.0d, DIESEL, vehicle);

            assertTrue(plan.isEmpty());
            assertEquals(0.0d, plan.totalCost(), 0.0d);
        }

        @Test
        @DisplayName("Infeasible route reports the 50 km reachable bound")
        void testInfeasible() {
            VehicleProfile vehicle = VehicleProfile.of(50.0d, 10.0d, 0.1d);
            ImpossibleRouteException ex = assertThrows(ImpossibleRouteException.class,
                    () -> planner.plan(List.of(candidate("km80", 80.0d, 1.4d)), 200_000.0d, DIESEL, vehicle));

            assertEquals(50.0d, ex.furthestReachableKm(), 1e-9);
            assertTrue(ex.getMessage().contains("km 50.0"));
        }

        @Test
        @DisplayName("A reachable station followed by a gap beyond the tank reports its range")
        void testInfeasibleAfterStation() {
            VehicleProfile vehicle = VehicleProfile.of(50.0d, 10.0d, 0.5d);
            ImpossibleRouteException ex = assertThrows(ImpossibleRouteException.class,
                    () -> planner.plan(List.of(candidate("km100", 100.0d, 1.4d)), 900_000.0d, DIESEL, vehicle));

            assertEquals(600.0d, ex.furthestReachableKm(), 1e-9);
        }
    }

    @Nested
    @DisplayName("Optimality")
    class Optimality {

        @Test
        @DisplayName("Matches an exhaustive search over station subsets")
        void testMatchesExhaustiveSearch() {
            Random random = new Random(2026L);
            int feasibleRuns = 0;
            for (int run = 0; run < 300; run++) {
                VehicleProfile vehicle = VehicleProfile.of(50.0d, 7.0d, 0.2d + random.nextDouble() * 0.8d);
                double routeMeters = 450_000.0d + random.nextDouble() * 600_000.0d;
                List<CandidateStation> stations = randomStations(random, 9, routeMeters, false);

                double expected = exhaustiveOptimum(stations, routeMeters, vehicle, 5.0d);
                if (Double.isInfinite(expected)) {
                    assertThrows(ImpossibleRouteException.class,
                            () -> planner.plan(stations, routeMeters, DIESEL, vehicle), "run " + run);
                    continue;
                }
                feasibleRuns++;
                RefuelingPlan plan = planner.plan(stations, routeMeters, DIESEL, vehicle);
                assertEquals(expected, plan.totalCost(), 1e-6, "run " + run);
                PlanAssertions.assertFeasible(plan, vehicle, 5.0d);
            }
            assertTrue(feasibleRuns > 50, "fixture should produce feasible routes");
        }

        @Test
        @DisplayName("Greedy never beats it on uniform or decreasing prices")
        void testGreedyNeverCheaper() {
            GreedyRefuelPlanner greedy = new GreedyRefuelPlanner();
            Random random = new Random(99L);
            for (int run = 0; run < 200; run++) {
                VehicleProfile vehicle = VehicleProfile.of(55.0d, 6.5d, 0.3d + random.nextDouble() * 0.7d);
                double routeMeters = 600_000.0d + random.nextDouble() * 900_000.0d;
                List<CandidateStation> stations = randomStations(random, 12, routeMeters, run % 2 == 0);

                RefuelingPlan optimal;
                try {
                    optimal = planner.plan(stations, routeMeters, DIESEL, vehicle);
                } catch (ImpossibleRouteException ex) {
                    assertThrows(ImpossibleRouteException.class,
                            () -> greedy.plan(stations, routeMeters, DIESEL, vehicle), "run " + run);
                    continue;
                }
                RefuelingPlan heuristic = greedy.plan(stations, routeMeters, DIESEL, vehicle);
                assertTrue(heuristic.totalCost() + 1e-6 >= optimal.totalCost(),
                        "run " + run + ": greedy " + heuristic.totalCost() + " < optimal " + optimal.totalCost());
                PlanAssertions.assertFeasible(heuristic, vehicle, 5.5d);
            }
        }

        @Test
        @DisplayName("Rising prices let greedy filling undercut minimal per-leg purchases")
        void testGreedyCheaperOnRisingPrices() {
            VehicleProfile vehicle = VehicleProfile.of(50.0d, 10.0d, 0.2d);
            List<CandidateStation> stations = List.of(
                    candidate("A", 50.0d, 1.0d),
                    candidate("B", 100.0d, 2.0d),
                    candidate("C", 200.0d, 2.0d));

            RefuelingPlan minimal = planner.plan(stations, 560_000.0d, DIESEL, vehicle);
            RefuelingPlan greedy = new GreedyRefuelPlanner().plan(stations, 560_000.0d, DIESEL, vehicle);

            assertEquals(List.of("A", "C"), minimal.stations().stream().map(CandidateStation::id).toList());
            assertEquals(15.0d, minimal.stops().get(0).litersPurchased(), 1e-9);
            assertEquals(36.0d, minimal.stops().get(1).litersPurchased(), 1e-9);
            assertEquals(87.0d, minimal.totalCost(), 1e-9);
            assertEquals(List.of("A", "C"), greedy.stations().stream().map(CandidateStation::id).toList());
            assertEquals(37.5d, greedy.stops().get(0).litersPurchased(), 1e-9);
            assertEquals(67.5d, greedy.totalCost(), 1e-9);
            PlanAssertions.assertFeasible(minimal, vehicle, 5.0d);
            PlanAssertions.assertFeasible(greedy, vehicle, 5.0d);
        }
    }

    /**
     * Stations ordered by position; prices decrease along the route, or are all equal.
     */
    private static List<CandidateStation> randomStations(Random random, int count, double routeMeters, boolean uniform) {
        List<Double> positions = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            positions.add(random.nextDouble() * routeMeters / 1000.0d);
        }
        positions.sort(Comparator.naturalOrder());
        List<CandidateStation> stations = new ArrayList<>();
        double price = 1.30d + random.nextDouble() * 0.40d;
        for (int i = 0; i < count; i++) {
            stations.add(candidate("s" + i, positions.get(i), uniform ? 1.50d : price));
            price -= random.nextDouble() * 0.03d;
        }
        return stations;
    }

    /**
     * Minimum cost over every ordered subset of stations, buying at each stop exactly what
     * the next leg needs to arrive with the reserve.
     */
    private static double exhaustiveOptimum(List<CandidateStation> stations, double routeMeters,
                                            VehicleProfile vehicle, double reserve) {
        int n = stations.size();
        double best = Double.POSITIVE_INFINITY;
        for (int mask = 0; mask < (1 << n); mask++) {
            double fuel = vehicle.getInitialFuelLiters();
            double previous = 0.0d;
            double cost = 0.0d;
            boolean feasible = true;
            List<CandidateStation> chosen = new ArrayList<>();
            for (int i = 0; i < n; i++) {
                if ((mask & (1 << i)) != 0) {
                    chosen.add(stations.get(i));
                }
            }
            for (int k = 0; k < chosen.size() && feasible; k++) {
                CandidateStation stop = chosen.get(k);
                fuel -= vehicle.litersFor(stop.distanceAlongMeters() - previous);
                previous = stop.distanceAlongMeters();
                if (fuel + EPSILON < reserve) {
                    feasible = false;
                    break;
                }
                double next = k + 1 < chosen.size() ? chosen.get(k + 1).distanceAlongMeters() : routeMeters;
                double target = vehicle.litersFor(next - previous) + reserve;
                double buy = Math.max(0.0d, target - fuel);
                if (buy > EPSILON && target > vehicle.getTankCapacityLiters() + EPSILON) {
                    feasible = false;
                    break;
                }
                cost += buy * stop.requirePrice(DIESEL);
                fuel += buy;
            }
            if (!feasible) {
                continue;
            }
            fuel -= vehicle.litersFor(routeMeters - previous);
            if (fuel + EPSILON >= reserve) {
                best = Math.min(best, cost);
            }
        }
        return best;
    }
}
