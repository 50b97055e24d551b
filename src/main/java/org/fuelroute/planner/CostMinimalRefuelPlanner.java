package org.fuelroute.planner;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.fuelroute.station.CandidateStation;
import org.fuelroute.station.FuelType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

/**
 * Cost-minimal planner: Dijkstra over a DAG of refueling decisions.
 *
 * <p>Graph layout for {@code n} stations ordered by position:</p>
 * <ul>
 *     <li>node {@code 0}: route start with the initial fuel;</li>
 *     <li>nodes {@code 1..n}: station {@code i} reached with exactly the reserve left;</li>
 *     <li>nodes {@code n+1..2n}: station {@code i} reached straight from the start, with the
 *     initial fuel minus the first leg;</li>
 *     <li>node {@code 2n+1}: destination.</li>
 * </ul>
 * <p>A station-to-next edge buys exactly the fuel needed to arrive with the reserve, so every
 * edge carries a single purchase. Legs longer than the range of {@code capacity − reserve}
 * have no edge. All weights are non-negative.</p>
 * <p>The result is optimal among plans that buy only what each leg needs. Filling up at a
 * cheap station ahead of dearer ones is outside that space, so on rising prices the greedy
 * planner can come out cheaper.</p>
 */
@Slf4j
public final class CostMinimalRefuelPlanner implements RefuelPlanner {
    public static final String STRATEGY = "cost-minimal";

    private static final int START = 0;
    private static final int NO_PREDECESSOR = -1;

    private record FrontierState(int node, double cost) {
    }

    private final PlannerConfig config;

    public CostMinimalRefuelPlanner() {
        this(PlannerConfig.defaults());
    }

    public CostMinimalRefuelPlanner(PlannerConfig config) {
        this.config = Objects.requireNonNull(config, "config").validate();
    }

    @Override
    public RefuelingPlan plan(List<CandidateStation> candidates, double routeLengthMeters, FuelType fuelType, VehicleProfile vehicle) {
        Objects.requireNonNull(vehicle, "vehicle").validate();
        List<CandidateStation> stations = PlannerInputs.stationsOnRoute(candidates, routeLengthMeters, fuelType);
        int n = stations.size();
        int destination = 2 * n + 1;
        int nodeCount = destination + 1;

        double[] position = new double[n];
        double[] price = new double[n];
        for (int i = 0; i < n; i++) {
            position[i] = stations.get(i).distanceAlongMeters();
            price[i] = stations.get(i).requirePrice(fuelType);
        }
        double reserve = config.reserveLiters(vehicle);
        double initial = vehicle.getInitialFuelLiters();
        double maxLegMeters = vehicle.metersOn(vehicle.getTankCapacityLiters() - reserve);

        double[] best = new double[nodeCount];
        Arrays.fill(best, Double.POSITIVE_INFINITY);
        int[] predecessor = new int[nodeCount];
        Arrays.fill(predecessor, NO_PREDECESSOR);
        double[] litersIntoNode = new double[nodeCount];
        boolean[] settled = new boolean[nodeCount];

        PriorityQueue<FrontierState> frontier = new PriorityQueue<>(
                (left, right) -> Double.compare(left.cost(), right.cost()));
        best[START] = 0.0d;
        frontier.add(new FrontierState(START, 0.0d));

        while (!frontier.isEmpty()) {
            FrontierState state = frontier.poll();
            int node = state.node();
            if (settled[node] || state.cost() > best[node]) {
                continue;
            }
            settled[node] = true;
            if (node == destination) {
                break;
            }

            if (node == START) {
                for (int j = 0; j < n; j++) {
                    if (initial - vehicle.litersFor(position[j]) + PlannerInputs.EPSILON_LITERS >= reserve) {
                        relax(frontier, best, predecessor, litersIntoNode, START, directNode(j, n), 0.0d, 0.0d);
                    }
                }
                if (initial - vehicle.litersFor(routeLengthMeters) + PlannerInputs.EPSILON_LITERS >= reserve) {
                    relax(frontier, best, predecessor, litersIntoNode, START, destination, 0.0d, 0.0d);
                }
                continue;
            }

            int i = stationOf(node, n);
            double fuelHere = node <= n ? reserve : initial - vehicle.litersFor(position[i]);
            for (int j = i + 1; j < n; j++) {
                double leg = position[j] - position[i];
                if (leg > maxLegMeters) {
                    break;
                }
                double liters = vehicle.litersFor(leg) + reserve - fuelHere;
                if (liters > PlannerInputs.EPSILON_LITERS) {
                    relax(frontier, best, predecessor, litersIntoNode, node, reserveNode(j),
                            state.cost() + liters * price[i], liters);
                }
            }
            double finalLeg = routeLengthMeters - position[i];
            double finalLiters = vehicle.litersFor(finalLeg) + reserve - fuelHere;
            if (finalLeg <= maxLegMeters && finalLiters > PlannerInputs.EPSILON_LITERS) {
                relax(frontier, best, predecessor, litersIntoNode, node, destination,
                        state.cost() + finalLiters * price[i], finalLiters);
            }
        }

        if (!settled[destination]) {
            double furthest = furthestReachable(settled, position, n, vehicle, routeLengthMeters);
            throw new ImpossibleRouteException(furthest, routeLengthMeters,
                    "no chain of stations keeps every leg within " + Math.round(maxLegMeters / 1000.0d)
                            + " km while holding the reserve");
        }

        RefuelingPlan plan = reconstruct(stations, price, predecessor, litersIntoNode, destination, n, vehicle, routeLengthMeters);
        log.info("Cost-minimal plan: {} stops, {} L, cost {}",
                plan.stops().size(), Math.round(plan.totalLiters() * 10.0d) / 10.0d,
                Math.round(plan.totalCost() * 100.0d) / 100.0d);
        return plan;
    }

    private static void relax(
            PriorityQueue<FrontierState> frontier,
            double[] best,
            int[] predecessor,
            double[] litersIntoNode,
            int from,
            int to,
            double cost,
            double liters
    ) {
        if (cost < best[to]) {
            best[to] = cost;
            predecessor[to] = from;
            litersIntoNode[to] = liters;
            frontier.add(new FrontierState(to, cost));
        }
    }

    private static RefuelingPlan reconstruct(
            List<CandidateStation> stations,
            double[] price,
            int[] predecessor,
            double[] litersIntoNode,
            int destination,
            int n,
            VehicleProfile vehicle,
            double routeLengthMeters
    ) {
        IntArrayList chain = new IntArrayList();
        for (int node = destination; node != NO_PREDECESSOR; node = predecessor[node]) {
            chain.add(node);
        }

        List<RefuelStop> stops = new ArrayList<>();
        double fuel = vehicle.getInitialFuelLiters();
        double previous = 0.0d;
        for (int k = chain.size() - 1; k > 0; k--) {
            int node = chain.getInt(k);
            if (node == START) {
                continue;
            }
            int i = stationOf(node, n);
            CandidateStation station = stations.get(i);
            fuel -= vehicle.litersFor(station.distanceAlongMeters() - previous);
            previous = station.distanceAlongMeters();
            double liters = litersIntoNode[chain.getInt(k - 1)];
            stops.add(new RefuelStop(station, liters, price[i], liters * price[i], fuel, fuel + liters));
            fuel += liters;
        }
        double finalFuel = fuel - vehicle.litersFor(routeLengthMeters - previous);
        return new RefuelingPlan(STRATEGY, stops, routeLengthMeters, finalFuel);
    }

    private static double furthestReachable(boolean[] settled, double[] position, int n, VehicleProfile vehicle, double routeLengthMeters) {
        double furthest = vehicle.initialRangeMeters();
        for (int node = 1; node <= 2 * n; node++) {
            if (settled[node]) {
                furthest = Math.max(furthest, position[stationOf(node, n)] + vehicle.fullTankRangeMeters());
            }
        }
        return Math.min(furthest, routeLengthMeters);
    }

    private static int reserveNode(int station) {
        return 1 + station;
    }

    private static int directNode(int station, int n) {
        return 1 + n + station;
    }

    private static int stationOf(int node, int n) {
        return node <= n ? node - 1 : node - 1 - n;
    }
}
