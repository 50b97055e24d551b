package org.fuelroute.testutil;

import org.fuelroute.geometry.GeoPoint;
import org.fuelroute.routing.RouteGeometry;
import org.fuelroute.routing.RouteSummary;
import org.fuelroute.routing.RoutingService;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;

/**
 * Programmable {@link RoutingService} counting the calls it receives.
 */
public final class StubRoutingService implements RoutingService {
    private final BiFunction<GeoPoint, GeoPoint, Optional<RouteGeometry>> routes;
    private final BiFunction<GeoPoint, GeoPoint, Optional<RouteSummary>> summaries;
    private final AtomicInteger routeCalls = new AtomicInteger();
    private final AtomicInteger legCalls = new AtomicInteger();
    private final AtomicInteger summaryCalls = new AtomicInteger();

    public StubRoutingService(
            BiFunction<GeoPoint, GeoPoint, Optional<RouteGeometry>> routes,
            BiFunction<GeoPoint, GeoPoint, Optional<RouteSummary>> summaries
    ) {
        this.routes = routes;
        this.summaries = summaries;
    }

    /**
     * Every call fails softly.
     */
    public static StubRoutingService unavailable() {
        return new StubRoutingService((from, to) -> Optional.empty(), (from, to) -> Optional.empty());
    }

    /**
     * Straight two-point legs and summaries of 1 km per call.
     */
    public static StubRoutingService straightLines() {
        return new StubRoutingService(
                (from, to) -> Optional.of(new RouteGeometry(List.of(from, to), new RouteSummary(1_000.0d, 60.0d))),
                (from, to) -> Optional.of(new RouteSummary(1_000.0d, 60.0d))
        );
    }

    @Override
    public Optional<RouteGeometry> route(GeoPoint from, GeoPoint to) {
        routeCalls.incrementAndGet();
        return routes.apply(from, to);
    }

    @Override
    public Optional<RouteGeometry> leg(GeoPoint from, GeoPoint to) {
        legCalls.incrementAndGet();
        return routes.apply(from, to);
    }

    @Override
    public Optional<RouteSummary> summary(GeoPoint from, GeoPoint to) {
        summaryCalls.incrementAndGet();
        return summaries.apply(from, to);
    }

    public int routeCalls() {
        return routeCalls.get();
    }

    public int legCalls() {
        return legCalls.get();
    }

    public int summaryCalls() {
        return summaryCalls.get();
    }
}
