package org.fuelroute.geometry;

import org.fuelroute.testutil.FuelRouteFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.GeometryFactory;

import static org.junit.jupiter.api.Assertions.assertEquals;

@DisplayName("PathProjector Tests")
class PathProjectorTest {
    private final GeoPath route = FuelRouteFixtures.straightRoute(100.0d, 51);
    private final PathProjector projector = PathProjector.of(route, MetricProjection.utm30N(), new GeometryFactory());

    @Test
    @DisplayName("Projected length matches the geodesic length")
    void testLength() {
        assertEquals(route.lengthMeters(), projector.lengthMeters(), route.lengthMeters() * 0.001d);
        assertEquals(100_000.0d, projector.lengthMeters(), 200.0d);
    }

    @Test
    @DisplayName("Off-path points project to the along distance of their foot point")
    void testAlongDistance() {
        assertEquals(30_000.0d, projector.alongDistanceMeters(FuelRouteFixtures.onRoute(30.0d)), 100.0d);
        assertEquals(30_000.0d, projector.alongDistanceMeters(FuelRouteFixtures.besideRoute(30.0d, 3.0d)), 100.0d);
        assertEquals(0.0d, projector.alongDistanceMeters(FuelRouteFixtures.onRoute(-5.0d)), 1e-6);
        assertEquals(projector.lengthMeters(),
                projector.alongDistanceMeters(FuelRouteFixtures.onRoute(120.0d)), 1e-6);
    }

    @Test
    @DisplayName("Point lookup clamps to the path ends")
    void testPointAtClamps() {
        assertEquals(route.first().latitude(), projector.pointAt(-10.0d).latitude(), 1e-7);
        assertEquals(route.last().latitude(), projector.pointAt(1e9).latitude(), 1e-7);
    }

    @Test
    @DisplayName("Nearest path point lies on the route meridian")
    void testNearestPointOnPath() {
        GeoPoint nearest = projector.nearestPointOnPath(FuelRouteFixtures.besideRoute(42.0d, 2.0d));
        assertEquals(FuelRouteFixtures.ROUTE_LONGITUDE, nearest.longitude(), 1e-3);
        assertEquals(FuelRouteFixtures.onRoute(42.0d).latitude(), nearest.latitude(), 1e-3);
    }
}
