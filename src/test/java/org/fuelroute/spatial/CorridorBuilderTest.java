package org.fuelroute.spatial;

import org.fuelroute.geometry.GeoPath;
import org.fuelroute.geometry.GeoPoint;
import org.fuelroute.geometry.ProjectionException;
import org.fuelroute.testutil.FuelRouteFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Point;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("CorridorBuilder Tests")
class CorridorBuilderTest {
    private final CorridorBuilder builder = CorridorBuilder.utm30N();

    @Test
    @DisplayName("Buffer is measured in meters: stadium area of a straight route")
    void testStadiumArea() {
        GeoPath route = FuelRouteFixtures.straightRoute(100.0d, 11);
        Corridor corridor = builder.build(route, 5_000.0d);

        double expectedKm2 = 2.0d * 5.0d * 100.0d + Math.PI * 25.0d;
        assertEquals(expectedKm2, corridor.areaSquareKm(), expectedKm2 * 0.01d);
        assertEquals(5_000.0d, corridor.radiusMeters(), 0.0d);
        assertEquals(route, corridor.path());
    }

    @Test
    @DisplayName("Interior points are contained and points beyond the radius are not")
    void testContainment() {
        Corridor corridor = builder.build(FuelRouteFixtures.straightRoute(100.0d, 11), 5_000.0d);

        assertTrue(corridor.containsProperly(metricPoint(corridor, FuelRouteFixtures.besideRoute(50.0d, 4.5d))));
        assertFalse(corridor.containsProperly(metricPoint(corridor, FuelRouteFixtures.besideRoute(50.0d, 5.5d))));
        assertFalse(corridor.containsProperly(metricPoint(corridor, FuelRouteFixtures.onRoute(106.0d))));
    }

    @Test
    @DisplayName("Non-positive radii and paths outside the projection are refused")
    void testInvalidInput() {
        GeoPath route = FuelRouteFixtures.straightRoute(10.0d, 3);
        assertThrows(IllegalArgumentException.class, () -> builder.build(route, 0.0d));
        assertThrows(IllegalArgumentException.class, () -> builder.build(route, -1.0d));
        assertThrows(IllegalArgumentException.class, () -> builder.build(route, Double.NaN));

        GeoPath tokyo = GeoPath.of(List.of(new GeoPoint(35.68d, 139.76d), new GeoPoint(35.70d, 139.80d)));
        assertThrows(ProjectionException.class, () -> builder.build(tokyo, 1_000.0d));
    }

    static Point metricPoint(Corridor corridor, GeoPoint point) {
        return corridor.polygon().getFactory().createPoint(corridor.projector().projection().toMetric(point));
    }
}
