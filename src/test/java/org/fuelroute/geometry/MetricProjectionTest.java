package org.fuelroute.geometry;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("MetricProjection Tests")
class MetricProjectionTest {
    private final MetricProjection utm30 = MetricProjection.utm30N();

    @Nested
    @DisplayName("Round trips")
    class RoundTrips {

        @Test
        @DisplayName("Forward then inverse returns within a centimeter across peninsular Spain")
        void testRoundTripPrecision() {
            Random random = new Random(17L);
            for (int i = 0; i < 500; i++) {
                GeoPoint point = new GeoPoint(36.0d + random.nextDouble() * 7.5d, -6.5d + random.nextDouble() * 7.0d);
                GeoPoint back = utm30.toGeographic(utm30.toMetric(point));
                assertTrue(GeometryDistance.geodesicDistanceMeters(point, back) < 0.01d,
                        "round trip drifted for " + point);
            }
        }

        @Test
        @DisplayName("Line reprojection keeps vertex count and order")
        void testLineRoundTrip() {
            GeoPath path = GeoPath.of(List.of(
                    new GeoPoint(40.0d, -3.7d),
                    new GeoPoint(40.5d, -3.2d),
                    new GeoPoint(41.0d, -2.9d)));
            LineString metric = utm30.toMetric(path, new GeometryFactory());
            GeoPath back = utm30.toGeographic(metric);

            assertEquals(3, metric.getNumPoints());
            for (int i = 0; i < path.size(); i++) {
                assertTrue(GeometryDistance.geodesicDistanceMeters(path.point(i), back.point(i)) < 0.01d);
            }
        }
    }

    @Test
    @DisplayName("Projected distances match geodesic distances near the central meridian")
    void testMetricDistances() {
        GeoPoint a = new GeoPoint(40.0d, -3.0d);
        GeoPoint b = new GeoPoint(40.09d, -2.95d);
        Coordinate ma = utm30.toMetric(a);
        Coordinate mb = utm30.toMetric(b);
        double geodesic = GeometryDistance.geodesicDistanceMeters(a, b);
        assertEquals(geodesic, ma.distance(mb), geodesic * 0.001d);
    }

    @Test
    @DisplayName("Points outside the area of use are rejected with a reason code")
    void testOutOfExtent() {
        ProjectionException ex = assertThrows(ProjectionException.class,
                () -> utm30.toMetric(new GeoPoint(60.0d, 30.0d)));
        assertEquals(ProjectionException.REASON_OUT_OF_EXTENT, ex.reasonCode());
    }

    @Test
    @DisplayName("Area of use is a defensive copy")
    void testAreaOfUseCopy() {
        utm30.areaOfUse().expandToInclude(100.0d, 80.0d);
        assertEquals(12.0d, utm30.areaOfUse().getMaxX(), 0.0d);
    }
}
