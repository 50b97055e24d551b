package org.fuelroute.geometry;

import lombok.experimental.UtilityClass;
import net.sf.geographiclib.Geodesic;

import java.util.List;
import java.util.Objects;

/**
 * Numeric helpers for distances between geographic coordinates.
 *
 * <p>Path lengths are always computed with the WGS84 inverse geodesic. The haversine
 * variant is only used for cheap straight-line estimates.</p>
 */
@UtilityClass
public class GeometryDistance {
    private static final double EARTH_MEAN_RADIUS_METERS = 6_371_008.8d;

    /**
     * Computes the WGS84 ellipsoidal distance in meters between two points.
     */
    public static double geodesicDistanceMeters(GeoPoint from, GeoPoint to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        return Geodesic.WGS84.Inverse(from.latitude(), from.longitude(), to.latitude(), to.longitude()).s12;
    }

    /**
     * Sums inverse geodesic distances over consecutive vertices.
     */
    public static double geodesicLengthMeters(List<GeoPoint> points) {
        Objects.requireNonNull(points, "points");
        double total = 0.0d;
        for (int i = 1; i < points.size(); i++) {
            total += geodesicDistanceMeters(points.get(i - 1), points.get(i));
        }
        return total;
    }

    /**
     * Computes great-circle distance in meters using haversine formulation.
     */
    public static double greatCircleDistanceMeters(GeoPoint from, GeoPoint to) {
        double lat1Rad = Math.toRadians(from.latitude());
        double lat2Rad = Math.toRadians(to.latitude());
        double deltaLatRad = Math.toRadians(to.latitude() - from.latitude());
        double deltaLonRad = Math.toRadians(normalizeDeltaLongitudeDegrees(to.longitude() - from.longitude()));

        double sinHalfLat = Math.sin(deltaLatRad * 0.5d);
        double sinHalfLon = Math.sin(deltaLonRad * 0.5d);

        double a = sinHalfLat * sinHalfLat
                + Math.cos(lat1Rad) * Math.cos(lat2Rad) * sinHalfLon * sinHalfLon;
        double c = 2.0d * Math.asin(Math.sqrt(Math.min(1.0d, Math.max(0.0d, a))));
        return EARTH_MEAN_RADIUS_METERS * c;
    }

    /**
     * Normalizes delta-longitude into the principal range {@code (-180, 180]}.
     */
    static double normalizeDeltaLongitudeDegrees(double deltaLonDeg) {
        double normalized = ((deltaLonDeg + 540.0d) % 360.0d) - 180.0d;
        if (normalized == -180.0d) {
            return 180.0d;
        }
        return normalized;
    }
}
