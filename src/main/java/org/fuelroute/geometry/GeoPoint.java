package org.fuelroute.geometry;

/**
 * Geographic WGS84 coordinate in decimal degrees.
 *
 * @param latitude latitude in {@code [-90, 90]}.
 * @param longitude longitude in {@code [-180, 180]}.
 */
public record GeoPoint(double latitude, double longitude) {

    public GeoPoint {
        if (!Double.isFinite(latitude) || latitude < -90.0d || latitude > 90.0d) {
            throw new IllegalArgumentException("latitude must be finite and within [-90, 90], got " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0d || longitude > 180.0d) {
            throw new IllegalArgumentException("longitude must be finite and within [-180, 180], got " + longitude);
        }
    }

    /**
     * Creates a point from {@code (longitude, latitude)} order, as used by GeoJSON and JTS.
     */
    public static GeoPoint ofLonLat(double longitude, double latitude) {
        return new GeoPoint(latitude, longitude);
    }

    /**
     * Returns true when this is the {@code (0, 0)} null-island placeholder some feeds emit.
     */
    public boolean isNullIsland() {
        return latitude == 0.0d && longitude == 0.0d;
    }
}
