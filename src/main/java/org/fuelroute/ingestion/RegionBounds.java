package org.fuelroute.ingestion;

import org.fuelroute.geometry.GeoPoint;

import java.util.Objects;

/**
 * Latitude/longitude box of the supported operating region.
 */
public record RegionBounds(String name, double minLatitude, double maxLatitude, double minLongitude, double maxLongitude) {
    /**
     * Peninsular Spain, Balearic and Canary Islands, Ceuta and Melilla.
     */
    public static final RegionBounds SPAIN = new RegionBounds("Spain", 27.6d, 44.0d, -18.2d, 4.3d);

    public RegionBounds {
        Objects.requireNonNull(name, "name");
        if (!(minLatitude < maxLatitude) || !(minLongitude < maxLongitude)) {
            throw new IllegalArgumentException("region bounds must satisfy min < max for both axes");
        }
    }

    /**
     * Strict containment: points on the border are outside.
     */
    public boolean contains(GeoPoint point) {
        Objects.requireNonNull(point, "point");
        return point.latitude() > minLatitude && point.latitude() < maxLatitude
                && point.longitude() > minLongitude && point.longitude() < maxLongitude;
    }
}
