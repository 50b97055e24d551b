package org.fuelroute.ingestion;

import org.fuelroute.geometry.GeoPoint;

/**
 * Resolves a free-text place name to one best-match coordinate.
 */
@FunctionalInterface
public interface Geocoder {

    /**
     * @throws RouteTextException with {@code GEOCODE_NOT_FOUND} when nothing matches, or
     *                            {@code GEOCODE_FAILED} when the lookup itself fails.
     */
    GeoPoint geocode(String place);
}
