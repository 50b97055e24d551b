package org.fuelroute.geometry;

import org.fuelroute.core.FuelRouteException;

/**
 * Thrown when a coordinate cannot be reprojected into or out of the metric CRS.
 */
public final class ProjectionException extends FuelRouteException {
    public static final String REASON_OUT_OF_EXTENT = "PROJECTION_OUT_OF_EXTENT";
    public static final String REASON_UNDEFINED = "PROJECTION_UNDEFINED";

    public ProjectionException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public ProjectionException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
