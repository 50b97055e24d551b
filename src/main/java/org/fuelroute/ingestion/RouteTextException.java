package org.fuelroute.ingestion;

import org.fuelroute.core.FuelRouteException;

/**
 * Raised when a route between two place names cannot be built.
 */
public final class RouteTextException extends FuelRouteException {
    public static final String REASON_GEOCODE_NOT_FOUND = "GEOCODE_NOT_FOUND";
    public static final String REASON_GEOCODE_FAILED = "GEOCODE_FAILED";
    public static final String REASON_ROUTE_NOT_FOUND = "ROUTE_NOT_FOUND";
    public static final String REASON_ROUTE_UNAVAILABLE = "ROUTE_UNAVAILABLE";

    public RouteTextException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public RouteTextException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
