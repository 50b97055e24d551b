package org.fuelroute.station;

import org.fuelroute.core.FuelRouteException;

/**
 * Thrown when no endpoint of the price listing could be read.
 */
public final class PriceSourceException extends FuelRouteException {
    public static final String REASON_UNAVAILABLE = "PRICE_SOURCE_UNAVAILABLE";
    public static final String REASON_EMPTY = "PRICE_SOURCE_EMPTY";

    public PriceSourceException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public PriceSourceException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
