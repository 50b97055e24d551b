package org.fuelroute.ingestion;

import org.fuelroute.core.FuelRouteException;

/**
 * Raised when a track cannot be read or is unsafe to process.
 */
public final class TrackValidationException extends FuelRouteException {
    public static final String REASON_TOO_MANY_POINTS = "TRACK_TOO_MANY_POINTS";
    public static final String REASON_OUT_OF_REGION = "TRACK_OUT_OF_REGION";
    public static final String REASON_TOO_SHORT = "TRACK_TOO_SHORT";
    public static final String REASON_UNREADABLE = "TRACK_UNREADABLE";

    public TrackValidationException(String reasonCode, String message) {
        super(reasonCode, message);
    }

    public TrackValidationException(String reasonCode, String message, Throwable cause) {
        super(reasonCode, message, cause);
    }
}
