package org.fuelroute.station;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.fuelroute.core.FuelRouteException;

import java.util.List;

/**
 * Thrown when a requested fuel type does not match any published price column.
 */
@Getter
@Accessors(fluent = true)
public final class UnknownFuelTypeException extends FuelRouteException {
    public static final String REASON_UNKNOWN_FUEL_TYPE = "UNKNOWN_FUEL_TYPE";

    private final List<String> availableLabels;

    public UnknownFuelTypeException(String requested, List<String> availableLabels) {
        super(REASON_UNKNOWN_FUEL_TYPE, "fuel type '" + requested + "' not found; available: " + availableLabels);
        this.availableLabels = List.copyOf(availableLabels);
    }
}
