package org.fuelroute.export;

import org.fuelroute.geometry.GeoPoint;
import org.fuelroute.ingestion.GpxDocument;
import org.fuelroute.planner.RefuelStop;
import org.fuelroute.station.CandidateStation;
import org.fuelroute.station.FuelType;

import java.util.Locale;
import java.util.Objects;

/**
 * A selected stop with the metadata carried by its GPX marker.
 *
 * @param liters planned purchase, zero when the stop comes from ranking rather than planning.
 */
public record StopWaypoint(GeoPoint location, String name, double pricePerLiter, double liters, double cost) {
    public static final String FUEL_SYMBOL = "Fuel";

    public StopWaypoint {
        Objects.requireNonNull(location, "location");
        name = name == null || name.isBlank() ? "Station" : name;
    }

    public static StopWaypoint of(CandidateStation station, FuelType fuelType) {
        return new StopWaypoint(station.location(), station.name(),
                station.price(fuelType).orElse(0.0d), 0.0d, 0.0d);
    }

    public static StopWaypoint of(RefuelStop stop) {
        CandidateStation station = stop.station();
        return new StopWaypoint(station.location(), station.name(), stop.pricePerLiter(), stop.litersPurchased(), stop.cost());
    }

    /**
     * GPX marker numbered from 1 in itinerary order.
     */
    public GpxDocument.Waypoint toGpxWaypoint(int ordinal) {
        String label;
        String description;
        if (liters > 0.0d) {
            label = String.format(Locale.ROOT, "%d. %s | %.1f L @ %.3f EUR/L = %.2f EUR",
                    ordinal, name, liters, pricePerLiter, cost);
            description = String.format(Locale.ROOT, "Refuel at %s. Price %.3f EUR/L. Estimated cost %.2f EUR.",
                    name, pricePerLiter, cost);
        } else {
            label = String.format(Locale.ROOT, "%d. %s | %.3f EUR/L", ordinal, name, pricePerLiter);
            description = String.format(Locale.ROOT, "Station %s. Price %.3f EUR/L.", name, pricePerLiter);
        }
        return new GpxDocument.Waypoint(location, label, description, FUEL_SYMBOL);
    }
}
