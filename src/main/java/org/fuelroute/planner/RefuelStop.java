package org.fuelroute.planner;

import org.fuelroute.station.CandidateStation;

import java.util.Objects;

/**
 * One purchase of a refueling plan.
 *
 * @param fuelOnArrivalLiters tank level when reaching the station.
 * @param fuelOnDepartureLiters tank level after the purchase.
 */
public record RefuelStop(
        CandidateStation station,
        double litersPurchased,
        double pricePerLiter,
        double cost,
        double fuelOnArrivalLiters,
        double fuelOnDepartureLiters
) {
    public RefuelStop {
        Objects.requireNonNull(station, "station");
        if (!(litersPurchased >= 0.0d) || !(pricePerLiter >= 0.0d) || !(cost >= 0.0d)) {
            throw new IllegalArgumentException("liters, price and cost must be >= 0 at station " + station.id());
        }
    }

    public double distanceAlongMeters() {
        return station.distanceAlongMeters();
    }
}
