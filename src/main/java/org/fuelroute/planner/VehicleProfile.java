package org.fuelroute.planner;

import lombok.Builder;
import lombok.Value;

/**
 * Tank and consumption figures of the vehicle being planned for.
 */
@Value
@Builder
public class VehicleProfile {
    double tankCapacityLiters;
    /**
     * Liters per 100 km.
     */
    double consumptionLitersPer100Km;
    double initialFuelLiters;

    /**
     * Profile starting with {@code initialFraction} of a full tank.
     */
    public static VehicleProfile of(double tankCapacityLiters, double consumptionLitersPer100Km, double initialFraction) {
        return builder()
                .tankCapacityLiters(tankCapacityLiters)
                .consumptionLitersPer100Km(consumptionLitersPer100Km)
                .initialFuelLiters(tankCapacityLiters * initialFraction)
                .build()
                .validate();
    }

    public VehicleProfile validate() {
        if (!Double.isFinite(tankCapacityLiters) || tankCapacityLiters <= 0.0d) {
            throw new IllegalArgumentException("tankCapacityLiters must be finite and > 0, got " + tankCapacityLiters);
        }
        if (!Double.isFinite(consumptionLitersPer100Km) || consumptionLitersPer100Km <= 0.0d) {
            throw new IllegalArgumentException(
                    "consumptionLitersPer100Km must be finite and > 0, got " + consumptionLitersPer100Km);
        }
        if (!Double.isFinite(initialFuelLiters) || initialFuelLiters < 0.0d || initialFuelLiters > tankCapacityLiters) {
            throw new IllegalArgumentException(
                    "initialFuelLiters must be within [0, tankCapacityLiters], got " + initialFuelLiters);
        }
        return this;
    }

    public double litersFor(double meters) {
        return meters / 100_000.0d * consumptionLitersPer100Km;
    }

    public double metersOn(double liters) {
        return liters / consumptionLitersPer100Km * 100_000.0d;
    }

    public double initialRangeMeters() {
        return metersOn(initialFuelLiters);
    }

    public double fullTankRangeMeters() {
        return metersOn(tankCapacityLiters);
    }
}
