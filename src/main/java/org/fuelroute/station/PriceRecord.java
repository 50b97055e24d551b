package org.fuelroute.station;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.experimental.Accessors;
import org.fuelroute.geometry.GeoPoint;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * One refueling point from the price listing.
 *
 * <p>Immutable. Identity is the listing id; prices are absent for fuels the station
 * does not sell.</p>
 */
@Getter
@Accessors(fluent = true)
public final class PriceRecord {
    private final String id;
    private final GeoPoint location;
    private final String name;
    private final String address;
    private final String municipality;
    private final String province;
    private final String openingHours;
    private final Map<FuelType, Double> prices;

    @Builder
    private PriceRecord(
            String id,
            GeoPoint location,
            String name,
            String address,
            String municipality,
            String province,
            String openingHours,
            @Singular("price") Map<FuelType, Double> prices
    ) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must be non-blank");
        }
        Objects.requireNonNull(location, "location");
        if (location.isNullIsland()) {
            throw new IllegalArgumentException("location must not be (0, 0) for station " + id);
        }
        EnumMap<FuelType, Double> copy = new EnumMap<>(FuelType.class);
        for (Map.Entry<FuelType, Double> entry : prices.entrySet()) {
            Double value = entry.getValue();
            if (value == null) {
                continue;
            }
            if (!Double.isFinite(value) || value < 0.0d) {
                throw new IllegalArgumentException(
                        "price for " + entry.getKey() + " must be finite and >= 0 at station " + id + ", got " + value);
            }
            copy.put(Objects.requireNonNull(entry.getKey(), "fuel type"), value);
        }
        this.id = id;
        this.location = location;
        this.name = name == null ? "" : name;
        this.address = address == null ? "" : address;
        this.municipality = municipality == null ? "" : municipality;
        this.province = province == null ? "" : province;
        this.openingHours = openingHours == null ? "" : openingHours;
        this.prices = Collections.unmodifiableMap(copy);
    }

    /**
     * Price of {@code fuelType}, empty when the station does not sell it.
     */
    public OptionalDouble price(FuelType fuelType) {
        Double value = prices.get(fuelType);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    /**
     * True when the station publishes a strictly positive price for {@code fuelType}.
     */
    public boolean sells(FuelType fuelType) {
        Double value = prices.get(fuelType);
        return value != null && value > 0.0d;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PriceRecord)) {
            return false;
        }
        return id.equals(((PriceRecord) other).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "PriceRecord[id=" + id + ", name=" + name + ", municipality=" + municipality + ", location=" + location + "]";
    }
}
