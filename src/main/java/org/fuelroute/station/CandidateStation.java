package org.fuelroute.station;

import org.fuelroute.geometry.GeoPoint;
import org.fuelroute.geometry.GeometryDistance;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;

/**
 * A price record that fell inside the route corridor, positioned along the path.
 *
 * <p>Price and identity fields are fixed at construction. Enrichment fields (segment bin,
 * detour origin, road detour distance and duration) are appended later by the ranker and
 * the detour enricher; an unset detour means "unknown", never zero.</p>
 */
public final class CandidateStation {
    private final PriceRecord record;
    private final double distanceAlongMeters;

    private int segmentIndex = -1;
    private GeoPoint detourOrigin;
    private double detourDistanceMeters = Double.NaN;
    private double detourDurationSeconds = Double.NaN;

    public CandidateStation(PriceRecord record, double distanceAlongMeters) {
        this.record = Objects.requireNonNull(record, "record");
        if (!Double.isFinite(distanceAlongMeters) || distanceAlongMeters < 0.0d) {
            throw new IllegalArgumentException(
                    "distanceAlongMeters must be finite and >= 0, got " + distanceAlongMeters);
        }
        this.distanceAlongMeters = distanceAlongMeters;
    }

    public PriceRecord record() {
        return record;
    }

    public String id() {
        return record.id();
    }

    public String name() {
        return record.name();
    }

    public GeoPoint location() {
        return record.location();
    }

    public OptionalDouble price(FuelType fuelType) {
        return record.price(fuelType);
    }

    /**
     * Price of {@code fuelType}.
     *
     * @throws IllegalStateException when the station does not sell it.
     */
    public double requirePrice(FuelType fuelType) {
        return record.price(fuelType).orElseThrow(() -> new IllegalStateException(
                "station " + record.id() + " has no price for " + fuelType));
    }

    /**
     * Meters from the path start to the path point nearest this station.
     */
    public double distanceAlongMeters() {
        return distanceAlongMeters;
    }

    public double distanceAlongKm() {
        return distanceAlongMeters / 1000.0d;
    }

    public OptionalInt segmentIndex() {
        return segmentIndex < 0 ? OptionalInt.empty() : OptionalInt.of(segmentIndex);
    }

    public void assignSegmentIndex(int segmentIndex) {
        if (segmentIndex < 0) {
            throw new IllegalArgumentException("segmentIndex must be >= 0, got " + segmentIndex);
        }
        this.segmentIndex = segmentIndex;
    }

    /**
     * Point of the original path from which the detour to this station starts.
     */
    public Optional<GeoPoint> detourOrigin() {
        return Optional.ofNullable(detourOrigin);
    }

    public void assignDetourOrigin(GeoPoint detourOrigin) {
        this.detourOrigin = Objects.requireNonNull(detourOrigin, "detourOrigin");
    }

    public OptionalDouble detourDistanceMeters() {
        return Double.isNaN(detourDistanceMeters) ? OptionalDouble.empty() : OptionalDouble.of(detourDistanceMeters);
    }

    public OptionalDouble detourDurationSeconds() {
        return Double.isNaN(detourDurationSeconds) ? OptionalDouble.empty() : OptionalDouble.of(detourDurationSeconds);
    }

    public boolean hasRoadDetour() {
        return !Double.isNaN(detourDistanceMeters);
    }

    /**
     * Appends road-accurate detour figures.
     */
    public void recordRoadDetour(double distanceMeters, double durationSeconds) {
        if (!Double.isFinite(distanceMeters) || distanceMeters < 0.0d) {
            throw new IllegalArgumentException("distanceMeters must be finite and >= 0, got " + distanceMeters);
        }
        if (!Double.isFinite(durationSeconds) || durationSeconds < 0.0d) {
            throw new IllegalArgumentException("durationSeconds must be finite and >= 0, got " + durationSeconds);
        }
        this.detourDistanceMeters = distanceMeters;
        this.detourDurationSeconds = durationSeconds;
    }

    /**
     * Road detour when known, otherwise the straight-line distance from the detour origin.
     *
     * @return empty only when neither a road detour nor a detour origin is known.
     */
    public OptionalDouble detourDistanceOrEstimateMeters() {
        if (hasRoadDetour()) {
            return OptionalDouble.of(detourDistanceMeters);
        }
        if (detourOrigin == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(GeometryDistance.greatCircleDistanceMeters(detourOrigin, record.location()));
    }

    @Override
    public String toString() {
        return "CandidateStation[id=" + record.id()
                + ", name=" + record.name()
                + ", alongKm=" + String.format(Locale.ROOT, "%.3f", distanceAlongKm())
                + (segmentIndex >= 0 ? ", segment=" + segmentIndex : "")
                + "]";
    }
}
