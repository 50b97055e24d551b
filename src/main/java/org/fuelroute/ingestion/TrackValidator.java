package org.fuelroute.ingestion;

import lombok.extern.slf4j.Slf4j;
import org.fuelroute.geometry.GeoPath;
import org.fuelroute.geometry.GeoPoint;

import java.util.Locale;
import java.util.Objects;

/**
 * Safety checks run on a track before the pipeline starts.
 */
@Slf4j
public final class TrackValidator {
    public static final int DEFAULT_MAX_POINTS = 50_000;

    private final int maxPoints;
    private final RegionBounds region;

    public TrackValidator(int maxPoints, RegionBounds region) {
        if (maxPoints < 2) {
            throw new IllegalArgumentException("maxPoints must be >= 2, got " + maxPoints);
        }
        this.maxPoints = maxPoints;
        this.region = Objects.requireNonNull(region, "region");
    }

    public static TrackValidator defaults() {
        return new TrackValidator(DEFAULT_MAX_POINTS, RegionBounds.SPAIN);
    }

    /**
     * @throws TrackValidationException when the track has more than {@code maxPoints} vertices
     *                                  or its vertex centroid falls outside the region.
     */
    public void validate(GeoPath path) {
        validate(path, maxPoints, region);
    }

    public static void validate(GeoPath path, int maxPoints, RegionBounds region) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(region, "region");
        if (path.size() > maxPoints) {
            throw new TrackValidationException(
                    TrackValidationException.REASON_TOO_MANY_POINTS,
                    "track has " + path.size() + " points, maximum allowed is " + maxPoints
                            + "; simplify the track before loading it"
            );
        }
        GeoPoint centroid = path.centroid();
        if (!region.contains(centroid)) {
            throw new TrackValidationException(
                    TrackValidationException.REASON_OUT_OF_REGION,
                    String.format(Locale.ROOT,
                            "track centroid (lat=%.3f, lon=%.3f) lies outside the supported region %s",
                            centroid.latitude(), centroid.longitude(), region.name())
            );
        }
        log.debug("Track accepted: {} points, centroid {}", path.size(), centroid);
    }

    public int maxPoints() {
        return maxPoints;
    }

    public RegionBounds region() {
        return region;
    }
}
