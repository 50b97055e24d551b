package org.fuelroute.pipeline;

import lombok.Builder;
import lombok.Value;
import org.fuelroute.export.MapUrlBuilder;
import org.fuelroute.export.TrackSplicer;
import org.fuelroute.ingestion.NominatimGeocoder;
import org.fuelroute.ingestion.RegionBounds;
import org.fuelroute.ingestion.TrackValidator;
import org.fuelroute.planner.PlannerConfig;
import org.fuelroute.planner.PlanningStrategy;
import org.fuelroute.ranking.RankingRequest;
import org.fuelroute.routing.OsrmRoutingClient;
import org.fuelroute.station.CachedPriceSource;
import org.fuelroute.station.FuelType;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;

/**
 * Runtime configuration bound once when a {@link FuelRoutePipeline} is created.
 *
 * <p>Every field has a default; {@link #fromProperties(Properties)} overrides the defaults
 * from {@code fuelroute.*} keys.</p>
 */
@Value
@Builder(toBuilder = true)
public class FuelRouteConfig {
    public static final String PREFIX = "fuelroute.";

    public static final double DEFAULT_BUFFER_METERS = 5_000.0d;
    public static final double DEFAULT_SIMPLIFY_TOLERANCE_DEGREES = 0.0005d;

    /**
     * Corridor radius around the simplified path.
     */
    @Builder.Default
    double bufferMeters = DEFAULT_BUFFER_METERS;
    /**
     * Douglas-Peucker tolerance, in degrees.
     */
    @Builder.Default
    double simplifyToleranceDegrees = DEFAULT_SIMPLIFY_TOLERANCE_DEGREES;
    @Builder.Default
    int topN = RankingRequest.DEFAULT_TOP_N;
    /**
     * Mandatory-stop bin length; zero disables segmented ranking.
     */
    @Builder.Default
    double segmentKm = 0.0d;
    @Builder.Default
    FuelType fuelType = FuelType.GASOLEO_A;

    @Builder.Default
    boolean enrichDetours = true;
    @Builder.Default
    int detourWorkers = 3;
    @Builder.Default
    int breakerThreshold = 3;

    @Builder.Default
    Duration enrichmentTimeout = OsrmRoutingClient.DEFAULT_SUMMARY_TIMEOUT;
    @Builder.Default
    Duration legTimeout = OsrmRoutingClient.DEFAULT_LEG_TIMEOUT;
    @Builder.Default
    Duration routeTimeout = OsrmRoutingClient.DEFAULT_ROUTE_TIMEOUT;
    @Builder.Default
    Duration geocodeTimeout = NominatimGeocoder.DEFAULT_TIMEOUT;
    @Builder.Default
    Duration geocodeCourtesyDelay = NominatimGeocoder.DEFAULT_COURTESY_DELAY;
    @Builder.Default
    Duration priceCacheTtl = CachedPriceSource.DEFAULT_TTL;

    @Builder.Default
    double reserveFraction = PlannerConfig.DEFAULT_RESERVE_FRACTION;
    @Builder.Default
    double greedySafetyMargin = PlannerConfig.DEFAULT_GREEDY_SAFETY_MARGIN;
    @Builder.Default
    PlanningStrategy planningStrategy = PlanningStrategy.COST_MINIMAL;

    @Builder.Default
    int maxWaypoints = MapUrlBuilder.DEFAULT_MAX_WAYPOINTS;
    @Builder.Default
    double reentryThresholdMeters = TrackSplicer.DEFAULT_REENTRY_THRESHOLD_METERS;
    @Builder.Default
    int maxReentryScan = TrackSplicer.DEFAULT_MAX_REENTRY_SCAN;

    @Builder.Default
    int maxTrackPoints = TrackValidator.DEFAULT_MAX_POINTS;
    @Builder.Default
    RegionBounds region = RegionBounds.SPAIN;

    public static FuelRouteConfig defaults() {
        return builder().build();
    }

    /**
     * Reads {@code fuelroute.*} keys over the defaults. Missing keys keep their default.
     *
     * @throws IllegalArgumentException when a present key cannot be parsed.
     */
    public static FuelRouteConfig fromProperties(Properties properties) {
        Objects.requireNonNull(properties, "properties");
        FuelRouteConfig defaults = defaults();
        PropertyReader reader = new PropertyReader(properties);
        return builder()
                .bufferMeters(reader.decimal("buffer.meters", defaults.bufferMeters))
                .simplifyToleranceDegrees(reader.decimal("simplify.tolerance.degrees", defaults.simplifyToleranceDegrees))
                .topN(reader.integer("ranking.top-n", defaults.topN))
                .segmentKm(reader.decimal("ranking.segment-km", defaults.segmentKm))
                .fuelType(reader.fuelType("fuel-type", defaults.fuelType))
                .enrichDetours(reader.bool("enrichment.enabled", defaults.enrichDetours))
                .detourWorkers(reader.integer("enrichment.workers", defaults.detourWorkers))
                .breakerThreshold(reader.integer("enrichment.breaker-threshold", defaults.breakerThreshold))
                .enrichmentTimeout(reader.millis("enrichment.timeout-ms", defaults.enrichmentTimeout))
                .legTimeout(reader.millis("routing.leg-timeout-ms", defaults.legTimeout))
                .routeTimeout(reader.millis("routing.route-timeout-ms", defaults.routeTimeout))
                .geocodeTimeout(reader.millis("geocode.timeout-ms", defaults.geocodeTimeout))
                .geocodeCourtesyDelay(reader.millis("geocode.delay-ms", defaults.geocodeCourtesyDelay))
                .priceCacheTtl(reader.millis("prices.cache-ttl-ms", defaults.priceCacheTtl))
                .reserveFraction(reader.decimal("planner.reserve-fraction", defaults.reserveFraction))
                .greedySafetyMargin(reader.decimal("planner.greedy-safety-margin", defaults.greedySafetyMargin))
                .planningStrategy(reader.strategy("planner.strategy", defaults.planningStrategy))
                .maxWaypoints(reader.integer("export.max-waypoints", defaults.maxWaypoints))
                .reentryThresholdMeters(reader.decimal("export.reentry-threshold-meters", defaults.reentryThresholdMeters))
                .maxReentryScan(reader.integer("export.max-reentry-scan", defaults.maxReentryScan))
                .maxTrackPoints(reader.integer("track.max-points", defaults.maxTrackPoints))
                .build()
                .validate();
    }

    /**
     * @throws IllegalArgumentException when a field is out of range.
     */
    public FuelRouteConfig validate() {
        if (!Double.isFinite(bufferMeters) || bufferMeters <= 0.0d) {
            throw new IllegalArgumentException("bufferMeters must be finite and > 0, got " + bufferMeters);
        }
        if (!Double.isFinite(simplifyToleranceDegrees) || simplifyToleranceDegrees < 0.0d) {
            throw new IllegalArgumentException(
                    "simplifyToleranceDegrees must be finite and >= 0, got " + simplifyToleranceDegrees);
        }
        Objects.requireNonNull(fuelType, "fuelType");
        Objects.requireNonNull(planningStrategy, "planningStrategy");
        Objects.requireNonNull(region, "region");
        RankingRequest.of(fuelType, topN, segmentKm).validate();
        plannerConfig().validate();
        requirePositive(detourWorkers, "detourWorkers");
        requirePositive(breakerThreshold, "breakerThreshold");
        requirePositive(maxWaypoints, "maxWaypoints");
        requirePositive(maxReentryScan, "maxReentryScan");
        requirePositive(maxTrackPoints, "maxTrackPoints");
        requirePositive(enrichmentTimeout, "enrichmentTimeout");
        requirePositive(legTimeout, "legTimeout");
        requirePositive(routeTimeout, "routeTimeout");
        requirePositive(geocodeTimeout, "geocodeTimeout");
        requirePositive(priceCacheTtl, "priceCacheTtl");
        Objects.requireNonNull(geocodeCourtesyDelay, "geocodeCourtesyDelay");
        if (geocodeCourtesyDelay.isNegative()) {
            throw new IllegalArgumentException("geocodeCourtesyDelay must be >= 0, got " + geocodeCourtesyDelay);
        }
        if (!Double.isFinite(reentryThresholdMeters) || reentryThresholdMeters < 0.0d) {
            throw new IllegalArgumentException(
                    "reentryThresholdMeters must be finite and >= 0, got " + reentryThresholdMeters);
        }
        return this;
    }

    public PlannerConfig plannerConfig() {
        return PlannerConfig.builder()
                .reserveFraction(reserveFraction)
                .greedySafetyMargin(greedySafetyMargin)
                .build();
    }

    private static void requirePositive(int value, String name) {
        if (value < 1) {
            throw new IllegalArgumentException(name + " must be >= 1, got " + value);
        }
    }

    private static void requirePositive(Duration value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be > 0, got " + value);
        }
    }

    private static final class PropertyReader {
        private final Properties properties;

        private PropertyReader(Properties properties) {
            this.properties = properties;
        }

        private String raw(String key) {
            String value = properties.getProperty(PREFIX + key);
            return value == null || value.isBlank() ? null : value.trim();
        }

        private double decimal(String key, double fallback) {
            String value = raw(key);
            if (value == null) {
                return fallback;
            }
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException ex) {
                throw invalid(key, value, ex);
            }
        }

        private int integer(String key, int fallback) {
            String value = raw(key);
            if (value == null) {
                return fallback;
            }
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException ex) {
                throw invalid(key, value, ex);
            }
        }

        private Duration millis(String key, Duration fallback) {
            String value = raw(key);
            if (value == null) {
                return fallback;
            }
            try {
                return Duration.ofMillis(Long.parseLong(value));
            } catch (NumberFormatException ex) {
                throw invalid(key, value, ex);
            }
        }

        private boolean bool(String key, boolean fallback) {
            String value = raw(key);
            if (value == null) {
                return fallback;
            }
            if ("true".equalsIgnoreCase(value)) {
                return true;
            }
            if ("false".equalsIgnoreCase(value)) {
                return false;
            }
            throw invalid(key, value, null);
        }

        private FuelType fuelType(String key, FuelType fallback) {
            String value = raw(key);
            return value == null ? fallback : FuelType.fromLabel(value);
        }

        private PlanningStrategy strategy(String key, PlanningStrategy fallback) {
            String value = raw(key);
            return value == null ? fallback : PlanningStrategy.fromId(value);
        }

        private static IllegalArgumentException invalid(String key, String value, Exception cause) {
            return new IllegalArgumentException("invalid value for " + PREFIX + key + ": " + value, cause);
        }
    }
}
