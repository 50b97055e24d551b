package org.fuelroute.routing;

import org.fuelroute.geometry.GeoPoint;

import java.util.Locale;
import java.util.Objects;

/**
 * One OSRM {@code route/v1/driving} endpoint with the geometry detail it is asked for.
 */
public record OsrmEndpoint(String name, String baseUrl, Overview overview) {
    public static final String PRIMARY_BASE_URL = "https://routing.openstreetmap.de/routed-car/route/v1/driving";
    public static final String DEMO_BASE_URL = "http://router.project-osrm.org/route/v1/driving";

    public enum Overview {
        FULL("full"),
        SIMPLIFIED("simplified"),
        NONE("false");

        private final String parameter;

        Overview(String parameter) {
            this.parameter = parameter;
        }

        public String parameter() {
            return parameter;
        }
    }

    public OsrmEndpoint {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(overview, "overview");
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
    }

    public static OsrmEndpoint primaryFull() {
        return new OsrmEndpoint("primary-full", PRIMARY_BASE_URL, Overview.FULL);
    }

    public static OsrmEndpoint primarySimplified() {
        return new OsrmEndpoint("primary-simplified", PRIMARY_BASE_URL, Overview.SIMPLIFIED);
    }

    public static OsrmEndpoint primarySummary() {
        return new OsrmEndpoint("primary-summary", PRIMARY_BASE_URL, Overview.NONE);
    }

    public static OsrmEndpoint demoSimplified() {
        return new OsrmEndpoint("demo-simplified", DEMO_BASE_URL, Overview.SIMPLIFIED);
    }

    /**
     * Request URL for a two-point route, coordinates in lon,lat order.
     */
    public String url(GeoPoint from, GeoPoint to) {
        StringBuilder url = new StringBuilder(baseUrl)
                .append('/').append(coordinate(from))
                .append(';').append(coordinate(to))
                .append("?overview=").append(overview.parameter());
        if (overview != Overview.NONE) {
            url.append("&geometries=geojson");
        }
        return url.append("&alternatives=false&steps=false").toString();
    }

    private static String coordinate(GeoPoint point) {
        return String.format(Locale.ROOT, "%.6f,%.6f", point.longitude(), point.latitude());
    }
}
