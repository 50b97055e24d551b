package org.fuelroute.export;

import lombok.extern.slf4j.Slf4j;
import org.fuelroute.geometry.GeoPath;
import org.fuelroute.geometry.GeoPoint;
import org.fuelroute.station.CandidateStation;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Builds multi-stop driving URLs for the public Google Maps URL API.
 *
 * <p>The API accepts at most {@value #DEFAULT_MAX_WAYPOINTS} waypoints. Extra stops are cut
 * from the tail and reported in {@link MapUrlResult#omittedStops()}.</p>
 */
@Slf4j
public final class MapUrlBuilder {
    public static final String BASE_URL = "https://www.google.com/maps/dir/?";
    public static final int DEFAULT_MAX_WAYPOINTS = 9;

    private final int maxWaypoints;

    public MapUrlBuilder() {
        this(DEFAULT_MAX_WAYPOINTS);
    }

    public MapUrlBuilder(int maxWaypoints) {
        if (maxWaypoints < 0) {
            throw new IllegalArgumentException("maxWaypoints must be >= 0, got " + maxWaypoints);
        }
        this.maxWaypoints = maxWaypoints;
    }

    /**
     * Origin and destination are the path endpoints; stops keep the given order.
     */
    public MapUrlResult build(GeoPath path, List<CandidateStation> stops) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(stops, "stops");
        List<GeoPoint> points = new ArrayList<>(stops.size());
        for (CandidateStation stop : stops) {
            points.add(stop.location());
        }
        return build(path.first(), path.last(), points);
    }

    public MapUrlResult build(GeoPoint origin, GeoPoint destination, List<GeoPoint> stops) {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(stops, "stops");

        int included = Math.min(stops.size(), maxWaypoints);
        int omitted = stops.size() - included;
        StringBuilder url = new StringBuilder(BASE_URL)
                .append("api=1")
                .append("&origin=").append(encode(coordinate(origin)))
                .append("&destination=").append(encode(coordinate(destination)))
                .append("&travelmode=driving");
        if (included > 0) {
            StringJoiner waypoints = new StringJoiner("|");
            for (int i = 0; i < included; i++) {
                waypoints.add(coordinate(stops.get(i)));
            }
            url.append("&waypoints=").append(encode(waypoints.toString()));
        }
        if (omitted > 0) {
            log.warn("Map URL carries {} of {} stops; {} omitted by the waypoint limit", included, stops.size(), omitted);
        }
        return new MapUrlResult(url.toString(), included, omitted);
    }

    public int maxWaypoints() {
        return maxWaypoints;
    }

    private static String coordinate(GeoPoint point) {
        return String.format(Locale.ROOT, "%.6f,%.6f", point.latitude(), point.longitude());
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
