package org.fuelroute.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.fuelroute.geometry.GeoPoint;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RoutingService} over public OSRM HTTP endpoints.
 *
 * <p>Route requests walk a fixed cascade (primary full overview, primary simplified overview,
 * demo server simplified). Leg and summary requests hit a single endpoint once. Every call
 * has its own timeout and every failure is absorbed into an empty result.</p>
 */
@Slf4j
public final class OsrmRoutingClient implements RoutingService {
    public static final Duration DEFAULT_ROUTE_TIMEOUT = Duration.ofSeconds(12);
    public static final Duration DEFAULT_LEG_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_SUMMARY_TIMEOUT = Duration.ofSeconds(2);

    private static final int HTTP_TOO_MANY_REQUESTS = 429;

    private final ObjectMapper mapper;
    private final List<OsrmEndpoint> routeCascade;
    private final OsrmEndpoint legEndpoint;
    private final OsrmEndpoint summaryEndpoint;
    private final OkHttpClient routeClient;
    private final OkHttpClient legClient;
    private final OkHttpClient summaryClient;

    @Builder
    private OsrmRoutingClient(
            OkHttpClient httpClient,
            ObjectMapper mapper,
            List<OsrmEndpoint> routeCascade,
            OsrmEndpoint legEndpoint,
            OsrmEndpoint summaryEndpoint,
            Duration routeTimeout,
            Duration legTimeout,
            Duration summaryTimeout
    ) {
        OkHttpClient base = httpClient == null ? HttpClients.shared() : httpClient;
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
        this.routeCascade = routeCascade == null ? defaultRouteCascade() : List.copyOf(routeCascade);
        if (this.routeCascade.isEmpty()) {
            throw new IllegalArgumentException("routeCascade must be non-empty");
        }
        this.legEndpoint = legEndpoint == null ? OsrmEndpoint.primaryFull() : legEndpoint;
        this.summaryEndpoint = summaryEndpoint == null ? OsrmEndpoint.primarySummary() : summaryEndpoint;
        this.routeClient = HttpClients.withTimeout(base, routeTimeout == null ? DEFAULT_ROUTE_TIMEOUT : routeTimeout);
        this.legClient = HttpClients.withTimeout(base, legTimeout == null ? DEFAULT_LEG_TIMEOUT : legTimeout);
        this.summaryClient = HttpClients.withTimeout(
                base, summaryTimeout == null ? DEFAULT_SUMMARY_TIMEOUT : summaryTimeout);
    }

    public static OsrmRoutingClient defaults() {
        return builder().build();
    }

    public static List<OsrmEndpoint> defaultRouteCascade() {
        return List.of(
                OsrmEndpoint.primaryFull(),
                OsrmEndpoint.primarySimplified(),
                OsrmEndpoint.demoSimplified()
        );
    }

    @Override
    public Optional<RouteGeometry> route(GeoPoint from, GeoPoint to) {
        requireEndpoints(from, to);
        for (OsrmEndpoint endpoint : routeCascade) {
            Optional<RouteGeometry> geometry = fetch(routeClient, endpoint, from, to).flatMap(this::parseGeometry);
            if (geometry.isPresent()) {
                log.debug("Route obtained from {} with {} coordinates",
                        endpoint.name(), geometry.get().coordinates().size());
                return geometry;
            }
        }
        log.warn("No OSRM endpoint produced a route from {} to {}", from, to);
        return Optional.empty();
    }

    @Override
    public Optional<RouteGeometry> leg(GeoPoint from, GeoPoint to) {
        requireEndpoints(from, to);
        return fetch(legClient, legEndpoint, from, to).flatMap(this::parseGeometry);
    }

    @Override
    public Optional<RouteSummary> summary(GeoPoint from, GeoPoint to) {
        requireEndpoints(from, to);
        return fetch(summaryClient, summaryEndpoint, from, to).flatMap(OsrmRoutingClient::parseSummary);
    }

    private Optional<JsonNode> fetch(OkHttpClient client, OsrmEndpoint endpoint, GeoPoint from, GeoPoint to) {
        Request request = new Request.Builder().url(endpoint.url(from, to)).get().build();
        try (Response response = client.newCall(request).execute()) {
            if (response.code() == HTTP_TOO_MANY_REQUESTS) {
                log.warn("OSRM endpoint {} is rate limiting (429)", endpoint.name());
                return Optional.empty();
            }
            if (!response.isSuccessful()) {
                log.debug("OSRM endpoint {} answered HTTP {}", endpoint.name(), response.code());
                return Optional.empty();
            }
            ResponseBody body = response.body();
            if (body == null) {
                return Optional.empty();
            }
            JsonNode root = mapper.readTree(body.byteStream());
            if (root == null || !"Ok".equals(root.path("code").asText())) {
                log.debug("OSRM endpoint {} answered code {}", endpoint.name(),
                        root == null ? "<empty>" : root.path("code").asText("<missing>"));
                return Optional.empty();
            }
            return Optional.of(root);
        } catch (IOException | RuntimeException ex) {
            log.debug("OSRM endpoint {} failed: {}", endpoint.name(), ex.toString());
            return Optional.empty();
        }
    }

    private Optional<RouteGeometry> parseGeometry(JsonNode root) {
        JsonNode route = root.path("routes").path(0);
        JsonNode coordinates = route.path("geometry").path("coordinates");
        if (!coordinates.isArray() || coordinates.isEmpty()) {
            return Optional.empty();
        }
        List<GeoPoint> points = new ArrayList<>(coordinates.size());
        try {
            for (JsonNode pair : coordinates) {
                if (!pair.isArray() || pair.size() < 2 || !pair.get(0).isNumber() || !pair.get(1).isNumber()) {
                    return Optional.empty();
                }
                points.add(GeoPoint.ofLonLat(pair.get(0).asDouble(), pair.get(1).asDouble()));
            }
        } catch (IllegalArgumentException ex) {
            log.debug("OSRM geometry carries an invalid coordinate: {}", ex.getMessage());
            return Optional.empty();
        }
        Optional<RouteSummary> summary = parseSummary(root);
        if (summary.isEmpty()) {
            double distance = route.path("distance").asDouble(Double.NaN);
            double duration = route.path("duration").asDouble(Double.NaN);
            if (!Double.isFinite(distance) || !Double.isFinite(duration) || distance < 0.0d || duration < 0.0d) {
                return Optional.empty();
            }
            summary = Optional.of(new RouteSummary(distance, duration));
        }
        return Optional.of(new RouteGeometry(points, summary.get()));
    }

    static Optional<RouteSummary> parseSummary(JsonNode root) {
        JsonNode leg = root.path("routes").path(0).path("legs").path(0);
        JsonNode distance = leg.get("distance");
        JsonNode duration = leg.get("duration");
        if (distance == null || duration == null || !distance.isNumber() || !duration.isNumber()) {
            return Optional.empty();
        }
        double meters = distance.asDouble();
        double seconds = duration.asDouble();
        if (!Double.isFinite(meters) || !Double.isFinite(seconds) || meters < 0.0d || seconds < 0.0d) {
            return Optional.empty();
        }
        return Optional.of(new RouteSummary(meters, seconds));
    }

    private static void requireEndpoints(GeoPoint from, GeoPoint to) {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }
}
