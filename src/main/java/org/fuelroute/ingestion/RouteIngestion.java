package org.fuelroute.ingestion;

import lombok.extern.slf4j.Slf4j;
import org.fuelroute.geometry.GeoPath;
import org.fuelroute.geometry.GeoPoint;
import org.fuelroute.routing.RouteGeometry;
import org.fuelroute.routing.RoutingService;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Builds the route document either from a track file or from two place names.
 */
@Slf4j
public final class RouteIngestion {
    private final GpxTrackReader reader;
    private final Geocoder geocoder;
    private final RoutingService routing;

    public RouteIngestion(GpxTrackReader reader, Geocoder geocoder, RoutingService routing) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.geocoder = Objects.requireNonNull(geocoder, "geocoder");
        this.routing = Objects.requireNonNull(routing, "routing");
    }

    public GpxDocument fromTrackFile(Path file) {
        GpxDocument document = reader.read(file);
        document.toPath();
        return document;
    }

    public GpxDocument fromTrackBytes(byte[] bytes) {
        GpxDocument document = reader.read(bytes);
        document.toPath();
        return document;
    }

    /**
     * Geocodes both places and asks the routing service for a road path between them.
     *
     * @throws RouteTextException on geocoding failure, when no endpoint answers, or when the
     *                            returned geometry has fewer than two coordinates.
     */
    public GpxDocument fromPlaceNames(String origin, String destination) {
        GeoPoint from = geocoder.geocode(origin);
        GeoPoint to = geocoder.geocode(destination);

        RouteGeometry geometry = routing.route(from, to).orElseThrow(() -> new RouteTextException(
                RouteTextException.REASON_ROUTE_UNAVAILABLE,
                "no routing service answered for '" + origin + "' -> '" + destination
                        + "' (timeouts, rate limits or malformed responses)"
        ));
        if (!geometry.isPath()) {
            throw new RouteTextException(RouteTextException.REASON_ROUTE_NOT_FOUND,
                    "the routed path between '" + origin + "' and '" + destination + "' is too short");
        }
        GeoPath path = geometry.toPath();
        log.info("Routed '{}' -> '{}': {} km, {} points",
                origin, destination, Math.round(geometry.summary().distanceKm() * 10.0d) / 10.0d, path.size());
        return GpxDocument.ofPath(origin + " - " + destination, path);
    }
}
