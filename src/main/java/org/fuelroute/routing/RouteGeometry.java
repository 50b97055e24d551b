package org.fuelroute.routing;

import org.fuelroute.geometry.GeoPath;
import org.fuelroute.geometry.GeoPoint;

import java.util.List;
import java.util.Objects;

/**
 * Geometry of the best route returned by a routing service, with its summary.
 *
 * <p>Coordinates may hold a single point for degenerate legs; {@link #toPath()} requires two.</p>
 */
public record RouteGeometry(List<GeoPoint> coordinates, RouteSummary summary) {
    public RouteGeometry {
        coordinates = List.copyOf(Objects.requireNonNull(coordinates, "coordinates"));
        Objects.requireNonNull(summary, "summary");
    }

    public boolean isPath() {
        return coordinates.size() >= 2;
    }

    public GeoPath toPath() {
        return GeoPath.of(coordinates);
    }
}
