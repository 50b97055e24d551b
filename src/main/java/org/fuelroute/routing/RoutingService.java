package org.fuelroute.routing;

import org.fuelroute.geometry.GeoPoint;

import java.util.Optional;

/**
 * Road routing collaborator.
 *
 * <p>Implementations never throw for transport or payload problems: a timeout, a non-success
 * status, a rate limit or malformed JSON all yield {@link Optional#empty()}.</p>
 */
public interface RoutingService {

    /**
     * Best route between two points, trying every configured endpoint in order.
     */
    Optional<RouteGeometry> route(GeoPoint from, GeoPoint to);

    /**
     * Full-detail geometry of a short leg from a single endpoint, used for track splicing.
     */
    Optional<RouteGeometry> leg(GeoPoint from, GeoPoint to);

    /**
     * Distance and duration only, from a single endpoint with a short timeout.
     */
    Optional<RouteSummary> summary(GeoPoint from, GeoPoint to);
}
