package org.fuelroute.routing;

/**
 * Road distance and travel time of a routed leg.
 */
public record RouteSummary(double distanceMeters, double durationSeconds) {
    public RouteSummary {
        if (!Double.isFinite(distanceMeters) || distanceMeters < 0.0d) {
            throw new IllegalArgumentException("distanceMeters must be finite and >= 0, got " + distanceMeters);
        }
        if (!Double.isFinite(durationSeconds) || durationSeconds < 0.0d) {
            throw new IllegalArgumentException("durationSeconds must be finite and >= 0, got " + durationSeconds);
        }
    }

    public double distanceKm() {
        return distanceMeters / 1000.0d;
    }

    public double durationMinutes() {
        return durationSeconds / 60.0d;
    }
}
