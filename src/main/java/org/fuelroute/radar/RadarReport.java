package org.fuelroute.radar;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Segments of a path with the geodesic path length.
 */
public record RadarReport(List<AutonomySegment> segments, double totalLengthMeters, OptionalDouble rangeMeters) {
    public RadarReport {
        segments = List.copyOf(Objects.requireNonNull(segments, "segments"));
        Objects.requireNonNull(rangeMeters, "rangeMeters");
    }

    public double totalLengthKm() {
        return totalLengthMeters / 1000.0d;
    }

    public boolean hasCriticalSegment() {
        for (AutonomySegment segment : segments) {
            if (segment.riskLevel() == RiskLevel.CRITICAL) {
                return true;
            }
        }
        return false;
    }

    public double longestGapMeters() {
        double longest = 0.0d;
        for (AutonomySegment segment : segments) {
            longest = Math.max(longest, segment.gapMeters());
        }
        return longest;
    }
}
