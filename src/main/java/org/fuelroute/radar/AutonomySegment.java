package org.fuelroute.radar;

import java.util.Objects;

/**
 * Stretch of the path between two consecutive checkpoints.
 *
 * @param rangeRatio gap divided by the configured range, {@code NaN} when no range is set.
 */
public record AutonomySegment(
        int index,
        double fromMeters,
        double toMeters,
        String fromLabel,
        String toLabel,
        double rangeRatio,
        RiskLevel riskLevel
) {
    public AutonomySegment {
        Objects.requireNonNull(fromLabel, "fromLabel");
        Objects.requireNonNull(toLabel, "toLabel");
        Objects.requireNonNull(riskLevel, "riskLevel");
        if (toMeters < fromMeters) {
            throw new IllegalArgumentException("toMeters must be >= fromMeters");
        }
    }

    public double gapMeters() {
        return toMeters - fromMeters;
    }

    public double gapKm() {
        return gapMeters() / 1000.0d;
    }
}
