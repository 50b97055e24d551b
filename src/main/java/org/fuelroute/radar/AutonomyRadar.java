package org.fuelroute.radar;

import lombok.extern.slf4j.Slf4j;
import org.fuelroute.geometry.GeoPath;
import org.fuelroute.station.CandidateStation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;

/**
 * Splits a path into inter-station gaps and grades each against the vehicle range.
 *
 * <p>Checkpoints are the path start, every selected station by position, and the path end at
 * the geodesic path length. Stations beyond the end are clamped to it.</p>
 */
@Slf4j
public final class AutonomyRadar {
    public static final String START_LABEL = "Route start";
    public static final String END_LABEL = "Route end";

    public RadarReport analyze(GeoPath path, List<CandidateStation> selected, OptionalDouble rangeMeters) {
        Objects.requireNonNull(path, "path");
        return analyze(path.lengthMeters(), selected, rangeMeters);
    }

    /**
     * @param totalLengthMeters geodesic length of the path.
     * @param rangeMeters vehicle range; empty (or non-positive) for informational segments.
     */
    public RadarReport analyze(double totalLengthMeters, List<CandidateStation> selected, OptionalDouble rangeMeters) {
        Objects.requireNonNull(selected, "selected");
        Objects.requireNonNull(rangeMeters, "rangeMeters");
        if (!Double.isFinite(totalLengthMeters) || totalLengthMeters < 0.0d) {
            throw new IllegalArgumentException("totalLengthMeters must be finite and >= 0, got " + totalLengthMeters);
        }
        OptionalDouble range = rangeMeters.isPresent() && rangeMeters.getAsDouble() > 0.0d
                ? rangeMeters : OptionalDouble.empty();

        List<CandidateStation> ordered = new ArrayList<>(selected);
        ordered.sort(Comparator.comparingDouble(CandidateStation::distanceAlongMeters).thenComparing(CandidateStation::id));

        List<AutonomySegment> segments = new ArrayList<>(ordered.size() + 1);
        double from = 0.0d;
        String fromLabel = START_LABEL;
        for (CandidateStation station : ordered) {
            double to = Math.min(station.distanceAlongMeters(), totalLengthMeters);
            String toLabel = label(station);
            segments.add(segment(segments.size(), from, to, fromLabel, toLabel, range));
            from = to;
            fromLabel = toLabel;
        }
        segments.add(segment(segments.size(), from, totalLengthMeters, fromLabel, END_LABEL, range));

        RadarReport report = new RadarReport(segments, totalLengthMeters, range);
        log.debug("Autonomy radar: {} segments over {} m, critical={}",
                segments.size(), Math.round(totalLengthMeters), report.hasCriticalSegment());
        return report;
    }

    private static AutonomySegment segment(int index, double from, double to, String fromLabel, String toLabel, OptionalDouble range) {
        if (range.isEmpty()) {
            return new AutonomySegment(index, from, to, fromLabel, toLabel, Double.NaN, RiskLevel.INFORMATIONAL);
        }
        double ratio = (to - from) / range.getAsDouble();
        return new AutonomySegment(index, from, to, fromLabel, toLabel, ratio, RiskLevel.forRatio(ratio));
    }

    private static String label(CandidateStation station) {
        return station.name().isBlank() ? "Station " + station.id() : station.name();
    }
}
