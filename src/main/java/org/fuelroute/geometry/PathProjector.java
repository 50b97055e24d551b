package org.fuelroute.geometry;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.linearref.LengthIndexedLine;

import java.util.Objects;

/**
 * Linear referencing over a path in metric space.
 *
 * <p>Answers "how many meters from the start of the path is the point of the path closest
 * to P" and the inverse "which point lies N meters along the path".</p>
 */
public final class PathProjector {
    @Getter
    @Accessors(fluent = true)
    private final MetricProjection projection;
    @Getter
    @Accessors(fluent = true)
    private final LineString metricLine;
    private final LengthIndexedLine indexedLine;

    private PathProjector(MetricProjection projection, LineString metricLine) {
        this.projection = projection;
        this.metricLine = metricLine;
        this.indexedLine = new LengthIndexedLine(metricLine);
    }

    /**
     * Reprojects {@code path} and indexes it by length.
     */
    public static PathProjector of(GeoPath path, MetricProjection projection, GeometryFactory metricFactory) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(projection, "projection");
        Objects.requireNonNull(metricFactory, "metricFactory");
        return new PathProjector(projection, projection.toMetric(path, metricFactory));
    }

    /**
     * Indexes a line that is already expressed in {@code projection}'s metric space.
     */
    public static PathProjector ofMetricLine(MetricProjection projection, LineString metricLine) {
        Objects.requireNonNull(projection, "projection");
        Objects.requireNonNull(metricLine, "metricLine");
        return new PathProjector(projection, metricLine);
    }

    /**
     * Along-path distance in meters of the path point closest to {@code point}.
     */
    public double alongDistanceMeters(GeoPoint point) {
        return alongDistanceMeters(projection.toMetric(point));
    }

    /**
     * Along-path distance in meters of the path point closest to a metric coordinate.
     */
    public double alongDistanceMeters(Coordinate metric) {
        Objects.requireNonNull(metric, "metric");
        return indexedLine.project(metric) - indexedLine.getStartIndex();
    }

    /**
     * Geographic point located {@code alongMeters} from the path start (clamped to the path).
     */
    public GeoPoint pointAt(double alongMeters) {
        double clamped = Math.max(0.0d, Math.min(alongMeters, lengthMeters()));
        return projection.toGeographic(indexedLine.extractPoint(indexedLine.getStartIndex() + clamped));
    }

    /**
     * Closest point of the path to {@code point}, in geographic degrees.
     */
    public GeoPoint nearestPointOnPath(GeoPoint point) {
        return pointAt(alongDistanceMeters(point));
    }

    /**
     * Planar length of the projected path in meters.
     */
    public double lengthMeters() {
        return metricLine.getLength();
    }
}
