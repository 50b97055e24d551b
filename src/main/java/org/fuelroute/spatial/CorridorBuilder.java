package org.fuelroute.spatial;

import lombok.extern.slf4j.Slf4j;
import org.fuelroute.geometry.GeoPath;
import org.fuelroute.geometry.MetricProjection;
import org.fuelroute.geometry.PathProjector;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;

import java.util.Objects;

/**
 * Builds corridors in a metric projection.
 *
 * <p>The path is reprojected first and buffered in meters; buffering in degrees would
 * stretch the corridor with latitude.</p>
 */
@Slf4j
public final class CorridorBuilder {
    private final MetricProjection projection;
    private final GeometryFactory metricFactory;

    public CorridorBuilder(MetricProjection projection, GeometryFactory metricFactory) {
        this.projection = Objects.requireNonNull(projection, "projection");
        this.metricFactory = Objects.requireNonNull(metricFactory, "metricFactory");
    }

    public static CorridorBuilder utm30N() {
        return new CorridorBuilder(MetricProjection.utm30N(), new GeometryFactory());
    }

    public MetricProjection projection() {
        return projection;
    }

    public GeometryFactory metricFactory() {
        return metricFactory;
    }

    /**
     * @param path simplified path in geographic degrees.
     * @param radiusMeters strictly positive buffer radius.
     */
    public Corridor build(GeoPath path, double radiusMeters) {
        Objects.requireNonNull(path, "path");
        if (!Double.isFinite(radiusMeters) || radiusMeters <= 0.0d) {
            throw new IllegalArgumentException("radiusMeters must be finite and > 0, got " + radiusMeters);
        }
        LineString metricLine = projection.toMetric(path, metricFactory);
        Geometry polygon = metricLine.buffer(radiusMeters);
        Corridor corridor = new Corridor(path, radiusMeters, polygon, PathProjector.ofMetricLine(projection, metricLine));
        log.info("Corridor of {} m built around {} vertices (area {} km2)",
                Math.round(radiusMeters), path.size(), Math.round(corridor.areaSquareKm() * 10.0d) / 10.0d);
        return corridor;
    }
}
