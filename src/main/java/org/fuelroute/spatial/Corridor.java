package org.fuelroute.spatial;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.fuelroute.geometry.GeoPath;
import org.fuelroute.geometry.PathProjector;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.prep.PreparedGeometry;
import org.locationtech.jts.geom.prep.PreparedGeometryFactory;

import java.util.Objects;

/**
 * Metric buffer polygon around a simplified path.
 *
 * <p>Ephemeral: rebuilt whenever the path or the radius changes. The polygon is prepared
 * once so repeated point tests do not re-index its edges.</p>
 */
@Getter
@Accessors(fluent = true)
public final class Corridor {
    private final GeoPath path;
    private final double radiusMeters;
    private final Geometry polygon;
    private final PathProjector projector;
    @Getter(lombok.AccessLevel.NONE)
    private final PreparedGeometry prepared;

    Corridor(GeoPath path, double radiusMeters, Geometry polygon, PathProjector projector) {
        this.path = Objects.requireNonNull(path, "path");
        this.radiusMeters = radiusMeters;
        this.polygon = Objects.requireNonNull(polygon, "polygon");
        this.projector = Objects.requireNonNull(projector, "projector");
        this.prepared = PreparedGeometryFactory.prepare(polygon);
    }

    /**
     * True when the metric point lies in the interior of the corridor (boundary excluded).
     */
    public boolean containsProperly(Point metricPoint) {
        return prepared.containsProperly(metricPoint);
    }

    public Envelope envelope() {
        return polygon.getEnvelopeInternal();
    }

    public double areaSquareKm() {
        return polygon.getArea() / 1_000_000.0d;
    }
}
