package org.fuelroute.geometry;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;
import org.locationtech.proj4j.Proj4jException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Bidirectional transform between WGS84 degrees and a planar metric CRS.
 *
 * <p>Every metric buffer, containment test and along-path distance in the engine runs in
 * this projection. Inputs outside the declared area of use are rejected instead of being
 * silently distorted.</p>
 *
 * <p>Instances are safe for concurrent use: proj4j transforms keep scratch state, so each
 * thread gets its own pair.</p>
 */
public final class MetricProjection {
    /** ETRS89 / UTM zone 30N, the official planar CRS for peninsular Spain. */
    public static final String UTM_30N_ETRS89_NAME = "EPSG:25830";
    static final String UTM_30N_ETRS89_PARAMS =
            "+proj=utm +zone=30 +ellps=GRS80 +towgs84=0,0,0,0,0,0,0 +units=m +no_defs";
    private static final String WGS84_PARAMS = "+proj=longlat +datum=WGS84 +no_defs";

    private static final CRSFactory CRS_FACTORY = new CRSFactory();
    private static final CoordinateTransformFactory TRANSFORM_FACTORY = new CoordinateTransformFactory();

    @Getter
    @Accessors(fluent = true)
    private final String name;
    private final Envelope areaOfUse;
    private final ThreadLocal<CoordinateTransform> forward;
    private final ThreadLocal<CoordinateTransform> inverse;

    private MetricProjection(String name, String projParams, Envelope areaOfUse) {
        this.name = Objects.requireNonNull(name, "name");
        this.areaOfUse = new Envelope(Objects.requireNonNull(areaOfUse, "areaOfUse"));
        CoordinateReferenceSystem geographic;
        CoordinateReferenceSystem metric;
        try {
            geographic = CRS_FACTORY.createFromParameters("WGS84", WGS84_PARAMS);
            metric = CRS_FACTORY.createFromParameters(name, projParams);
        } catch (Proj4jException ex) {
            throw new ProjectionException(
                    ProjectionException.REASON_UNDEFINED,
                    "cannot build projection " + name + " from '" + projParams + "'",
                    ex
            );
        }
        this.forward = ThreadLocal.withInitial(() -> TRANSFORM_FACTORY.createTransform(geographic, metric));
        this.inverse = ThreadLocal.withInitial(() -> TRANSFORM_FACTORY.createTransform(metric, geographic));
    }

    /**
     * Returns ETRS89 / UTM 30N with an area of use covering Spain, Balearics and Canaries.
     */
    public static MetricProjection utm30N() {
        return new MetricProjection(UTM_30N_ETRS89_NAME, UTM_30N_ETRS89_PARAMS, new Envelope(-24.0d, 12.0d, 20.0d, 52.0d));
    }

    /**
     * Returns a copy of the geographic envelope ({@code x=lon, y=lat}) this projection accepts.
     */
    public Envelope areaOfUse() {
        return new Envelope(areaOfUse);
    }

    /**
     * Projects one geographic point into metric coordinates.
     *
     * @throws ProjectionException when the point is outside the area of use.
     */
    public Coordinate toMetric(GeoPoint point) {
        Objects.requireNonNull(point, "point");
        ensureWithinArea(point);
        ProjCoordinate out = new ProjCoordinate();
        forward.get().transform(new ProjCoordinate(point.longitude(), point.latitude()), out);
        return new Coordinate(out.x, out.y);
    }

    /**
     * Inverse-projects one metric coordinate back to geographic degrees.
     */
    public GeoPoint toGeographic(Coordinate metric) {
        Objects.requireNonNull(metric, "metric");
        ProjCoordinate out = new ProjCoordinate();
        inverse.get().transform(new ProjCoordinate(metric.x, metric.y), out);
        return GeoPoint.ofLonLat(out.x, out.y);
    }

    /**
     * Reprojects a full path into a metric line string.
     */
    public LineString toMetric(GeoPath path, GeometryFactory factory) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(factory, "factory");
        Coordinate[] coordinates = new Coordinate[path.size()];
        for (int i = 0; i < coordinates.length; i++) {
            coordinates[i] = toMetric(path.point(i));
        }
        return factory.createLineString(coordinates);
    }

    /**
     * Reprojects a metric line string back into a geographic path.
     */
    public GeoPath toGeographic(LineString metricLine) {
        Objects.requireNonNull(metricLine, "metricLine");
        Coordinate[] coordinates = metricLine.getCoordinates();
        List<GeoPoint> points = new ArrayList<>(coordinates.length);
        for (Coordinate coordinate : coordinates) {
            points.add(toGeographic(coordinate));
        }
        return GeoPath.of(points);
    }

    private void ensureWithinArea(GeoPoint point) {
        if (!areaOfUse.contains(point.longitude(), point.latitude())) {
            throw new ProjectionException(
                    ProjectionException.REASON_OUT_OF_EXTENT,
                    "point (lat=" + point.latitude() + ", lon=" + point.longitude() + ") is outside the area of use of "
                            + name + " " + areaOfUse
            );
        }
    }

    @Override
    public String toString() {
        return "MetricProjection[name=" + name + ", areaOfUse=" + areaOfUse + "]";
    }
}
