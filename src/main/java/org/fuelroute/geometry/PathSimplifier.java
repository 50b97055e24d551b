package org.fuelroute.geometry;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.simplify.TopologyPreservingSimplifier;

import java.util.Objects;

/**
 * Douglas-Peucker polyline reduction that preserves topology and both endpoints.
 */
@Slf4j
@UtilityClass
public class PathSimplifier {
    private static final GeometryFactory GEOGRAPHIC_FACTORY = new GeometryFactory();

    /**
     * Simplifies a geographic path.
     *
     * @param path input path.
     * @param toleranceDegrees distance tolerance in the path's own units (degrees).
     * @return simplified path; never more vertices than the input, same first and last vertex.
     */
    public static GeoPath simplify(GeoPath path, double toleranceDegrees) {
        Objects.requireNonNull(path, "path");
        validateTolerance(toleranceDegrees);
        LineString simplified = simplify(path.toLonLatLine(GEOGRAPHIC_FACTORY), toleranceDegrees);
        if (simplified.getNumPoints() < 2 || simplified.getNumPoints() >= path.size()) {
            return path;
        }
        GeoPath result = GeoPath.fromLonLatLine(simplified);
        log.debug("Simplified path vertices {} -> {} (tolerance={} deg)", path.size(), result.size(), toleranceDegrees);
        return result;
    }

    /**
     * Simplifies a line string in whatever units it is expressed in.
     */
    public static LineString simplify(LineString line, double tolerance) {
        Objects.requireNonNull(line, "line");
        validateTolerance(tolerance);
        Geometry simplified = TopologyPreservingSimplifier.simplify(line, tolerance);
        if (!(simplified instanceof LineString) || simplified.getNumPoints() < 2) {
            return line;
        }
        return (LineString) simplified;
    }

    private static void validateTolerance(double tolerance) {
        if (!Double.isFinite(tolerance) || tolerance < 0.0d) {
            throw new IllegalArgumentException("tolerance must be finite and >= 0, got " + tolerance);
        }
    }
}
