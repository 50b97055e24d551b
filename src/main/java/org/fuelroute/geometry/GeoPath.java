package org.fuelroute.geometry;

import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable ordered polyline of geographic coordinates.
 *
 * <p>A path always carries at least two points. Its length is geodesic, never a sum of
 * Euclidean distances in degrees.</p>
 */
public final class GeoPath {
    private final List<GeoPoint> points;
    private double lengthMeters = Double.NaN;

    private GeoPath(List<GeoPoint> points) {
        this.points = points;
    }

    /**
     * Creates a path from an ordered point list.
     *
     * @throws IllegalArgumentException when fewer than two points are supplied.
     */
    public static GeoPath of(List<GeoPoint> points) {
        Objects.requireNonNull(points, "points");
        if (points.size() < 2) {
            throw new IllegalArgumentException("path requires at least 2 points, got " + points.size());
        }
        List<GeoPoint> copy = new ArrayList<>(points.size());
        for (int i = 0; i < points.size(); i++) {
            copy.add(Objects.requireNonNull(points.get(i), "points[" + i + "]"));
        }
        return new GeoPath(Collections.unmodifiableList(copy));
    }

    /**
     * Creates a path from a JTS line whose coordinates are {@code x=longitude, y=latitude}.
     */
    public static GeoPath fromLonLatLine(LineString line) {
        Objects.requireNonNull(line, "line");
        Coordinate[] coordinates = line.getCoordinates();
        List<GeoPoint> points = new ArrayList<>(coordinates.length);
        for (Coordinate coordinate : coordinates) {
            points.add(GeoPoint.ofLonLat(coordinate.x, coordinate.y));
        }
        return of(points);
    }

    public List<GeoPoint> points() {
        return points;
    }

    public int size() {
        return points.size();
    }

    public GeoPoint point(int index) {
        return points.get(index);
    }

    public GeoPoint first() {
        return points.get(0);
    }

    public GeoPoint last() {
        return points.get(points.size() - 1);
    }

    /**
     * Geodesic length in meters, cached after first use.
     */
    public double lengthMeters() {
        double cached = lengthMeters;
        if (Double.isNaN(cached)) {
            cached = GeometryDistance.geodesicLengthMeters(points);
            lengthMeters = cached;
        }
        return cached;
    }

    /**
     * Arithmetic mean of vertex coordinates, used for coarse region checks.
     */
    public GeoPoint centroid() {
        double latSum = 0.0d;
        double lonSum = 0.0d;
        for (GeoPoint point : points) {
            latSum += point.latitude();
            lonSum += point.longitude();
        }
        return new GeoPoint(latSum / points.size(), lonSum / points.size());
    }

    /**
     * Builds a JTS line in geographic space ({@code x=longitude, y=latitude}).
     */
    public LineString toLonLatLine(GeometryFactory factory) {
        Coordinate[] coordinates = new Coordinate[points.size()];
        for (int i = 0; i < coordinates.length; i++) {
            GeoPoint point = points.get(i);
            coordinates[i] = new Coordinate(point.longitude(), point.latitude());
        }
        return factory.createLineString(coordinates);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof GeoPath)) {
            return false;
        }
        return points.equals(((GeoPath) other).points);
    }

    @Override
    public int hashCode() {
        return points.hashCode();
    }

    @Override
    public String toString() {
        return "GeoPath[points=" + points.size() + ", first=" + first() + ", last=" + last() + "]";
    }
}
