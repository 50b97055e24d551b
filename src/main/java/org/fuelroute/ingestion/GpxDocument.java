package org.fuelroute.ingestion;

import org.fuelroute.geometry.GeoPath;
import org.fuelroute.geometry.GeoPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Structural view of a GPX file: tracks with their segments, routes and waypoints.
 *
 * <p>Immutable. Splicing and waypoint injection produce new documents.</p>
 */
public final class GpxDocument {

    public record Segment(List<GeoPoint> points) {
        public Segment {
            points = List.copyOf(Objects.requireNonNull(points, "points"));
        }
    }

    public record Track(String name, List<Segment> segments) {
        public Track {
            name = name == null ? "" : name;
            segments = List.copyOf(Objects.requireNonNull(segments, "segments"));
        }
    }

    public record Route(String name, List<GeoPoint> points) {
        public Route {
            name = name == null ? "" : name;
            points = List.copyOf(Objects.requireNonNull(points, "points"));
        }
    }

    public record Waypoint(GeoPoint location, String name, String description, String symbol) {
        public Waypoint {
            Objects.requireNonNull(location, "location");
            name = name == null ? "" : name;
            description = description == null ? "" : description;
            symbol = symbol == null ? "" : symbol;
        }
    }

    private final List<Track> tracks;
    private final List<Route> routes;
    private final List<Waypoint> waypoints;

    public GpxDocument(List<Track> tracks, List<Route> routes, List<Waypoint> waypoints) {
        this.tracks = List.copyOf(Objects.requireNonNull(tracks, "tracks"));
        this.routes = List.copyOf(Objects.requireNonNull(routes, "routes"));
        this.waypoints = List.copyOf(Objects.requireNonNull(waypoints, "waypoints"));
    }

    /**
     * Single-track, single-segment document holding {@code path}.
     */
    public static GpxDocument ofPath(String name, GeoPath path) {
        Objects.requireNonNull(path, "path");
        Track track = new Track(name, List.of(new Segment(path.points())));
        return new GpxDocument(List.of(track), List.of(), List.of());
    }

    public List<Track> tracks() {
        return tracks;
    }

    public List<Route> routes() {
        return routes;
    }

    public List<Waypoint> waypoints() {
        return waypoints;
    }

    /**
     * All track points in document order, or all route points when there is no track point.
     */
    public List<GeoPoint> pathPoints() {
        List<GeoPoint> points = new ArrayList<>();
        for (Track track : tracks) {
            for (Segment segment : track.segments()) {
                points.addAll(segment.points());
            }
        }
        if (points.isEmpty()) {
            for (Route route : routes) {
                points.addAll(route.points());
            }
        }
        return points;
    }

    /**
     * @throws TrackValidationException with {@code TRACK_TOO_SHORT} below two points.
     */
    public GeoPath toPath() {
        List<GeoPoint> points = pathPoints();
        if (points.size() < 2) {
            throw new TrackValidationException(
                    TrackValidationException.REASON_TOO_SHORT,
                    "GPX document must contain at least 2 track or route points, found " + points.size()
            );
        }
        return GeoPath.of(points);
    }

    public GpxDocument withTracks(List<Track> replacement) {
        return new GpxDocument(replacement, routes, waypoints);
    }

    public GpxDocument withAddedWaypoints(List<Waypoint> added) {
        List<Waypoint> merged = new ArrayList<>(waypoints);
        merged.addAll(Objects.requireNonNull(added, "added"));
        return new GpxDocument(tracks, routes, merged);
    }
}
