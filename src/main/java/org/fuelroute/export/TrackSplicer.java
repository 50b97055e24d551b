package org.fuelroute.export;

import lombok.extern.slf4j.Slf4j;
import org.fuelroute.geometry.GeoPoint;
import org.fuelroute.geometry.GeometryDistance;
import org.fuelroute.ingestion.GpxDocument;
import org.fuelroute.routing.RouteGeometry;
import org.fuelroute.routing.RoutingService;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Splices routed detours to each stop into the original track and adds stop markers.
 *
 * <p>For every stop the nearest track vertex is the exit point; the re-entry point is the
 * first vertex more than {@code reentryThresholdMeters} further along (scanning at most
 * {@code maxReentryScan} vertices, and at least one). The two routed legs exit→station and
 * station→re-entry replace the vertices in between. Anchors are resolved on the original
 * track and splices are applied from the last one backwards, so earlier indices stay valid.
 * When both legs fail the station itself is inserted as a single vertex.</p>
 */
@Slf4j
public final class TrackSplicer implements AutoCloseable {
    public static final double DEFAULT_REENTRY_THRESHOLD_METERS = 35.0d;
    public static final int DEFAULT_MAX_REENTRY_SCAN = 30;
    public static final int DEFAULT_WORKERS = 3;
    private static final Duration LEG_WAIT = Duration.ofSeconds(15);

    /**
     * Result of a splice run.
     *
     * @param spliced stops whose detour got at least one routed leg.
     * @param fallbacks stops represented by a single inserted station vertex.
     */
    public record Result(GpxDocument document, int spliced, int fallbacks) {
    }

    private record Anchor(int track, int segment, int exit, int reentry, StopWaypoint stop) {
    }

    private record Legs(Optional<RouteGeometry> inbound, Optional<RouteGeometry> outbound) {
    }

    private final RoutingService routing;
    private final double reentryThresholdMeters;
    private final int maxReentryScan;
    private final ExecutorService executor;

    public TrackSplicer(RoutingService routing) {
        this(routing, DEFAULT_REENTRY_THRESHOLD_METERS, DEFAULT_MAX_REENTRY_SCAN, DEFAULT_WORKERS);
    }

    public TrackSplicer(RoutingService routing, double reentryThresholdMeters, int maxReentryScan, int workers) {
        this.routing = Objects.requireNonNull(routing, "routing");
        if (!Double.isFinite(reentryThresholdMeters) || reentryThresholdMeters < 0.0d) {
            throw new IllegalArgumentException("reentryThresholdMeters must be finite and >= 0");
        }
        if (maxReentryScan < 1) {
            throw new IllegalArgumentException("maxReentryScan must be >= 1, got " + maxReentryScan);
        }
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + workers);
        }
        this.reentryThresholdMeters = reentryThresholdMeters;
        this.maxReentryScan = maxReentryScan;
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "track-splicer-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public Result splice(GpxDocument document, List<StopWaypoint> stops) {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(stops, "stops");
        if (stops.isEmpty()) {
            return new Result(document, 0, 0);
        }
        List<GpxDocument.Waypoint> markers = new ArrayList<>(stops.size());
        for (int i = 0; i < stops.size(); i++) {
            markers.add(stops.get(i).toGpxWaypoint(i + 1));
        }

        List<List<List<GeoPoint>>> tracks = mutableTracks(document);
        List<Anchor> anchors = resolveAnchors(tracks, stops);
        if (anchors.isEmpty()) {
            return new Result(document.withAddedWaypoints(markers), 0, 0);
        }

        List<Future<Legs>> legs = new ArrayList<>(anchors.size());
        for (Anchor anchor : anchors) {
            List<GeoPoint> points = tracks.get(anchor.track()).get(anchor.segment());
            GeoPoint exit = points.get(anchor.exit());
            GeoPoint reentry = points.get(anchor.reentry());
            GeoPoint station = anchor.stop().location();
            legs.add(executor.submit(() -> new Legs(leg(exit, station), leg(station, reentry))));
        }

        int spliced = 0;
        int fallbacks = 0;
        for (int k = 0; k < anchors.size(); k++) {
            Anchor anchor = anchors.get(k);
            Legs result = await(legs.get(k));
            List<GeoPoint> inserted = new ArrayList<>();
            result.inbound().ifPresent(geometry -> appendSkippingFirst(inserted, geometry.coordinates()));
            if (result.inbound().isEmpty() && result.outbound().isEmpty()) {
                inserted.add(anchor.stop().location());
                fallbacks++;
                log.warn("No routed leg for stop '{}'; inserting the station vertex", anchor.stop().name());
            } else {
                spliced++;
            }
            result.outbound().ifPresent(geometry -> appendSkippingFirst(inserted, geometry.coordinates()));

            // without an outbound leg the re-entry vertex is not part of the insert and stays in the track
            int resume = result.outbound().isPresent()
                    ? anchor.reentry() + 1
                    : Math.max(anchor.exit() + 1, anchor.reentry());
            List<GeoPoint> points = tracks.get(anchor.track()).get(anchor.segment());
            List<GeoPoint> rebuilt = new ArrayList<>(points.size() + inserted.size());
            rebuilt.addAll(points.subList(0, anchor.exit() + 1));
            rebuilt.addAll(inserted);
            rebuilt.addAll(points.subList(Math.min(points.size(), resume), points.size()));
            tracks.get(anchor.track()).set(anchor.segment(), rebuilt);
        }

        GpxDocument splicedDocument = document.withTracks(immutableTracks(document, tracks)).withAddedWaypoints(markers);
        log.info("Track splicing: {} stops spliced, {} fallbacks", spliced, fallbacks);
        return new Result(splicedDocument, spliced, fallbacks);
    }

    /**
     * Anchors sorted from the last track position to the first, with re-entry points clamped
     * so that no splice reaches into a later one.
     */
    private List<Anchor> resolveAnchors(List<List<List<GeoPoint>>> tracks, List<StopWaypoint> stops) {
        List<Anchor> anchors = new ArrayList<>(stops.size());
        for (StopWaypoint stop : stops) {
            int bestTrack = -1;
            int bestSegment = -1;
            int bestIndex = -1;
            double bestDistance = Double.POSITIVE_INFINITY;
            for (int t = 0; t < tracks.size(); t++) {
                for (int s = 0; s < tracks.get(t).size(); s++) {
                    List<GeoPoint> points = tracks.get(t).get(s);
                    for (int p = 0; p < points.size(); p++) {
                        double distance = GeometryDistance.greatCircleDistanceMeters(points.get(p), stop.location());
                        if (distance < bestDistance) {
                            bestDistance = distance;
                            bestTrack = t;
                            bestSegment = s;
                            bestIndex = p;
                        }
                    }
                }
            }
            if (bestTrack < 0) {
                continue;
            }
            List<GeoPoint> points = tracks.get(bestTrack).get(bestSegment);
            anchors.add(new Anchor(bestTrack, bestSegment, bestIndex, reentryIndex(points, bestIndex), stop));
        }
        anchors.sort(Comparator.comparingInt(Anchor::track)
                .thenComparingInt(Anchor::segment)
                .thenComparingInt(Anchor::exit)
                .reversed());

        List<Anchor> clamped = new ArrayList<>(anchors.size());
        Anchor later = null;
        for (Anchor anchor : anchors) {
            Anchor current = anchor;
            if (later != null && later.track() == anchor.track() && later.segment() == anchor.segment()
                    && anchor.reentry() > later.exit()) {
                current = new Anchor(anchor.track(), anchor.segment(), anchor.exit(),
                        Math.max(anchor.exit(), later.exit()), anchor.stop());
            }
            clamped.add(current);
            later = current;
        }
        return clamped;
    }

    int reentryIndex(List<GeoPoint> points, int exit) {
        int last = points.size() - 1;
        int limit = Math.min(exit + maxReentryScan, last);
        int reentry = exit;
        double accumulated = 0.0d;
        for (int i = exit; i < limit; i++) {
            accumulated += GeometryDistance.greatCircleDistanceMeters(points.get(i), points.get(i + 1));
            reentry = i + 1;
            if (accumulated > reentryThresholdMeters) {
                break;
            }
        }
        if (reentry == exit) {
            reentry = Math.min(exit + 1, last);
        }
        return reentry;
    }

    private Optional<RouteGeometry> leg(GeoPoint from, GeoPoint to) {
        try {
            return routing.leg(from, to);
        } catch (RuntimeException ex) {
            log.debug("Routing service threw for splice leg {} -> {}: {}", from, to, ex.toString());
            return Optional.empty();
        }
    }

    private static Legs await(Future<Legs> future) {
        try {
            return future.get(LEG_WAIT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
        } catch (ExecutionException | TimeoutException ex) {
            future.cancel(true);
            log.debug("Splice legs unavailable: {}", ex.toString());
        }
        return new Legs(Optional.empty(), Optional.empty());
    }

    private static void appendSkippingFirst(List<GeoPoint> target, List<GeoPoint> coordinates) {
        for (int i = 1; i < coordinates.size(); i++) {
            target.add(coordinates.get(i));
        }
    }

    private static List<List<List<GeoPoint>>> mutableTracks(GpxDocument document) {
        List<List<List<GeoPoint>>> tracks = new ArrayList<>(document.tracks().size());
        for (GpxDocument.Track track : document.tracks()) {
            List<List<GeoPoint>> segments = new ArrayList<>(track.segments().size());
            for (GpxDocument.Segment segment : track.segments()) {
                segments.add(new ArrayList<>(segment.points()));
            }
            tracks.add(segments);
        }
        return tracks;
    }

    private static List<GpxDocument.Track> immutableTracks(GpxDocument original, List<List<List<GeoPoint>>> tracks) {
        List<GpxDocument.Track> rebuilt = new ArrayList<>(tracks.size());
        for (int t = 0; t < tracks.size(); t++) {
            List<GpxDocument.Segment> segments = new ArrayList<>(tracks.get(t).size());
            for (List<GeoPoint> points : tracks.get(t)) {
                segments.add(new GpxDocument.Segment(points));
            }
            rebuilt.add(new GpxDocument.Track(original.tracks().get(t).name(), segments));
        }
        return rebuilt;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
