package org.fuelroute.spatial;

import lombok.extern.slf4j.Slf4j;
import org.fuelroute.geometry.MetricProjection;
import org.fuelroute.geometry.ProjectionException;
import org.fuelroute.station.PriceRecord;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.index.strtree.STRtree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Packed R-tree over the metric positions of a price listing.
 *
 * <p>Built once per listing and projection, then read-only; queries may run from several
 * threads. Records the projection cannot represent are left out of the index.</p>
 */
@Slf4j
public final class StationIndex {

    /**
     * A record with its projected position.
     */
    public record IndexedStation(PriceRecord record, Point metricPoint) {
        public IndexedStation {
            Objects.requireNonNull(record, "record");
            Objects.requireNonNull(metricPoint, "metricPoint");
        }
    }

    private final MetricProjection projection;
    private final STRtree tree;
    private final List<IndexedStation> stations;
    private final int skipped;

    private StationIndex(MetricProjection projection, STRtree tree, List<IndexedStation> stations, int skipped) {
        this.projection = projection;
        this.tree = tree;
        this.stations = stations;
        this.skipped = skipped;
    }

    public static StationIndex build(List<PriceRecord> records, MetricProjection projection, GeometryFactory metricFactory) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(projection, "projection");
        Objects.requireNonNull(metricFactory, "metricFactory");

        STRtree tree = new STRtree();
        List<IndexedStation> stations = new ArrayList<>(records.size());
        int skipped = 0;
        for (PriceRecord record : records) {
            Point point;
            try {
                point = metricFactory.createPoint(projection.toMetric(record.location()));
            } catch (ProjectionException ex) {
                skipped++;
                continue;
            }
            IndexedStation station = new IndexedStation(record, point);
            tree.insert(point.getEnvelopeInternal(), station);
            stations.add(station);
        }
        tree.build();
        if (skipped > 0) {
            log.warn("{} of {} records fall outside {} and were not indexed", skipped, records.size(), projection.name());
        }
        log.debug("Station index built over {} records", stations.size());
        return new StationIndex(projection, tree, Collections.unmodifiableList(stations), skipped);
    }

    /**
     * Stations whose point lies inside {@code envelope} (metric coordinates).
     */
    @SuppressWarnings("unchecked")
    public List<IndexedStation> query(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        if (stations.isEmpty()) {
            return List.of();
        }
        return (List<IndexedStation>) tree.query(envelope);
    }

    public List<IndexedStation> stations() {
        return stations;
    }

    public MetricProjection projection() {
        return projection;
    }

    public int size() {
        return stations.size();
    }

    public int skipped() {
        return skipped;
    }
}
