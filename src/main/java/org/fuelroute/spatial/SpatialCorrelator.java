package org.fuelroute.spatial;

import it.unimi.dsi.fastutil.objects.ObjectOpenHashSet;
import lombok.extern.slf4j.Slf4j;
import org.fuelroute.station.CandidateStation;
import org.fuelroute.station.PriceRecord;
import org.locationtech.jts.geom.GeometryFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Restricts a price listing to the stations strictly inside a corridor.
 *
 * <p>Candidates come from an R-tree envelope query and are then tested exactly against the
 * prepared corridor polygon. Results are unique by station id and sorted by their position
 * along the corridor path.</p>
 */
@Slf4j
public final class SpatialCorrelator {
    private static final Comparator<CandidateStation> BY_POSITION =
            Comparator.comparingDouble(CandidateStation::distanceAlongMeters).thenComparing(CandidateStation::id);

    private final GeometryFactory metricFactory;

    public SpatialCorrelator(GeometryFactory metricFactory) {
        this.metricFactory = Objects.requireNonNull(metricFactory, "metricFactory");
    }

    /**
     * Indexes {@code records} and correlates them in one step.
     */
    public List<CandidateStation> correlate(List<PriceRecord> records, Corridor corridor) {
        Objects.requireNonNull(corridor, "corridor");
        return correlate(StationIndex.build(records, corridor.projector().projection(), metricFactory), corridor);
    }

    public List<CandidateStation> correlate(StationIndex index, Corridor corridor) {
        Objects.requireNonNull(index, "index");
        Objects.requireNonNull(corridor, "corridor");

        List<StationIndex.IndexedStation> hits = index.query(corridor.envelope());
        ObjectOpenHashSet<String> seen = new ObjectOpenHashSet<>();
        List<CandidateStation> candidates = new ArrayList<>();
        for (StationIndex.IndexedStation hit : hits) {
            if (!corridor.containsProperly(hit.metricPoint())) {
                continue;
            }
            if (!seen.add(hit.record().id())) {
                continue;
            }
            double along = corridor.projector().alongDistanceMeters(hit.metricPoint().getCoordinate());
            candidates.add(new CandidateStation(hit.record(), Math.max(0.0d, along)));
        }
        candidates.sort(BY_POSITION);
        log.info("Corridor correlation: {} envelope hits, {} stations inside", hits.size(), candidates.size());
        return candidates;
    }
}
