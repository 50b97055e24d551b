package org.fuelroute.pipeline;

import org.fuelroute.enrichment.EnrichmentReport;
import org.fuelroute.export.MapUrlResult;
import org.fuelroute.geometry.GeoPath;
import org.fuelroute.ingestion.GpxDocument;
import org.fuelroute.planner.RefuelingPlan;
import org.fuelroute.radar.RadarReport;
import org.fuelroute.spatial.Corridor;
import org.fuelroute.station.CandidateStation;
import org.fuelroute.station.FuelType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Everything one pipeline run produced.
 *
 * @param candidates every corridor station, ordered by position along the route.
 * @param selected ranked stations, or the plan's stops when a plan was computed.
 */
public record PipelineResult(
        GpxDocument document,
        GeoPath originalPath,
        GeoPath simplifiedPath,
        Corridor corridor,
        FuelType fuelType,
        List<CandidateStation> candidates,
        List<CandidateStation> selected,
        Optional<RefuelingPlan> plan,
        EnrichmentReport enrichment,
        RadarReport radar,
        MapUrlResult mapUrl
) {
    public PipelineResult {
        Objects.requireNonNull(document, "document");
        Objects.requireNonNull(originalPath, "originalPath");
        Objects.requireNonNull(simplifiedPath, "simplifiedPath");
        Objects.requireNonNull(corridor, "corridor");
        Objects.requireNonNull(fuelType, "fuelType");
        candidates = List.copyOf(candidates);
        selected = List.copyOf(selected);
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(enrichment, "enrichment");
        Objects.requireNonNull(radar, "radar");
        Objects.requireNonNull(mapUrl, "mapUrl");
    }

    public double routeLengthKm() {
        return originalPath.lengthMeters() / 1000.0d;
    }

    public int corridorCount() {
        return candidates.size();
    }

    /**
     * Cheapest price of the requested fuel among the corridor stations.
     */
    public OptionalDouble bestPrice() {
        return candidates.stream()
                .map(candidate -> candidate.price(fuelType))
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble)
                .min();
    }

    /**
     * Most expensive price of the requested fuel among the corridor stations.
     */
    public OptionalDouble maxCorridorPrice() {
        return candidates.stream()
                .map(candidate -> candidate.price(fuelType))
                .filter(OptionalDouble::isPresent)
                .mapToDouble(OptionalDouble::getAsDouble)
                .max();
    }

    public boolean planned() {
        return plan.isPresent();
    }

    /**
     * Selected stations ordered by their position along the route.
     */
    public List<CandidateStation> selectedInRouteOrder() {
        List<CandidateStation> ordered = new ArrayList<>(selected);
        ordered.sort(Comparator.comparingDouble(CandidateStation::distanceAlongMeters));
        return ordered;
    }
}
