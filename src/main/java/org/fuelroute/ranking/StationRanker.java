package org.fuelroute.ranking;

import it.unimi.dsi.fastutil.ints.Int2ObjectAVLTreeMap;
import it.unimi.dsi.fastutil.ints.Int2ObjectSortedMap;
import lombok.extern.slf4j.Slf4j;
import org.fuelroute.station.CandidateStation;
import org.fuelroute.station.FuelType;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Station selection policies over corridor candidates.
 *
 * <p>Only candidates selling the requested fuel at a strictly positive price take part.
 * Price ties resolve to the station closer to the path start, then to the lower id.</p>
 */
@Slf4j
public final class StationRanker {

    /**
     * Applies global top-N, or top-N united with the per-segment cheapest when the request
     * carries a segment length.
     */
    public List<CandidateStation> rank(List<CandidateStation> candidates, RankingRequest request) {
        Objects.requireNonNull(request, "request").validate();
        if (request.segmented()) {
            return segmented(candidates, request.getFuelType(), request.getTopN(), request.getSegmentKm());
        }
        return topN(candidates, request.getFuelType(), request.getTopN());
    }

    /**
     * The {@code n} cheapest candidates, ascending by price.
     */
    public List<CandidateStation> topN(List<CandidateStation> candidates, FuelType fuelType, int n) {
        if (n < 0) {
            throw new IllegalArgumentException("n must be >= 0, got " + n);
        }
        List<CandidateStation> priced = priced(candidates, fuelType);
        priced.sort(byPrice(fuelType));
        List<CandidateStation> top = new ArrayList<>(priced.subList(0, Math.min(n, priced.size())));
        log.debug("Top {} for {}: {} of {} priced candidates", n, fuelType, top.size(), priced.size());
        return top;
    }

    /**
     * Global top-N united with the cheapest candidate of every non-empty {@code segmentKm}
     * bin, deduplicated by id and ordered by position along the path.
     *
     * <p>Every priced candidate gets its bin index assigned.</p>
     */
    public List<CandidateStation> segmented(List<CandidateStation> candidates, FuelType fuelType, int n, double segmentKm) {
        if (!Double.isFinite(segmentKm) || segmentKm <= 0.0d) {
            throw new IllegalArgumentException("segmentKm must be finite and > 0, got " + segmentKm);
        }
        Comparator<CandidateStation> cheapestFirst = byPrice(fuelType);
        List<CandidateStation> priced = priced(candidates, fuelType);

        Int2ObjectSortedMap<CandidateStation> cheapestPerBin = new Int2ObjectAVLTreeMap<>();
        for (CandidateStation candidate : priced) {
            int bin = (int) Math.floor(candidate.distanceAlongKm() / segmentKm);
            candidate.assignSegmentIndex(bin);
            CandidateStation current = cheapestPerBin.get(bin);
            if (current == null || cheapestFirst.compare(candidate, current) < 0) {
                cheapestPerBin.put(bin, candidate);
            }
        }

        Map<String, CandidateStation> union = new LinkedHashMap<>();
        for (CandidateStation station : topN(candidates, fuelType, n)) {
            union.putIfAbsent(station.id(), station);
        }
        for (CandidateStation station : cheapestPerBin.values()) {
            union.putIfAbsent(station.id(), station);
        }
        List<CandidateStation> selected = new ArrayList<>(union.values());
        selected.sort(Comparator.comparingDouble(CandidateStation::distanceAlongMeters)
                .thenComparing(CandidateStation::id));
        log.info("Selected {} stations: top {} plus the cheapest of {} bins of {} km",
                selected.size(), n, cheapestPerBin.size(), segmentKm);
        return selected;
    }

    private static List<CandidateStation> priced(List<CandidateStation> candidates, FuelType fuelType) {
        Objects.requireNonNull(candidates, "candidates");
        Objects.requireNonNull(fuelType, "fuelType");
        List<CandidateStation> priced = new ArrayList<>(candidates.size());
        for (CandidateStation candidate : candidates) {
            if (candidate.record().sells(fuelType)) {
                priced.add(candidate);
            }
        }
        return priced;
    }

    private static Comparator<CandidateStation> byPrice(FuelType fuelType) {
        return Comparator.<CandidateStation>comparingDouble(station -> station.requirePrice(fuelType))
                .thenComparingDouble(CandidateStation::distanceAlongMeters)
                .thenComparing(CandidateStation::id);
    }
}
