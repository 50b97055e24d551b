package org.fuelroute.ranking;

import lombok.Builder;
import lombok.Value;
import org.fuelroute.station.FuelType;

import java.util.Objects;

/**
 * Selection parameters for {@link StationRanker}.
 */
@Value
@Builder
public class RankingRequest {
    public static final int DEFAULT_TOP_N = 5;

    FuelType fuelType;
    @Builder.Default
    int topN = DEFAULT_TOP_N;
    /**
     * Length of the mandatory-stop bins; zero disables segmented selection.
     */
    @Builder.Default
    double segmentKm = 0.0d;

    public static RankingRequest of(FuelType fuelType, int topN, double segmentKm) {
        return builder().fuelType(fuelType).topN(topN).segmentKm(segmentKm).build();
    }

    /**
     * @throws IllegalArgumentException when a field is out of range.
     */
    public RankingRequest validate() {
        Objects.requireNonNull(fuelType, "fuelType");
        if (topN < 0) {
            throw new IllegalArgumentException("topN must be >= 0, got " + topN);
        }
        if (!Double.isFinite(segmentKm) || segmentKm < 0.0d) {
            throw new IllegalArgumentException("segmentKm must be finite and >= 0, got " + segmentKm);
        }
        return this;
    }

    public boolean segmented() {
        return segmentKm > 0.0d;
    }
}
