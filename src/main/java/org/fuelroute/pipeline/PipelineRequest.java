package org.fuelroute.pipeline;

import lombok.Builder;
import lombok.Value;
import org.fuelroute.ingestion.GpxDocument;
import org.fuelroute.planner.VehicleProfile;
import org.fuelroute.station.FuelType;

import java.nio.file.Path;

/**
 * One optimization run.
 *
 * <p>Exactly one route source must be set: a GPX file, an already parsed document, or an
 * origin and destination place name pair. Nullable overrides fall back to the pipeline's
 * {@link FuelRouteConfig}. A vehicle profile switches the run from ranking to planning.</p>
 */
@Value
@Builder
public class PipelineRequest {
    Path trackFile;
    GpxDocument document;
    String origin;
    String destination;

    FuelType fuelType;
    Double bufferMeters;
    Integer topN;
    Double segmentKm;
    Boolean enrichDetours;

    VehicleProfile vehicle;
    /**
     * Autonomy used by the radar; defaults to the vehicle's full-tank range when planning.
     */
    Double rangeKm;

    public static PipelineRequest forTrack(Path trackFile) {
        return builder().trackFile(trackFile).build();
    }

    public static PipelineRequest forPlaces(String origin, String destination) {
        return builder().origin(origin).destination(destination).build();
    }

    /**
     * @throws IllegalArgumentException when zero or several route sources are set, or an
     *                                  override is out of range.
     */
    public PipelineRequest validate() {
        int sources = (trackFile != null ? 1 : 0) + (document != null ? 1 : 0)
                + (origin != null || destination != null ? 1 : 0);
        if (sources != 1) {
            throw new IllegalArgumentException(
                    "exactly one route source (trackFile, document or origin/destination) is required, got " + sources);
        }
        if ((origin == null) != (destination == null)) {
            throw new IllegalArgumentException("origin and destination must be given together");
        }
        if (bufferMeters != null && (!Double.isFinite(bufferMeters) || bufferMeters <= 0.0d)) {
            throw new IllegalArgumentException("bufferMeters must be finite and > 0, got " + bufferMeters);
        }
        if (rangeKm != null && (!Double.isFinite(rangeKm) || rangeKm <= 0.0d)) {
            throw new IllegalArgumentException("rangeKm must be finite and > 0, got " + rangeKm);
        }
        if (topN != null && topN < 0) {
            throw new IllegalArgumentException("topN must be >= 0, got " + topN);
        }
        if (segmentKm != null && (!Double.isFinite(segmentKm) || segmentKm < 0.0d)) {
            throw new IllegalArgumentException("segmentKm must be finite and >= 0, got " + segmentKm);
        }
        if (vehicle != null) {
            vehicle.validate();
        }
        return this;
    }

    public boolean planning() {
        return vehicle != null;
    }
}
