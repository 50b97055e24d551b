package org.fuelroute.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.fuelroute.enrichment.DetourEnricher;
import org.fuelroute.enrichment.EnrichmentReport;
import org.fuelroute.export.GpxWriter;
import org.fuelroute.export.MapUrlBuilder;
import org.fuelroute.export.MapUrlResult;
import org.fuelroute.export.StopWaypoint;
import org.fuelroute.export.TrackSplicer;
import org.fuelroute.geometry.GeoPath;
import org.fuelroute.geometry.PathProjector;
import org.fuelroute.geometry.PathSimplifier;
import org.fuelroute.ingestion.GpxDocument;
import org.fuelroute.ingestion.GpxTrackReader;
import org.fuelroute.ingestion.NominatimGeocoder;
import org.fuelroute.ingestion.RouteIngestion;
import org.fuelroute.ingestion.TrackValidator;
import org.fuelroute.planner.RefuelStop;
import org.fuelroute.planner.RefuelingPlan;
import org.fuelroute.planner.VehicleProfile;
import org.fuelroute.radar.AutonomyRadar;
import org.fuelroute.radar.RadarReport;
import org.fuelroute.ranking.RankingRequest;
import org.fuelroute.ranking.StationRanker;
import org.fuelroute.routing.HttpClients;
import org.fuelroute.routing.OsrmRoutingClient;
import org.fuelroute.routing.RoutingService;
import org.fuelroute.spatial.Corridor;
import org.fuelroute.spatial.CorridorBuilder;
import org.fuelroute.spatial.SpatialCorrelator;
import org.fuelroute.spatial.StationIndex;
import org.fuelroute.station.CachedPriceSource;
import org.fuelroute.station.CandidateStation;
import org.fuelroute.station.FuelType;
import org.fuelroute.station.MitecoPriceSource;
import org.fuelroute.station.PriceRecord;
import org.fuelroute.station.PriceSource;

import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Facade running one route through ingestion, corridor correlation, selection, enrichment,
 * radar analysis and map export.
 *
 * <p>Validation and infeasibility errors propagate to the caller. Routing-service failures
 * during enrichment and splicing degrade to estimates and fallback geometry.</p>
 */
@Slf4j
public final class FuelRoutePipeline implements AutoCloseable {
    private final FuelRouteConfig config;
    private final PriceSource prices;
    private final RouteIngestion ingestion;
    private final TrackValidator validator;
    private final CorridorBuilder corridors;
    private final SpatialCorrelator correlator;
    private final StationRanker ranker = new StationRanker();
    private final AutonomyRadar radar = new AutonomyRadar();
    private final MapUrlBuilder mapUrls;
    private final DetourEnricher enricher;
    private final TrackSplicer splicer;
    private final GpxWriter writer = new GpxWriter();

    private List<PriceRecord> indexedListing;
    private StationIndex stationIndex;

    public FuelRoutePipeline(FuelRouteConfig config, PriceSource prices, RouteIngestion ingestion, RoutingService routing) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.prices = Objects.requireNonNull(prices, "prices");
        this.ingestion = Objects.requireNonNull(ingestion, "ingestion");
        Objects.requireNonNull(routing, "routing");
        this.validator = new TrackValidator(config.getMaxTrackPoints(), config.getRegion());
        this.corridors = CorridorBuilder.utm30N();
        this.correlator = new SpatialCorrelator(corridors.metricFactory());
        this.mapUrls = new MapUrlBuilder(config.getMaxWaypoints());
        this.enricher = new DetourEnricher(routing, config.getDetourWorkers(), config.getBreakerThreshold(),
                DetourEnricher.DEFAULT_RESULT_TIMEOUT);
        this.splicer = new TrackSplicer(routing, config.getReentryThresholdMeters(), config.getMaxReentryScan(),
                config.getDetourWorkers());
    }

    /**
     * Pipeline against the public price listing, OSRM and Nominatim services.
     */
    public static FuelRoutePipeline create(FuelRouteConfig config) {
        Objects.requireNonNull(config, "config");
        ObjectMapper mapper = new ObjectMapper();
        OsrmRoutingClient routing = OsrmRoutingClient.builder()
                .mapper(mapper)
                .routeTimeout(config.getRouteTimeout())
                .legTimeout(config.getLegTimeout())
                .summaryTimeout(config.getEnrichmentTimeout())
                .build();
        NominatimGeocoder geocoder = new NominatimGeocoder(
                HttpClients.withTimeout(config.getGeocodeTimeout()), mapper,
                NominatimGeocoder.SEARCH_URL, config.getGeocodeCourtesyDelay());
        PriceSource prices = new CachedPriceSource(
                new MitecoPriceSource(HttpClients.shared(), mapper, MitecoPriceSource.defaultEndpoints()),
                config.getPriceCacheTtl(), Clock.systemUTC());
        RouteIngestion ingestion = new RouteIngestion(new GpxTrackReader(), geocoder, routing);
        return new FuelRoutePipeline(config, prices, ingestion, routing);
    }

    public FuelRouteConfig config() {
        return config;
    }

    /**
     * Runs the whole pipeline for {@code request}.
     *
     * @throws org.fuelroute.ingestion.TrackValidationException when the route is unusable.
     * @throws org.fuelroute.ingestion.RouteTextException when place names cannot be routed.
     * @throws org.fuelroute.station.PriceSourceException when no listing can be fetched.
     * @throws org.fuelroute.planner.ImpossibleRouteException when the vehicle cannot complete the route.
     */
    public PipelineResult run(PipelineRequest request) {
        Objects.requireNonNull(request, "request").validate();
        FuelType fuelType = request.getFuelType() == null ? config.getFuelType() : request.getFuelType();
        double bufferMeters = request.getBufferMeters() == null ? config.getBufferMeters() : request.getBufferMeters();

        GpxDocument document = resolveDocument(request);
        GeoPath originalPath = document.toPath();
        validator.validate(originalPath);
        GeoPath simplified = PathSimplifier.simplify(originalPath, config.getSimplifyToleranceDegrees());
        log.info("Route of {} points simplified to {} ({} km)",
                originalPath.size(), simplified.size(), Math.round(originalPath.lengthMeters() / 1000.0d));

        Corridor corridor = corridors.build(simplified, bufferMeters);
        List<CandidateStation> candidates = correlator.correlate(stationIndex(), corridor);

        Optional<RefuelingPlan> plan = Optional.empty();
        List<CandidateStation> selected;
        if (request.planning()) {
            VehicleProfile vehicle = request.getVehicle();
            RefuelingPlan computed = config.getPlanningStrategy()
                    .create(config.plannerConfig())
                    .plan(candidates, corridor.projector().lengthMeters(), fuelType, vehicle);
            plan = Optional.of(computed);
            selected = computed.stations();
        } else {
            RankingRequest ranking = RankingRequest.of(
                    fuelType,
                    request.getTopN() == null ? config.getTopN() : request.getTopN(),
                    request.getSegmentKm() == null ? config.getSegmentKm() : request.getSegmentKm());
            selected = ranker.rank(candidates, ranking);
        }

        PathProjector originalProjector = PathProjector.of(originalPath, corridors.projection(), corridors.metricFactory());
        boolean enrich = request.getEnrichDetours() == null ? config.isEnrichDetours() : request.getEnrichDetours();
        EnrichmentReport enrichment;
        if (enrich) {
            enrichment = enricher.enrich(selected, originalProjector);
        } else {
            for (CandidateStation station : selected) {
                station.assignDetourOrigin(originalProjector.nearestPointOnPath(station.location()));
            }
            enrichment = EnrichmentReport.empty();
        }

        List<CandidateStation> inRouteOrder = new ArrayList<>(selected);
        inRouteOrder.sort(Comparator.comparingDouble(CandidateStation::distanceAlongMeters));
        RadarReport radarReport = radar.analyze(originalPath, inRouteOrder, radarRange(request));
        MapUrlResult mapUrl = mapUrls.build(originalPath, inRouteOrder);

        return new PipelineResult(document, originalPath, simplified, corridor, fuelType,
                candidates, selected, plan, enrichment, radarReport, mapUrl);
    }

    /**
     * Original document with routed detours to every selected stop and one marker per stop.
     */
    public TrackSplicer.Result exportGpx(PipelineResult result) {
        Objects.requireNonNull(result, "result");
        List<StopWaypoint> stops = new ArrayList<>();
        if (result.plan().isPresent()) {
            for (RefuelStop stop : result.plan().get().stops()) {
                stops.add(StopWaypoint.of(stop));
            }
        } else {
            for (CandidateStation station : result.selectedInRouteOrder()) {
                stops.add(StopWaypoint.of(station, result.fuelType()));
            }
        }
        return splicer.splice(result.document(), stops);
    }

    /**
     * Splices the selected stops into the track and writes the GPX file.
     */
    public TrackSplicer.Result exportGpx(PipelineResult result, Path file) {
        TrackSplicer.Result spliced = exportGpx(result);
        writer.write(spliced.document(), file);
        return spliced;
    }

    private GpxDocument resolveDocument(PipelineRequest request) {
        if (request.getDocument() != null) {
            return request.getDocument();
        }
        if (request.getTrackFile() != null) {
            return ingestion.fromTrackFile(request.getTrackFile());
        }
        return ingestion.fromPlaceNames(request.getOrigin(), request.getDestination());
    }

    private synchronized StationIndex stationIndex() {
        List<PriceRecord> listing = prices.fetchAll();
        if (listing != indexedListing || stationIndex == null) {
            stationIndex = StationIndex.build(listing, corridors.projection(), corridors.metricFactory());
            indexedListing = listing;
        }
        return stationIndex;
    }

    private static OptionalDouble radarRange(PipelineRequest request) {
        if (request.getRangeKm() != null) {
            return OptionalDouble.of(request.getRangeKm() * 1000.0d);
        }
        if (request.getVehicle() != null) {
            return OptionalDouble.of(request.getVehicle().fullTankRangeMeters());
        }
        return OptionalDouble.empty();
    }

    @Override
    public void close() {
        enricher.close();
        splicer.close();
    }
}
