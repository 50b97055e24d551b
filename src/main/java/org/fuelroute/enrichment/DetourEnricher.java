package org.fuelroute.enrichment;

import lombok.extern.slf4j.Slf4j;
import org.fuelroute.geometry.GeoPoint;
import org.fuelroute.geometry.PathProjector;
import org.fuelroute.routing.RouteSummary;
import org.fuelroute.routing.RoutingService;
import org.fuelroute.station.CandidateStation;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Best-effort road detour enrichment.
 *
 * <p>Detour origins are assigned on the calling thread first, so every station has a
 * straight-line fallback. Summary requests then run on a small fixed pool. The calling
 * thread is the only owner of the breaker and of the station rows: it consumes completions
 * one by one, writes successful results, and once the breaker opens cancels the outstanding
 * requests and returns. Nothing thrown by the routing service leaves this class.</p>
 */
@Slf4j
public final class DetourEnricher implements AutoCloseable {
    public static final int DEFAULT_WORKERS = 3;
    public static final int DEFAULT_BREAKER_THRESHOLD = 3;
    public static final Duration DEFAULT_RESULT_TIMEOUT = Duration.ofSeconds(10);

    private final RoutingService routing;
    private final int breakerThreshold;
    private final Duration resultTimeout;
    private final ExecutorService executor;

    public DetourEnricher(RoutingService routing) {
        this(routing, DEFAULT_WORKERS, DEFAULT_BREAKER_THRESHOLD, DEFAULT_RESULT_TIMEOUT);
    }

    public DetourEnricher(RoutingService routing, int workers, int breakerThreshold, Duration resultTimeout) {
        this.routing = Objects.requireNonNull(routing, "routing");
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + workers);
        }
        if (breakerThreshold < 1) {
            throw new IllegalArgumentException("breakerThreshold must be >= 1, got " + breakerThreshold);
        }
        this.breakerThreshold = breakerThreshold;
        this.resultTimeout = Objects.requireNonNull(resultTimeout, "resultTimeout");
        this.executor = Executors.newFixedThreadPool(workers, daemonThreads());
    }

    /**
     * Enriches {@code stations} in place.
     *
     * @param originalPath projector over the original (not simplified) path.
     */
    public EnrichmentReport enrich(List<CandidateStation> stations, PathProjector originalPath) {
        Objects.requireNonNull(stations, "stations");
        Objects.requireNonNull(originalPath, "originalPath");
        if (stations.isEmpty()) {
            return EnrichmentReport.empty();
        }
        for (CandidateStation station : stations) {
            station.assignDetourOrigin(originalPath.nearestPointOnPath(station.location()));
        }

        CircuitBreaker breaker = new CircuitBreaker(breakerThreshold);
        CompletionService<DetourResult> completions = new ExecutorCompletionService<>(executor);
        List<Future<DetourResult>> pending = new ArrayList<>(stations.size());
        for (CandidateStation station : stations) {
            GeoPoint origin = station.detourOrigin().orElseThrow();
            GeoPoint target = station.location();
            pending.add(completions.submit(() -> new DetourResult(station, requestSummary(origin, target))));
        }

        int enriched = 0;
        int failed = 0;
        int consumed = 0;
        while (consumed < stations.size() && !breaker.isOpen()) {
            DetourResult result = awaitNext(completions);
            consumed++;
            if (result != null && result.summary().isPresent()) {
                RouteSummary summary = result.summary().get();
                result.station().recordRoadDetour(summary.distanceMeters(), summary.durationSeconds());
                breaker.recordSuccess();
                enriched++;
            } else {
                failed++;
                if (breaker.recordFailure()) {
                    log.warn("Detour circuit breaker opened after {} consecutive failures; "
                            + "remaining stations keep straight-line estimates", breaker.consecutiveFailures());
                }
            }
        }
        for (Future<DetourResult> future : pending) {
            future.cancel(true);
        }

        int skipped = stations.size() - consumed;
        EnrichmentReport report = new EnrichmentReport(stations.size(), enriched, failed, skipped, breaker.isOpen());
        log.info("Detour enrichment: {} enriched, {} failed, {} skipped of {}",
                enriched, failed, skipped, stations.size());
        return report;
    }

    private Optional<RouteSummary> requestSummary(GeoPoint origin, GeoPoint target) {
        try {
            return routing.summary(origin, target);
        } catch (RuntimeException ex) {
            log.debug("Routing service threw for detour {} -> {}: {}", origin, target, ex.toString());
            return Optional.empty();
        }
    }

    private DetourResult awaitNext(CompletionService<DetourResult> completions) {
        try {
            Future<DetourResult> future = completions.poll(resultTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return future == null ? null : future.get();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return null;
        } catch (ExecutionException ex) {
            log.debug("Detour request failed: {}", ex.getCause() == null ? ex.toString() : ex.getCause().toString());
            return null;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "detour-enricher-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record DetourResult(CandidateStation station, Optional<RouteSummary> summary) {
    }
}
