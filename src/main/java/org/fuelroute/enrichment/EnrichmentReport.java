package org.fuelroute.enrichment;

/**
 * Outcome counters of one enrichment batch.
 *
 * @param skipped stations whose request was abandoned after the breaker opened.
 */
public record EnrichmentReport(int requested, int enriched, int failed, int skipped, boolean breakerTripped) {

    public static EnrichmentReport empty() {
        return new EnrichmentReport(0, 0, 0, 0, false);
    }
}
