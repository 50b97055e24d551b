package org.fuelroute.spatial;

import org.fuelroute.geometry.GeoPoint;
import org.fuelroute.station.CandidateStation;
import org.fuelroute.station.PriceRecord;
import org.fuelroute.testutil.FuelRouteFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("SpatialCorrelator Tests")
class SpatialCorrelatorTest {
    private final CorridorBuilder builder = CorridorBuilder.utm30N();
    private final SpatialCorrelator correlator = new SpatialCorrelator(builder.metricFactory());
    private final Corridor corridor = builder.build(FuelRouteFixtures.straightRoute(120.0d, 25), 5_000.0d);

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("Stations inside the buffer are kept with their along distance, ordered by position")
        void testInsideKeptAndOrdered() {
            List<PriceRecord> records = List.of(
                    FuelRouteFixtures.record("far", FuelRouteFixtures.besideRoute(30.0d, 8.0d), 1.30d),
                    FuelRouteFixtures.record("late", FuelRouteFixtures.besideRoute(90.0d, -3.0d), 1.50d),
                    FuelRouteFixtures.record("early", FuelRouteFixtures.besideRoute(15.0d, 2.0d), 1.40d));

            List<CandidateStation> candidates = correlator.correlate(records, corridor);

            assertEquals(2, candidates.size());
            assertEquals("early", candidates.get(0).id());
            assertEquals("late", candidates.get(1).id());
            assertEquals(15_000.0d, candidates.get(0).distanceAlongMeters(), 150.0d);
            assertEquals(90_000.0d, candidates.get(1).distanceAlongMeters(), 150.0d);
        }

        @Test
        @DisplayName("Duplicated listing ids produce a single candidate")
        void testDeduplicated() {
            List<PriceRecord> records = List.of(
                    FuelRouteFixtures.record("dup", FuelRouteFixtures.besideRoute(40.0d, 1.0d), 1.40d),
                    FuelRouteFixtures.record("dup", FuelRouteFixtures.besideRoute(40.0d, 1.0d), 1.40d));

            assertEquals(1, correlator.correlate(records, corridor).size());
        }

        @Test
        @DisplayName("Stations before the start get a zero along distance")
        void testBeforeStartClamped() {
            List<PriceRecord> records = List.of(
                    FuelRouteFixtures.record("behind", FuelRouteFixtures.onRoute(-2.0d), 1.40d));

            List<CandidateStation> candidates = correlator.correlate(records, corridor);
            assertEquals(1, candidates.size());
            assertEquals(0.0d, candidates.get(0).distanceAlongMeters(), 1e-6);
        }
    }

    @Test
    @DisplayName("Indexed correlation agrees with a linear containment scan")
    void testAgreesWithLinearScan() {
        Random random = new Random(7L);
        List<PriceRecord> records = new ArrayList<>();
        for (int i = 0; i < 2_000; i++) {
            GeoPoint location = FuelRouteFixtures.besideRoute(-20.0d + random.nextDouble() * 160.0d,
                    -15.0d + random.nextDouble() * 30.0d);
            records.add(FuelRouteFixtures.record("s" + i, location, 1.2d + random.nextDouble() * 0.5d));
        }

        StationIndex index = StationIndex.build(records, builder.projection(), builder.metricFactory());
        Set<String> indexed = new HashSet<>();
        for (CandidateStation candidate : correlator.correlate(index, corridor)) {
            indexed.add(candidate.id());
        }

        Set<String> scanned = new HashSet<>();
        for (StationIndex.IndexedStation station : index.stations()) {
            if (corridor.polygon().contains(station.metricPoint())) {
                scanned.add(station.record().id());
            }
        }
        assertEquals(scanned, indexed);
        assertTrue(indexed.size() > 100, "fixture should put a good share of stations inside");
    }

    @Test
    @DisplayName("Stations outside the projection extent are skipped by the index")
    void testIndexSkipsOutOfExtent() {
        List<PriceRecord> records = List.of(
                FuelRouteFixtures.record("madrid", FuelRouteFixtures.onRoute(10.0d), 1.4d),
                FuelRouteFixtures.record("tokyo", new GeoPoint(35.68d, 139.76d), 1.4d));

        StationIndex index = StationIndex.build(records, builder.projection(), builder.metricFactory());

        assertEquals(1, index.size());
        assertEquals(1, index.skipped());
    }
}
