package org.fuelroute.pipeline;

import org.fuelroute.planner.PlanningStrategy;
import org.fuelroute.station.FuelType;
import org.fuelroute.station.UnknownFuelTypeException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("FuelRouteConfig Tests")
class FuelRouteConfigTest {

    private static Properties properties(String... keyValues) {
        Properties properties = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) {
            properties.setProperty(FuelRouteConfig.PREFIX + keyValues[i], keyValues[i + 1]);
        }
        return properties;
    }

    @Test
    @DisplayName("Defaults match the documented values")
    void testDefaults() {
        FuelRouteConfig config = FuelRouteConfig.defaults();

        assertEquals(5_000.0d, config.getBufferMeters(), 0.0d);
        assertEquals(5, config.getTopN());
        assertEquals(0.0d, config.getSegmentKm(), 0.0d);
        assertEquals(FuelType.GASOLEO_A, config.getFuelType());
        assertTrue(config.isEnrichDetours());
        assertEquals(3, config.getBreakerThreshold());
        assertEquals(Duration.ofSeconds(2), config.getEnrichmentTimeout());
        assertEquals(Duration.ofMinutes(30), config.getPriceCacheTtl());
        assertEquals(PlanningStrategy.COST_MINIMAL, config.getPlanningStrategy());
        assertEquals(9, config.getMaxWaypoints());
        assertEquals(0.10d, config.plannerConfig().getReserveFraction(), 0.0d);
    }

    @Test
    @DisplayName("Bundled properties file reproduces the defaults")
    void testBundledProperties() throws IOException {
        Properties bundled = new Properties();
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("fuelroute.properties")) {
            assertNotNull(in);
            bundled.load(in);
        }

        assertEquals(FuelRouteConfig.defaults(), FuelRouteConfig.fromProperties(bundled));
    }

    @Test
    @DisplayName("Present keys override the defaults and missing keys keep them")
    void testOverrides() {
        FuelRouteConfig config = FuelRouteConfig.fromProperties(properties(
                "buffer.meters", "2500",
                "fuel-type", "GASOLINA_95_E5",
                "ranking.top-n", "3",
                "ranking.segment-km", "150",
                "enrichment.enabled", "FALSE",
                "routing.route-timeout-ms", "20000",
                "planner.strategy", "greedy",
                "export.max-waypoints", "5"));

        assertEquals(2_500.0d, config.getBufferMeters(), 0.0d);
        assertEquals(FuelType.GASOLINA_95_E5, config.getFuelType());
        assertEquals(3, config.getTopN());
        assertEquals(150.0d, config.getSegmentKm(), 0.0d);
        assertFalse(config.isEnrichDetours());
        assertEquals(Duration.ofSeconds(20), config.getRouteTimeout());
        assertEquals(PlanningStrategy.GREEDY, config.getPlanningStrategy());
        assertEquals(5, config.getMaxWaypoints());
        assertEquals(FuelRouteConfig.defaults().getLegTimeout(), config.getLegTimeout());
    }

    @Test
    @DisplayName("Unparseable or out-of-range values are refused")
    void testInvalidValues() {
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> FuelRouteConfig.fromProperties(properties("buffer.meters", "wide")));
        assertTrue(ex.getMessage().contains("fuelroute.buffer.meters"));
        assertThrows(IllegalArgumentException.class,
                () -> FuelRouteConfig.fromProperties(properties("enrichment.enabled", "yes")));
        assertThrows(IllegalArgumentException.class,
                () -> FuelRouteConfig.fromProperties(properties("buffer.meters", "-5")));
        assertThrows(IllegalArgumentException.class,
                () -> FuelRouteConfig.fromProperties(properties("enrichment.workers", "0")));
        assertThrows(IllegalArgumentException.class,
                () -> FuelRouteConfig.fromProperties(properties("planner.reserve-fraction", "1.5")));
        assertThrows(UnknownFuelTypeException.class,
                () -> FuelRouteConfig.fromProperties(properties("fuel-type", "kerosene")));
    }
}
