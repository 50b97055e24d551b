package org.fuelroute.ingestion;

import org.fuelroute.geometry.GeoPath;
import org.fuelroute.geometry.GeoPoint;
import org.fuelroute.testutil.FuelRouteFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TrackValidator Tests")
class TrackValidatorTest {

    @Test
    @DisplayName("A route through central Spain is accepted")
    void testAccepted() {
        assertDoesNotThrow(() -> TrackValidator.defaults().validate(FuelRouteFixtures.straightRoute(100.0d, 50)));
    }

    @Test
    @DisplayName("Too many points are refused before any processing")
    void testTooManyPoints() {
        TrackValidator validator = new TrackValidator(10, RegionBounds.SPAIN);
        TrackValidationException ex = assertThrows(TrackValidationException.class,
                () -> validator.validate(FuelRouteFixtures.straightRoute(10.0d, 11)));
        assertEquals(TrackValidationException.REASON_TOO_MANY_POINTS, ex.reasonCode());
        assertDoesNotThrow(() -> validator.validate(FuelRouteFixtures.straightRoute(10.0d, 10)));
    }

    @Test
    @DisplayName("A route whose centroid lies outside Spain is refused")
    void testOutOfRegion() {
        GeoPath paris = GeoPath.of(List.of(new GeoPoint(48.85d, 2.35d), new GeoPoint(48.90d, 2.40d)));
        TrackValidationException ex = assertThrows(TrackValidationException.class,
                () -> TrackValidator.defaults().validate(paris));
        assertEquals(TrackValidationException.REASON_OUT_OF_REGION, ex.reasonCode());
    }

    @Test
    @DisplayName("Region bounds are strict and include the Canaries")
    void testRegionBounds() {
        assertTrue(RegionBounds.SPAIN.contains(new GeoPoint(28.1d, -15.4d)));
        assertFalse(RegionBounds.SPAIN.contains(new GeoPoint(44.0d, -3.0d)));
        assertFalse(RegionBounds.SPAIN.contains(new GeoPoint(40.0d, 4.3d)));
    }

    @Test
    @DisplayName("Fewer than two allowed points is a configuration error")
    void testInvalidConfiguration() {
        assertThrows(IllegalArgumentException.class, () -> new TrackValidator(1, RegionBounds.SPAIN));
        assertThrows(NullPointerException.class, () -> new TrackValidator(10, null));
    }
}
