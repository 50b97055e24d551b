package org.fuelroute.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.HttpUrl;
import okhttp3.Request;
import org.fuelroute.geometry.GeoPoint;
import org.fuelroute.testutil.FuelRouteFixtures;
import org.fuelroute.testutil.FuelRouteFixtures.Canned;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

@DisplayName("NominatimGeocoder Tests")
class NominatimGeocoderTest {

    private static NominatimGeocoder geocoder(Function<Request, Canned> responder) {
        return new NominatimGeocoder(FuelRouteFixtures.cannedClient(responder), new ObjectMapper(),
                NominatimGeocoder.SEARCH_URL, Duration.ZERO);
    }

    @Test
    @DisplayName("Best match is parsed from string coordinates and the query asks for one result")
    void testBestMatch() {
        AtomicReference<Request> seen = new AtomicReference<>();
        NominatimGeocoder geocoder = geocoder(request -> {
            seen.set(request);
            return Canned.ok("[{\"lat\":\"40.4167047\",\"lon\":\"-3.7035825\",\"display_name\":\"Madrid\"},"
                    + "{\"lat\":\"1.0\",\"lon\":\"1.0\"}]");
        });

        GeoPoint point = geocoder.geocode("  Madrid ");

        assertEquals(40.4167047d, point.latitude(), 1e-9);
        assertEquals(-3.7035825d, point.longitude(), 1e-9);
        HttpUrl url = seen.get().url();
        assertEquals("Madrid", url.queryParameter("q"));
        assertEquals("json", url.queryParameter("format"));
        assertEquals("1", url.queryParameter("limit"));
        assertEquals("https://www.openstreetmap.org/", seen.get().header("Referer"));
    }

    @Test
    @DisplayName("An empty result list is a not-found error")
    void testNotFound() {
        RouteTextException ex = assertThrows(RouteTextException.class,
                () -> geocoder(request -> Canned.ok("[]")).geocode("Atlantis"));
        assertEquals(RouteTextException.REASON_GEOCODE_NOT_FOUND, ex.reasonCode());
    }

    @Test
    @DisplayName("HTTP errors and malformed payloads are geocoding failures")
    void testFailures() {
        RouteTextException status = assertThrows(RouteTextException.class,
                () -> geocoder(request -> Canned.status(503)).geocode("Madrid"));
        assertEquals(RouteTextException.REASON_GEOCODE_FAILED, status.reasonCode());

        RouteTextException malformed = assertThrows(RouteTextException.class,
                () -> geocoder(request -> Canned.ok("{not json")).geocode("Madrid"));
        assertEquals(RouteTextException.REASON_GEOCODE_FAILED, malformed.reasonCode());

        RouteTextException badCoordinates = assertThrows(RouteTextException.class,
                () -> geocoder(request -> Canned.ok("[{\"lat\":\"north\",\"lon\":\"-3\"}]")).geocode("Madrid"));
        assertEquals(RouteTextException.REASON_GEOCODE_FAILED, badCoordinates.reasonCode());
    }

    @Test
    @DisplayName("Blank place names are refused without a request")
    void testBlankPlace() {
        RouteTextException ex = assertThrows(RouteTextException.class,
                () -> geocoder(request -> {
                    throw new AssertionError("no request expected");
                }).geocode(" "));
        assertEquals(RouteTextException.REASON_GEOCODE_NOT_FOUND, ex.reasonCode());
    }
}
