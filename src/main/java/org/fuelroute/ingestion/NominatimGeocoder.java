package org.fuelroute.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.fuelroute.geometry.GeoPoint;
import org.fuelroute.routing.HttpClients;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * {@link Geocoder} over the public OpenStreetMap Nominatim search API.
 *
 * <p>The public instance allows at most one request per second, so each lookup waits
 * {@code courtesyDelay} before issuing its request.</p>
 */
@Slf4j
public final class NominatimGeocoder implements Geocoder {
    public static final String SEARCH_URL = "https://nominatim.openstreetmap.org/search";
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    public static final Duration DEFAULT_COURTESY_DELAY = Duration.ofSeconds(1);

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final HttpUrl searchUrl;
    private final Duration courtesyDelay;

    public NominatimGeocoder() {
        this(HttpClients.withTimeout(DEFAULT_TIMEOUT), new ObjectMapper(), SEARCH_URL, DEFAULT_COURTESY_DELAY);
    }

    public NominatimGeocoder(OkHttpClient client, ObjectMapper mapper, String searchUrl, Duration courtesyDelay) {
        this.client = Objects.requireNonNull(client, "client");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.searchUrl = HttpUrl.get(Objects.requireNonNull(searchUrl, "searchUrl"));
        this.courtesyDelay = Objects.requireNonNull(courtesyDelay, "courtesyDelay");
        if (courtesyDelay.isNegative()) {
            throw new IllegalArgumentException("courtesyDelay must be >= 0, got " + courtesyDelay);
        }
    }

    @Override
    public GeoPoint geocode(String place) {
        if (place == null || place.isBlank()) {
            throw new RouteTextException(RouteTextException.REASON_GEOCODE_NOT_FOUND, "place name must be non-blank");
        }
        String query = place.trim();
        pause();

        HttpUrl url = searchUrl.newBuilder()
                .addQueryParameter("q", query)
                .addQueryParameter("format", "json")
                .addQueryParameter("limit", "1")
                .build();
        Request request = new Request.Builder()
                .url(url)
                .header("Referer", "https://www.openstreetmap.org/")
                .get()
                .build();
        JsonNode results;
        try (Response response = client.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("empty body");
            }
            results = mapper.readTree(body.byteStream());
        } catch (IOException | RuntimeException ex) {
            throw new RouteTextException(RouteTextException.REASON_GEOCODE_FAILED,
                    "geocoding '" + query + "' failed: " + ex.getMessage(), ex);
        }

        if (results == null || !results.isArray() || results.isEmpty()) {
            throw new RouteTextException(RouteTextException.REASON_GEOCODE_NOT_FOUND,
                    "no location found for '" + query + "'; try the full city or province name");
        }
        JsonNode best = results.get(0);
        try {
            GeoPoint point = new GeoPoint(
                    Double.parseDouble(best.path("lat").asText()),
                    Double.parseDouble(best.path("lon").asText())
            );
            log.info("Geocoded '{}' to {}", query, point);
            return point;
        } catch (IllegalArgumentException ex) {
            throw new RouteTextException(RouteTextException.REASON_GEOCODE_FAILED,
                    "geocoder returned unusable coordinates for '" + query + "'", ex);
        }
    }

    private void pause() {
        if (courtesyDelay.isZero()) {
            return;
        }
        try {
            Thread.sleep(courtesyDelay.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new RouteTextException(RouteTextException.REASON_GEOCODE_FAILED, "interrupted before geocoding", ex);
        }
    }
}
