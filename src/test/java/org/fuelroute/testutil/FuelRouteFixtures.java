package org.fuelroute.testutil;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.fuelroute.geometry.GeoPath;
import org.fuelroute.geometry.GeoPoint;
import org.fuelroute.station.CandidateStation;
import org.fuelroute.station.FuelType;
import org.fuelroute.station.PriceRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Shared fixtures: a straight north-bound route through central Spain, stations along it,
 * and OkHttp clients answering from canned responses.
 */
public final class FuelRouteFixtures {
    public static final FuelType DIESEL = FuelType.GASOLEO_A;
    public static final double START_LATITUDE = 40.0d;
    public static final double ROUTE_LONGITUDE = -3.7d;
    /** Meridian arc length of one degree of latitude around 40N. */
    public static final double METERS_PER_DEGREE_LATITUDE = 111_034.0d;

    private FuelRouteFixtures() {
    }

    /**
     * Point {@code km} north of the route start on the route meridian.
     */
    public static GeoPoint onRoute(double km) {
        return new GeoPoint(START_LATITUDE + km * 1000.0d / METERS_PER_DEGREE_LATITUDE, ROUTE_LONGITUDE);
    }

    /**
     * Point {@code km} north of the route start, {@code eastKm} east of the route meridian.
     */
    public static GeoPoint besideRoute(double km, double eastKm) {
        GeoPoint base = onRoute(km);
        double metersPerDegreeLongitude = METERS_PER_DEGREE_LATITUDE * Math.cos(Math.toRadians(base.latitude()));
        return new GeoPoint(base.latitude(), base.longitude() + eastKm * 1000.0d / metersPerDegreeLongitude);
    }

    /**
     * North-bound straight route of {@code lengthKm} with {@code points} evenly spaced vertices.
     */
    public static GeoPath straightRoute(double lengthKm, int points) {
        List<GeoPoint> vertices = new ArrayList<>(points);
        for (int i = 0; i < points; i++) {
            vertices.add(onRoute(lengthKm * i / (points - 1)));
        }
        return GeoPath.of(vertices);
    }

    public static PriceRecord record(String id, GeoPoint location, double dieselPrice) {
        return PriceRecord.builder()
                .id(id)
                .name("Station " + id)
                .location(location)
                .price(DIESEL, dieselPrice)
                .build();
    }

    /**
     * Candidate with an exact along-route position.
     */
    public static CandidateStation candidate(String id, double km, double dieselPrice) {
        return new CandidateStation(record(id, onRoute(km), dieselPrice), km * 1000.0d);
    }

    /**
     * Client whose every call is answered by {@code responder} without touching the network.
     */
    public static OkHttpClient cannedClient(Function<Request, Canned> responder) {
        return new OkHttpClient.Builder()
                .addInterceptor(chain -> {
                    Request request = chain.request();
                    Canned canned = responder.apply(request);
                    return new Response.Builder()
                            .request(request)
                            .protocol(Protocol.HTTP_1_1)
                            .code(canned.code())
                            .message("canned " + canned.code())
                            .body(ResponseBody.create(canned.body(), MediaType.get("application/json")))
                            .build();
                })
                .build();
    }

    public record Canned(int code, String body) {
        public static Canned ok(String body) {
            return new Canned(200, body);
        }

        public static Canned status(int code) {
            return new Canned(code, "");
        }
    }
}
