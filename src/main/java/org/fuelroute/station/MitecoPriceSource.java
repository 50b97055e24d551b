package org.fuelroute.station;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.fuelroute.routing.HttpClients;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * {@link PriceSource} backed by the national fuel-price REST listing.
 *
 * <p>The listing host rejects some data-center networks, so the fetch walks a fixed cascade:
 * the direct endpoint first, then pass-through mirrors in order. The first endpoint that
 * yields a readable document wins; no endpoint is retried.</p>
 */
@Slf4j
public final class MitecoPriceSource implements PriceSource {
    public static final String LISTING_URL =
            "https://sedeaplicaciones.minetur.gob.es/ServiciosRESTCarburantes/PreciosCarburantes/EstacionesTerrestres/";
    public static final Duration DEFAULT_DIRECT_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_MIRROR_TIMEOUT = Duration.ofSeconds(15);

    /**
     * One endpoint of the cascade.
     *
     * @param name label used in logs.
     * @param url absolute URL.
     * @param wrapped true when the payload arrives as a JSON string under {@code contents}.
     * @param timeout whole-call timeout.
     */
    public record ListingEndpoint(String name, String url, boolean wrapped, Duration timeout) {
        public ListingEndpoint {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(timeout, "timeout");
        }
    }

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final List<ListingEndpoint> endpoints;

    public MitecoPriceSource() {
        this(HttpClients.shared(), new ObjectMapper(), defaultEndpoints());
    }

    public MitecoPriceSource(OkHttpClient client, ObjectMapper mapper, List<ListingEndpoint> endpoints) {
        this.client = Objects.requireNonNull(client, "client");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(endpoints, "endpoints");
        if (endpoints.isEmpty()) {
            throw new IllegalArgumentException("endpoints must be non-empty");
        }
        this.endpoints = List.copyOf(endpoints);
    }

    /**
     * Direct endpoint followed by the three public pass-through mirrors.
     */
    public static List<ListingEndpoint> defaultEndpoints() {
        String encoded = URLEncoder.encode(LISTING_URL, StandardCharsets.UTF_8);
        return List.of(
                new ListingEndpoint("direct", LISTING_URL, false, DEFAULT_DIRECT_TIMEOUT),
                new ListingEndpoint("corsproxy.io", "https://corsproxy.io/?" + encoded, false, DEFAULT_MIRROR_TIMEOUT),
                new ListingEndpoint("api.allorigins.win", "https://api.allorigins.win/get?url=" + encoded, true,
                        DEFAULT_MIRROR_TIMEOUT),
                new ListingEndpoint("api.codetabs.com", "https://api.codetabs.com/v1/proxy?quest=" + encoded, false,
                        DEFAULT_MIRROR_TIMEOUT)
        );
    }

    public List<ListingEndpoint> endpoints() {
        return endpoints;
    }

    @Override
    public List<PriceRecord> fetchAll() {
        Exception lastFailure = null;
        for (ListingEndpoint endpoint : endpoints) {
            try {
                JsonNode document = fetchDocument(endpoint);
                log.info("Price listing obtained via {}", endpoint.name());
                return PriceRecordNormalizer.normalizeListing(document);
            } catch (IOException | RuntimeException ex) {
                lastFailure = ex;
                log.warn("Price listing endpoint {} failed: {}", endpoint.name(), ex.toString());
            }
        }
        throw new PriceSourceException(
                PriceSourceException.REASON_UNAVAILABLE,
                "price listing unreachable through " + endpoints.size() + " endpoint(s)",
                lastFailure
        );
    }

    private JsonNode fetchDocument(ListingEndpoint endpoint) throws IOException {
        Request request = new Request.Builder()
                .url(endpoint.url())
                .header("Accept-Language", "es-ES,es;q=0.9")
                .get()
                .build();
        OkHttpClient timed = HttpClients.withTimeout(client, endpoint.timeout());
        try (Response response = timed.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("HTTP " + response.code() + " from " + endpoint.name());
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new IOException("empty body from " + endpoint.name());
            }
            JsonNode root = mapper.readTree(body.byteStream());
            if (!endpoint.wrapped()) {
                return root;
            }
            JsonNode contents = root == null ? null : root.get("contents");
            if (contents == null || !contents.isTextual()) {
                throw new IOException("wrapped payload without contents from " + endpoint.name());
            }
            return mapper.readTree(contents.asText());
        }
    }
}
