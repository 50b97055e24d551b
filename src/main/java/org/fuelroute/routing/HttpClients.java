package org.fuelroute.routing;

import lombok.experimental.UtilityClass;
import okhttp3.OkHttpClient;

import java.time.Duration;
import java.util.Objects;

/**
 * Shared OkHttp client construction for the public services the engine talks to.
 *
 * <p>Every client carries a call timeout; those services are unauthenticated and
 * sometimes hang.</p>
 */
@UtilityClass
public class HttpClients {
    public static final String USER_AGENT = "fuel-route-optimizer/1.0 (+https://github.com/fuelroute)";

    private static final OkHttpClient BASE = new OkHttpClient.Builder()
            .addInterceptor(chain -> chain.proceed(chain.request().newBuilder()
                    .header("User-Agent", USER_AGENT)
                    .header("Accept", "application/json, text/plain, */*")
                    .build()))
            .build();

    /**
     * Client sharing the base connection pool, with the given whole-call timeout.
     */
    public static OkHttpClient withTimeout(Duration callTimeout) {
        return withTimeout(BASE, callTimeout);
    }

    /**
     * Derives a client from {@code base} (sharing its pool and interceptors) with the given timeout.
     */
    public static OkHttpClient withTimeout(OkHttpClient base, Duration callTimeout) {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(callTimeout, "callTimeout");
        if (callTimeout.isNegative() || callTimeout.isZero()) {
            throw new IllegalArgumentException("callTimeout must be > 0, got " + callTimeout);
        }
        return base.newBuilder()
                .callTimeout(callTimeout)
                .connectTimeout(callTimeout)
                .readTimeout(callTimeout)
                .build();
    }

    public static OkHttpClient shared() {
        return BASE;
    }
}
