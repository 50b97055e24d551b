package org.fuelroute.station;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Time-boxed cache in front of another {@link PriceSource}.
 *
 * <p>A failed refresh propagates and leaves the previous snapshot in place; the stale
 * snapshot is not served after expiry.</p>
 */
@Slf4j
public final class CachedPriceSource implements PriceSource {
    public static final Duration DEFAULT_TTL = Duration.ofMinutes(30);

    private final PriceSource delegate;
    private final Duration ttl;
    private final Clock clock;

    private List<PriceRecord> snapshot;
    private Instant fetchedAt;

    public CachedPriceSource(PriceSource delegate) {
        this(delegate, DEFAULT_TTL, Clock.systemUTC());
    }

    public CachedPriceSource(PriceSource delegate, Duration ttl, Clock clock) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
        this.clock = Objects.requireNonNull(clock, "clock");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be > 0, got " + ttl);
        }
    }

    @Override
    public synchronized List<PriceRecord> fetchAll() {
        Instant now = clock.instant();
        if (snapshot != null && now.isBefore(fetchedAt.plus(ttl))) {
            return snapshot;
        }
        List<PriceRecord> fresh = List.copyOf(delegate.fetchAll());
        snapshot = fresh;
        fetchedAt = now;
        log.debug("Price snapshot refreshed: {} records", fresh.size());
        return fresh;
    }

    /**
     * Drops the snapshot so the next call refreshes.
     */
    public synchronized void invalidate() {
        snapshot = null;
        fetchedAt = null;
    }
}
