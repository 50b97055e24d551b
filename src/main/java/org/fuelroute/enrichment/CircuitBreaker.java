package org.fuelroute.enrichment;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Consecutive-failure breaker for one enrichment batch.
 *
 * <p>Opens after {@code threshold} failures in a row and stays open; a success before that
 * resets the count. There is no half-open state.</p>
 */
public final class CircuitBreaker {
    private final int threshold;
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile boolean open;

    public CircuitBreaker(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("threshold must be >= 1, got " + threshold);
        }
        this.threshold = threshold;
    }

    public void recordSuccess() {
        if (!open) {
            consecutiveFailures.set(0);
        }
    }

    /**
     * @return true when this failure opened (or found open) the breaker.
     */
    public boolean recordFailure() {
        if (consecutiveFailures.incrementAndGet() >= threshold) {
            open = true;
        }
        return open;
    }

    public boolean isOpen() {
        return open;
    }

    public int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    public int threshold() {
        return threshold;
    }
}
