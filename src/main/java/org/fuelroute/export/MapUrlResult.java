package org.fuelroute.export;

import java.util.Objects;

/**
 * Navigation URL with the number of stops it carries and the number left out.
 */
public record MapUrlResult(String url, int includedStops, int omittedStops) {
    public MapUrlResult {
        Objects.requireNonNull(url, "url");
        if (includedStops < 0 || omittedStops < 0) {
            throw new IllegalArgumentException("stop counts must be >= 0");
        }
    }

    public boolean truncated() {
        return omittedStops > 0;
    }
}
