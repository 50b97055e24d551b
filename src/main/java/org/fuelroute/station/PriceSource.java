package org.fuelroute.station;

import java.util.List;

/**
 * Supplier of the bulk price listing.
 *
 * <p>Implementations return records that are already normalized: numeric coordinates and
 * prices, no rows without coordinates.</p>
 */
@FunctionalInterface
public interface PriceSource {

    /**
     * Returns the full listing.
     *
     * @throws PriceSourceException when the listing cannot be obtained.
     */
    List<PriceRecord> fetchAll();
}
