package org.fuelroute.station;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.fuelroute.geometry.GeoPoint;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Turns raw listing rows into {@link PriceRecord}s.
 *
 * <p>Numeric fields arrive as strings with a comma decimal separator ({@code "1,549"}).
 * Rows without parseable coordinates, with a zero latitude or longitude, or without an id
 * are dropped.</p>
 */
@Slf4j
@UtilityClass
public class PriceRecordNormalizer {
    public static final String FIELD_LIST = "ListaEESSPrecio";
    static final String FIELD_ID = "IDEESS";
    static final String FIELD_NAME = "Rótulo";
    static final String FIELD_ADDRESS = "Dirección";
    static final String FIELD_MUNICIPALITY = "Municipio";
    static final String FIELD_PROVINCE = "Provincia";
    static final String FIELD_HOURS = "Horario";
    static final String FIELD_LATITUDE = "Latitud";
    static final String FIELD_LONGITUDE = "Longitud (WGS84)";

    /**
     * Parses a locale-decimal number.
     *
     * @return empty for null, blank or non-numeric input.
     */
    public static OptionalDouble parseDecimal(String raw) {
        if (raw == null) {
            return OptionalDouble.empty();
        }
        String trimmed = raw.trim().replace(',', '.');
        if (trimmed.isEmpty()) {
            return OptionalDouble.empty();
        }
        try {
            double value = Double.parseDouble(trimmed);
            return Double.isFinite(value) ? OptionalDouble.of(value) : OptionalDouble.empty();
        } catch (NumberFormatException ex) {
            return OptionalDouble.empty();
        }
    }

    /**
     * Normalizes the full listing document.
     *
     * @throws PriceSourceException when the document carries no rows.
     */
    public static List<PriceRecord> normalizeListing(JsonNode document) {
        JsonNode rows = document == null ? null : document.get(FIELD_LIST);
        if (rows == null || !rows.isArray() || rows.isEmpty()) {
            throw new PriceSourceException(PriceSourceException.REASON_EMPTY,
                    "price listing carries no " + FIELD_LIST + " rows");
        }
        List<PriceRecord> records = new ArrayList<>(rows.size());
        int dropped = 0;
        for (JsonNode row : rows) {
            PriceRecord record = normalizeRow(row);
            if (record == null) {
                dropped++;
            } else {
                records.add(record);
            }
        }
        log.info("Price listing normalized: {} rows, {} dropped without usable coordinates, {} kept",
                rows.size(), dropped, records.size());
        if (records.isEmpty()) {
            throw new PriceSourceException(PriceSourceException.REASON_EMPTY,
                    "no row of the price listing has usable coordinates");
        }
        return Collections.unmodifiableList(records);
    }

    /**
     * Normalizes one row.
     *
     * @return the record, or {@code null} when the row must be dropped.
     */
    public static PriceRecord normalizeRow(JsonNode row) {
        if (row == null || !row.isObject()) {
            return null;
        }
        String id = text(row, FIELD_ID);
        OptionalDouble latitude = parseDecimal(text(row, FIELD_LATITUDE));
        OptionalDouble longitude = parseDecimal(text(row, FIELD_LONGITUDE));
        if (id.isBlank() || latitude.isEmpty() || longitude.isEmpty()) {
            return null;
        }
        double lat = latitude.getAsDouble();
        double lon = longitude.getAsDouble();
        if (lat == 0.0d || lon == 0.0d || Math.abs(lat) > 90.0d || Math.abs(lon) > 180.0d) {
            return null;
        }

        PriceRecord.PriceRecordBuilder builder = PriceRecord.builder()
                .id(id)
                .location(new GeoPoint(lat, lon))
                .name(text(row, FIELD_NAME))
                .address(text(row, FIELD_ADDRESS))
                .municipality(text(row, FIELD_MUNICIPALITY))
                .province(text(row, FIELD_PROVINCE))
                .openingHours(text(row, FIELD_HOURS));
        for (FuelType fuelType : FuelType.values()) {
            OptionalDouble price = parseDecimal(text(row, fuelType.sourceLabel()));
            if (price.isPresent() && price.getAsDouble() >= 0.0d) {
                builder.price(fuelType, price.getAsDouble());
            }
        }
        return builder.build();
    }

    private static String text(JsonNode row, String field) {
        JsonNode node = row.get(field);
        if (node == null || node.isNull()) {
            return "";
        }
        return node.asText("").trim();
    }
}
