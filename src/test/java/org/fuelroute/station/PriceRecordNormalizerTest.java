package org.fuelroute.station;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("PriceRecordNormalizer Tests")
class PriceRecordNormalizerTest {
    private final ObjectMapper mapper = new ObjectMapper();

    private JsonNode listing() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/listing.json")) {
            return mapper.readTree(in);
        }
    }

    @Test
    @DisplayName("Comma decimals parse and garbage yields empty")
    void testParseDecimal() {
        assertEquals(1.549d, PriceRecordNormalizer.parseDecimal("1,549").getAsDouble(), 1e-12);
        assertEquals(-3.626694d, PriceRecordNormalizer.parseDecimal(" -3,626694 ").getAsDouble(), 1e-12);
        assertTrue(PriceRecordNormalizer.parseDecimal("").isEmpty());
        assertTrue(PriceRecordNormalizer.parseDecimal(null).isEmpty());
        assertTrue(PriceRecordNormalizer.parseDecimal("n/a").isEmpty());
        assertTrue(PriceRecordNormalizer.parseDecimal("NaN").isEmpty());
    }

    @Test
    @DisplayName("Rows without usable coordinates are dropped and the rest are normalized")
    void testNormalizeListing() throws IOException {
        List<PriceRecord> records = PriceRecordNormalizer.normalizeListing(listing());

        assertEquals(2, records.size());
        PriceRecord repsol = records.get(0);
        assertEquals("4375", repsol.id());
        assertEquals("REPSOL", repsol.name());
        assertEquals("San Sebastián de los Reyes", repsol.municipality());
        assertEquals(40.545417d, repsol.location().latitude(), 1e-9);
        assertEquals(-3.626694d, repsol.location().longitude(), 1e-9);
        assertEquals(1.459d, repsol.price(FuelType.GASOLEO_A).getAsDouble(), 1e-12);
        assertEquals(1.569d, repsol.price(FuelType.GASOLINA_95_E5).getAsDouble(), 1e-12);
        assertTrue(repsol.price(FuelType.HIDROGENO).isEmpty());

        PriceRecord ballenoil = records.get(1);
        assertFalse(ballenoil.sells(FuelType.GASOLINA_95_E5));
        assertTrue(ballenoil.sells(FuelType.GASOLEO_A));
    }

    @Test
    @DisplayName("Non-object rows and rows without an id are dropped")
    void testNormalizeRowDrops() throws IOException {
        assertNull(PriceRecordNormalizer.normalizeRow(mapper.readTree("[1, 2]")));
        assertNull(PriceRecordNormalizer.normalizeRow(
                mapper.readTree("{\"Latitud\":\"40,1\",\"Longitud (WGS84)\":\"-3,1\"}")));
        assertNull(PriceRecordNormalizer.normalizeRow(
                mapper.readTree("{\"IDEESS\":\"1\",\"Latitud\":\"40,1\",\"Longitud (WGS84)\":\"0,0\"}")));
    }

    @Test
    @DisplayName("Listings without rows, or without any usable row, are empty")
    void testEmptyListing() throws IOException {
        PriceSourceException noRows = assertThrows(PriceSourceException.class,
                () -> PriceRecordNormalizer.normalizeListing(mapper.readTree("{\"ListaEESSPrecio\":[]}")));
        assertEquals(PriceSourceException.REASON_EMPTY, noRows.reasonCode());

        PriceSourceException noUsable = assertThrows(PriceSourceException.class,
                () -> PriceRecordNormalizer.normalizeListing(mapper.readTree(
                        "{\"ListaEESSPrecio\":[{\"IDEESS\":\"1\",\"Latitud\":\"\",\"Longitud (WGS84)\":\"\"}]}")));
        assertEquals(PriceSourceException.REASON_EMPTY, noUsable.reasonCode());
    }
}
