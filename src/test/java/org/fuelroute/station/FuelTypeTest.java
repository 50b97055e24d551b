package org.fuelroute.station;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("FuelType Tests")
class FuelTypeTest {

    @Test
    @DisplayName("Lookup accepts source labels and enum names regardless of case and accents")
    void testLookup() {
        assertEquals(FuelType.GASOLEO_A, FuelType.fromLabel("Precio Gasoleo A"));
        assertEquals(FuelType.GASOLEO_A, FuelType.fromLabel("  gasoleo_a "));
        assertEquals(FuelType.GASES_LICUADOS_PETROLEO, FuelType.fromLabel("Precio Gases licuados del petroleo"));
        assertEquals(FuelType.GASOLINA_95_E5, FuelType.fromLabel("PRECIO GASOLINA 95 E5"));
    }

    @Test
    @DisplayName("Unknown labels list every available column")
    void testUnknownLabel() {
        UnknownFuelTypeException ex = assertThrows(UnknownFuelTypeException.class,
                () -> FuelType.fromLabel("Precio Queroseno"));

        assertEquals(UnknownFuelTypeException.REASON_UNKNOWN_FUEL_TYPE, ex.reasonCode());
        assertEquals(FuelType.values().length, ex.availableLabels().size());
        assertTrue(ex.getMessage().contains("Precio Gasoleo A"));
        assertThrows(UnknownFuelTypeException.class, () -> FuelType.fromLabel(null));
    }
}
