package org.fuelroute.station;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Fuel types published by the national price listing, keyed by their source column label.
 */
public enum FuelType {
    GASOLEO_A("Precio Gasoleo A"),
    GASOLEO_B("Precio Gasoleo B"),
    GASOLEO_PREMIUM("Precio Gasoleo Premium"),
    GASOLINA_95_E5("Precio Gasolina 95 E5"),
    GASOLINA_95_E10("Precio Gasolina 95 E10"),
    GASOLINA_95_E5_PREMIUM("Precio Gasolina 95 E5 Premium"),
    GASOLINA_98_E5("Precio Gasolina 98 E5"),
    GASOLINA_98_E10("Precio Gasolina 98 E10"),
    BIOETANOL("Precio Bioetanol"),
    BIODIESEL("Precio Biodiesel"),
    GAS_NATURAL_COMPRIMIDO("Precio Gas Natural Comprimido"),
    GAS_NATURAL_LICUADO("Precio Gas Natural Licuado"),
    GASES_LICUADOS_PETROLEO("Precio Gases licuados del petróleo"),
    HIDROGENO("Precio Hidrogeno");

    @Getter
    @Accessors(fluent = true)
    private final String sourceLabel;

    FuelType(String sourceLabel) {
        this.sourceLabel = sourceLabel;
    }

    /**
     * Resolves a fuel type from its source label or enum name.
     *
     * <p>Matching ignores case, accents and surrounding whitespace, so
     * {@code "Precio Gases licuados del petroleo"} and {@code "gasoleo_a"} both resolve.</p>
     *
     * @throws UnknownFuelTypeException when nothing matches.
     */
    public static FuelType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new UnknownFuelTypeException(String.valueOf(label), knownLabels());
        }
        String wanted = fold(label);
        for (FuelType type : values()) {
            if (fold(type.sourceLabel).equals(wanted) || fold(type.name()).equals(wanted)) {
                return type;
            }
        }
        throw new UnknownFuelTypeException(label, knownLabels());
    }

    public static List<String> knownLabels() {
        List<String> labels = new ArrayList<>(values().length);
        for (FuelType type : values()) {
            labels.add(type.sourceLabel);
        }
        return labels;
    }

    private static String fold(String value) {
        String stripped = Normalizer.normalize(value.trim(), Normalizer.Form.NFD).replaceAll("\\p{M}", "");
        return stripped.toLowerCase(Locale.ROOT);
    }
}
