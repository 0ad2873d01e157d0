package smartaqms.domain.prediction;

import java.util.List;

/**
 * Categorías ordenadas de calidad del aire. El ordinal es el índice de clase del clasificador.
 */
public enum AqiCategory {
    GOOD("Good"),
    MODERATE("Moderate"),
    UNHEALTHY("Unhealthy"),
    HAZARDOUS("Hazardous");

    private static final List<AqiCategory> ORDERED = List.of(values());

    private final String label;

    AqiCategory(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Etiqueta de referencia a partir de PM2.5 (µg/m³), según los cortes 12 / 35 / 55.
     */
    public static AqiCategory fromPm25(double pm25) {
        if (pm25 <= 12.0) return GOOD;
        if (pm25 <= 35.0) return MODERATE;
        if (pm25 <= 55.0) return UNHEALTHY;
        return HAZARDOUS;
    }

    public static AqiCategory ofIndex(int index) {
        return ORDERED.get(index);
    }

    public static int count() {
        return ORDERED.size();
    }
}
