package smartaqms.domain.reading;

import com.fasterxml.jackson.annotation.JsonCreator;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Magnitudes medidas por una estación de calidad del aire.
 * <p>
 * Cada magnitud declara su rango físicamente válido. Una lectura con cualquier valor fuera
 * de rango se rechaza en la ingesta. Las magnitudes "core" son obligatorias y forman el
 * vector de características que consumen el detector y el clasificador.
 * <p>
 * {@code resolution} es la menor variación que el sensor distingue del ruido; el detector no
 * trata como desviación nada por debajo de ella.
 */
@Getter
@RequiredArgsConstructor
public enum Quantity {

    PM25("PM25", "µg/m³", 0.0, 1000.0, 1.0, true),
    PM10("PM10", "µg/m³", 0.0, 1000.0, 1.0, false),
    CO2("CO2", "ppm", 0.0, 10000.0, 10.0, true),
    NO2("NO2", "ppm", 0.0, 10.0, 0.005, false),
    O3("O3", "ppm", 0.0, 10.0, 0.005, false),
    TEMPERATURE("TEMPERATURE", "ºC", -60.0, 60.0, 0.5, true),
    HUMIDITY("HUMIDITY", "%", 0.0, 100.0, 2.0, true),
    WIND_SPEED("WIND_SPEED", "m/s", 0.0, 75.0, 0.5, true),
    WIND_DIRECTION("WIND_DIRECTION", "º", 0.0, 360.0, 10.0, false),
    PRESSURE("PRESSURE", "hPa", 800.0, 1100.0, 1.0, false);

    private final String code;
    private final String unit;
    private final double minValid;
    private final double maxValid;
    private final double resolution;
    private final boolean core;

    private static final Map<String, Quantity> BY_CODE = Collections.unmodifiableMap(
            Arrays.stream(values())
                    .collect(Collectors.toMap(q -> q.code.toUpperCase(Locale.ROOT), q -> q))
    );

    /**
     * Orden fijo del vector de características. No reordenar: los pesos persistidos del
     * clasificador dependen de este orden.
     */
    private static final List<Quantity> CORE = List.of(PM25, CO2, TEMPERATURE, HUMIDITY, WIND_SPEED);

    private static final List<Quantity> OPTIONAL = Arrays.stream(values())
            .filter(q -> !q.core)
            .collect(Collectors.toUnmodifiableList());

    public boolean isWithinRange(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return false;
        }
        return value >= minValid && value <= maxValid;
    }

    /**
     * Resuelve el código que envían los alimentadores sin distinguir mayúsculas, puntos ni
     * separadores ("pm2.5", "wind-speed", "Wind Speed"). Devuelve null si no es una magnitud.
     */
    @JsonCreator
    public static Quantity fromString(String text) {
        if (text == null) return null;
        String normalized = text.trim()
                .toUpperCase(Locale.ROOT)
                .replace(".", "")
                .replace('-', '_')
                .replace(' ', '_');
        return BY_CODE.get(normalized);
    }

    public static List<Quantity> core() {
        return CORE;
    }

    /**
     * Resolución de cada magnitud core, en el orden del vector de características.
     */
    public static double[] coreResolution() {
        return CORE.stream().mapToDouble(Quantity::getResolution).toArray();
    }

    public static List<Quantity> optional() {
        return OPTIONAL;
    }

    /**
     * Posición de la magnitud dentro del vector core, o -1 si es opcional.
     */
    public int coreIndex() {
        return CORE.indexOf(this);
    }
}
