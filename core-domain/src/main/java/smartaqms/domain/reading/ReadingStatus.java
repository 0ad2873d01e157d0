package smartaqms.domain.reading;

/**
 * Estado cualitativo de una lectura, derivado en la ingesta a partir de PM2.5 y CO2.
 */
public enum ReadingStatus {
    NORMAL, WARNING, ALERT, CRITICAL;

    public static ReadingStatus of(double pm25, double co2Ppm) {
        if (pm25 > 100.0 || co2Ppm > 850.0) return CRITICAL;
        if (pm25 > 55.0 || co2Ppm > 700.0) return ALERT;
        if (pm25 > 35.0 || co2Ppm > 600.0) return WARNING;
        return NORMAL;
    }
}
