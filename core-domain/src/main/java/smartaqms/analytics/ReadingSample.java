package smartaqms.analytics;

import java.time.LocalDateTime;

/**
 * Vista analítica de una lectura persistida: identidad, contexto y vector core
 * (en el orden de {@link smartaqms.domain.reading.Quantity#core()}).
 */
public record ReadingSample(
        long readingId,
        String stationId,
        String zone,
        LocalDateTime timestamp,
        double[] core
) {
    public double pm25() {
        return core[0];
    }
}
