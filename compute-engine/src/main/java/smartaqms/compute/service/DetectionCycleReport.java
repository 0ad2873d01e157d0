package smartaqms.compute.service;

import java.util.List;

/**
 * Resumen de un ciclo del detector.
 *
 * @param degradedZones zonas en las que algún método se omitió o la zona falló
 */
public record DetectionCycleReport(
        int zones,
        int readingsScored,
        int anomalies,
        int alertsRaised,
        List<String> degradedZones,
        long durationMs
) {
    public boolean isDegraded() {
        return !degradedZones.isEmpty();
    }
}
