package smartaqms.analytics.detector;

import smartaqms.domain.alert.DetectionMethod;

import java.util.List;
import java.util.Map;

/**
 * Resultado de un ciclo del ensemble.
 *
 * @param skipped métodos omitidos en este ciclo y el motivo
 */
public record EnsembleOutcome(List<AnomalyVerdict> verdicts, Map<DetectionMethod, String> skipped) {

    public boolean isDegraded() {
        return !skipped.isEmpty();
    }

    public List<AnomalyVerdict> anomalies() {
        return verdicts.stream().filter(AnomalyVerdict::anomalous).toList();
    }
}
