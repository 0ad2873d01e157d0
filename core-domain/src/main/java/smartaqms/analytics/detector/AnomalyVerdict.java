package smartaqms.analytics.detector;

import smartaqms.domain.alert.AlertSeverity;
import smartaqms.domain.alert.DetectionMethod;

/**
 * Veredicto fusionado para una lectura de la ventana.
 *
 * @param index            posición de la lectura en la ventana
 * @param anomalous        algún método la marcó (OR)
 * @param score            puntuación normalizada máxima entre los métodos ejecutados
 * @param method           método(s) que la marcaron; null si no es anómala
 * @param dominantFeature  característica con mayor |z|, o -1 si el estadístico no se ejecutó
 */
public record AnomalyVerdict(
        int index,
        boolean anomalous,
        double score,
        DetectionMethod method,
        int dominantFeature
) {
    public AlertSeverity severity() {
        return AlertSeverity.fromNormalizedScore(score);
    }
}
