package smartaqms.analytics.detector;

import lombok.RequiredArgsConstructor;
import smartaqms.config.DetectorConfig;
import smartaqms.domain.alert.DetectionMethod;
import smartaqms.domain.exception.ModelFitException;

/**
 * Método estadístico: z-score por característica contra la media/desviación móvil de la zona.
 * La puntuación de una lectura es el |z| máximo dividido por el umbral configurado.
 * <p>
 * La desviación nunca baja de la resolución del sensor: sobre una línea base plana, una
 * variación menor que la resolución no es una desviación.
 */
@RequiredArgsConstructor
public class ZScoreDetector implements AnomalyDetector {

    private static final int MIN_BASELINE_SAMPLES = 2;

    private final DetectorConfig config;

    @Override
    public DetectionMethod method() {
        return DetectionMethod.STATISTICAL;
    }

    @Override
    public DetectorResult score(DetectionWindow window) throws ModelFitException {
        FeatureBaseline baseline = window.baseline();
        if (baseline == null || baseline.sampleCount() < MIN_BASELINE_SAMPLES) {
            throw new ModelFitException("Zone baseline has fewer than " + MIN_BASELINE_SAMPLES + " samples");
        }

        double[][] rows = window.features();
        double[] scores = new double[rows.length];
        int[] dominant = new int[rows.length];

        for (int i = 0; i < rows.length; i++) {
            if (rows[i].length != baseline.dimension()) {
                throw new ModelFitException("Feature dimension " + rows[i].length
                        + " does not match baseline dimension " + baseline.dimension());
            }
            double maxAbsZ = 0.0;
            int maxFeature = 0;
            for (int j = 0; j < rows[i].length; j++) {
                double absZ = Math.abs(baseline.zScore(j, rows[i][j], window.resolution(j)));
                if (absZ > maxAbsZ) {
                    maxAbsZ = absZ;
                    maxFeature = j;
                }
            }
            if (Double.isNaN(maxAbsZ)) {
                throw new ModelFitException("Non-finite z-score at row " + i);
            }
            scores[i] = maxAbsZ / config.getZThreshold();
            dominant[i] = maxFeature;
        }
        return new DetectorResult(method(), scores, dominant);
    }
}
