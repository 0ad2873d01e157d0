package smartaqms.analytics.detector;

import smartaqms.domain.alert.DetectionMethod;

/**
 * Puntuaciones por lectura de un método. Las puntuaciones están normalizadas de forma que
 * 1.0 es el umbral de detección del método: por encima, la lectura queda marcada.
 *
 * @param dominantFeatures índice de la característica que más contribuye, o -1 si el método
 *                         no es atribuible a una sola característica
 */
public record DetectorResult(DetectionMethod method, double[] normalizedScores, int[] dominantFeatures) {

    public static final double FLAG_THRESHOLD = 1.0;

    public boolean isFlagged(int index) {
        return normalizedScores[index] > FLAG_THRESHOLD;
    }

    public int size() {
        return normalizedScores.length;
    }
}
