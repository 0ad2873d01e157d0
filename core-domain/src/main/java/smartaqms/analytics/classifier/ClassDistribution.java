package smartaqms.analytics.classifier;

import smartaqms.domain.prediction.AqiCategory;

import java.util.EnumMap;
import java.util.Map;

/**
 * Distribución de probabilidad sobre las clases para una lectura.
 * La clase predicha es el argmax; en empate gana el índice menor.
 */
public record ClassDistribution(double[] probabilities, int predicted) {

    public static ClassDistribution of(double[] probabilities) {
        int best = 0;
        for (int k = 1; k < probabilities.length; k++) {
            if (probabilities[k] > probabilities[best]) {
                best = k;
            }
        }
        return new ClassDistribution(probabilities, best);
    }

    public double confidence() {
        return probabilities[predicted];
    }

    public AqiCategory category() {
        return AqiCategory.ofIndex(predicted);
    }

    public Map<AqiCategory, Double> asMap() {
        Map<AqiCategory, Double> map = new EnumMap<>(AqiCategory.class);
        for (int k = 0; k < probabilities.length; k++) {
            map.put(AqiCategory.ofIndex(k), probabilities[k]);
        }
        return map;
    }
}
