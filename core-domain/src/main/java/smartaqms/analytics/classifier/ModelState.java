package smartaqms.analytics.classifier;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;
import smartaqms.domain.exception.StateCorruptionException;

/**
 * Estado completo del clasificador: pesos, sesgos, estadísticos de estandarización y versión.
 * <p>
 * Objeto de valor: la actualización incremental devuelve una instancia nueva con la versión
 * incrementada y nunca modifica la recibida. Se serializa tal cual en cada checkpoint.
 * Los accesores de arrays devuelven copias.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ModelState {

    long version;
    int featureCount;
    int classCount;

    /**
     * Pesos [clase][característica] sobre entradas estandarizadas.
     */
    double[][] weights;
    double[] bias;

    /**
     * Media y M2 (Welford) acumulados de cada característica, para estandarizar.
     */
    double[] featureMean;
    double[] featureM2;
    long samplesSeen;

    /**
     * Pasos de gradiente aplicados desde el arranque en frío; gobierna el decaimiento del paso.
     */
    long stepCount;

    public static ModelState initial(int featureCount, int classCount, long version) {
        return ModelState.builder()
                .version(version)
                .featureCount(featureCount)
                .classCount(classCount)
                .weights(new double[classCount][featureCount])
                .bias(new double[classCount])
                .featureMean(new double[featureCount])
                .featureM2(new double[featureCount])
                .samplesSeen(0)
                .stepCount(0)
                .build();
    }

    public double[][] getWeights() {
        if (weights == null) {
            return null;
        }
        double[][] copy = new double[weights.length][];
        for (int k = 0; k < weights.length; k++) {
            copy[k] = weights[k] == null ? null : weights[k].clone();
        }
        return copy;
    }

    public double[] getBias() {
        return bias == null ? null : bias.clone();
    }

    public double[] getFeatureMean() {
        return featureMean == null ? null : featureMean.clone();
    }

    public double[] getFeatureM2() {
        return featureM2 == null ? null : featureM2.clone();
    }

    public double[] standardize(double[] x) {
        double[] z = new double[featureCount];
        for (int j = 0; j < featureCount; j++) {
            double std = samplesSeen > 1 ? Math.sqrt(featureM2[j] / (samplesSeen - 1)) : 1.0;
            z[j] = (x[j] - featureMean[j]) / Math.max(std, 1.0e-6);
        }
        return z;
    }

    /**
     * Comprueba dimensiones y finitud. Un estado que no pasa esta validación no se usa jamás.
     */
    public void validate(int expectedFeatures, int expectedClasses) throws StateCorruptionException {
        if (featureCount != expectedFeatures || classCount != expectedClasses) {
            throw new StateCorruptionException(String.format(
                    "Shape %dx%d does not match expected %dx%d",
                    classCount, featureCount, expectedClasses, expectedFeatures));
        }
        if (weights == null || bias == null || featureMean == null || featureM2 == null
                || weights.length != classCount || bias.length != classCount
                || featureMean.length != featureCount || featureM2.length != featureCount) {
            throw new StateCorruptionException("Parameter arrays missing or mis-sized");
        }
        for (double[] row : weights) {
            if (row == null || row.length != featureCount) {
                throw new StateCorruptionException("Weight row mis-sized");
            }
            checkFinite(row, "weights");
        }
        checkFinite(bias, "bias");
        checkFinite(featureMean, "featureMean");
        checkFinite(featureM2, "featureM2");
        if (version < 0 || samplesSeen < 0 || stepCount < 0) {
            throw new StateCorruptionException("Negative counters in model state");
        }
    }

    private static void checkFinite(double[] values, String name) throws StateCorruptionException {
        for (double v : values) {
            if (!Double.isFinite(v)) {
                throw new StateCorruptionException("Non-finite value in " + name);
            }
        }
    }
}
