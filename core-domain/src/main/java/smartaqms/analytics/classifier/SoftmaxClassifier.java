package smartaqms.analytics.classifier;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import smartaqms.config.ClassifierConfig;
import smartaqms.domain.exception.ModelFitException;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Regresión logística multinomial entrenada por SGD en mini-lotes.
 * <p>
 * El clasificador no guarda estado: recibe un {@link ModelState} y devuelve otro. La
 * puntuación es una función pura del estado y la entrada; la única aleatoriedad (el barajado
 * del lote durante la actualización) sale de la semilla que se le pasa.
 */
@Slf4j
@RequiredArgsConstructor
public class SoftmaxClassifier {

    private static final double STEP_DECAY = 1.0e-3;

    private final ClassifierConfig config;

    public ClassDistribution predict(ModelState state, double[] features) {
        return ClassDistribution.of(probabilities(state, state.standardize(features)));
    }

    public List<ClassDistribution> predictAll(ModelState state, double[][] features) {
        List<ClassDistribution> out = new ArrayList<>(features.length);
        for (double[] row : features) {
            out.add(predict(state, row));
        }
        return out;
    }

    /**
     * Fracción de aciertos del estado dado sobre muestras etiquetadas.
     */
    public double accuracy(ModelState state, List<LabeledSample> samples) {
        if (samples.isEmpty()) {
            return Double.NaN;
        }
        int hits = 0;
        for (LabeledSample s : samples) {
            if (predict(state, s.features()).predicted() == s.label()) {
                hits++;
            }
        }
        return (double) hits / samples.size();
    }

    /**
     * Semilla de barajado para el siguiente ciclo sobre {@code state}. Reproducible a partir de
     * la semilla configurada y la versión.
     */
    public long shuffleSeedFor(ModelState state) {
        return config.getSeed() * 1_000_003L + state.getVersion();
    }

    /**
     * Paso incremental: ajusta los parámetros existentes solo con este lote.
     *
     * @return estado nuevo con versión + 1; {@code state} no se modifica
     * @throws ModelFitException si el lote está vacío, tiene dimensiones erróneas o el paso
     *                           produce valores no finitos
     */
    public ModelState update(ModelState state, List<LabeledSample> batch, long shuffleSeed) throws ModelFitException {
        if (batch.isEmpty()) {
            throw new ModelFitException("Cannot update on an empty batch");
        }
        int d = state.getFeatureCount();
        int c = state.getClassCount();
        for (LabeledSample s : batch) {
            if (s.features().length != d || s.label() < 0 || s.label() >= c) {
                throw new ModelFitException("Sample does not match model shape " + c + "x" + d);
            }
        }

        // Los accesores de ModelState ya devuelven copias
        double[][] w = state.getWeights();
        double[] b = state.getBias();
        double[] mean = state.getFeatureMean();
        double[] m2 = state.getFeatureM2();
        long seen = state.getSamplesSeen();

        // 1. Estadísticos de estandarización (en el orden del lote, determinista)
        for (LabeledSample s : batch) {
            seen++;
            double[] x = s.features();
            for (int j = 0; j < d; j++) {
                double delta = x[j] - mean[j];
                mean[j] += delta / seen;
                m2[j] += delta * (x[j] - mean[j]);
            }
        }
        ModelState scaling = state.toBuilder().featureMean(mean).featureM2(m2).samplesSeen(seen).build();

        // 2. Barajado con semilla
        int[] order = new int[batch.size()];
        for (int i = 0; i < order.length; i++) order[i] = i;

        long steps = state.getStepCount();
        int miniBatch = Math.max(1, config.getMiniBatchSize());
        Random random = new Random(shuffleSeed);

        for (int epoch = 0; epoch < Math.max(1, config.getEpochs()); epoch++) {
            shuffle(order, random);
            for (int start = 0; start < order.length; start += miniBatch) {
                int end = Math.min(order.length, start + miniBatch);
                double lr = config.getLearningRate() / (1.0 + STEP_DECAY * steps);
                applyStep(w, b, scaling, batch, order, start, end, lr);
                steps++;
            }
        }

        ModelState next = scaling.toBuilder()
                .weights(w)
                .bias(b)
                .stepCount(steps)
                .version(state.getVersion() + 1)
                .build();

        if (!allFinite(w) || !allFinite(b)) {
            throw new ModelFitException("Numerical failure: non-finite parameters after update");
        }
        log.debug("Model updated {} -> {} on {} samples (seed={}, steps={})",
                state.getVersion(), next.getVersion(), batch.size(), shuffleSeed, steps);
        return next;
    }

    // 3. Gradiente de entropía cruzada promediado en el mini-lote, con L2 sobre los pesos
    private void applyStep(double[][] w, double[] b, ModelState scaling, List<LabeledSample> batch,
                           int[] order, int start, int end, double lr) {
        int c = w.length;
        int d = w[0].length;
        double[][] gradW = new double[c][d];
        double[] gradB = new double[c];
        int m = end - start;

        for (int i = start; i < end; i++) {
            LabeledSample sample = batch.get(order[i]);
            double[] z = scaling.standardize(sample.features());
            double[] p = softmax(logits(w, b, z));
            for (int k = 0; k < c; k++) {
                double g = p[k] - (k == sample.label() ? 1.0 : 0.0);
                gradB[k] += g;
                for (int j = 0; j < d; j++) {
                    gradW[k][j] += g * z[j];
                }
            }
        }

        for (int k = 0; k < c; k++) {
            b[k] -= lr * gradB[k] / m;
            for (int j = 0; j < d; j++) {
                w[k][j] -= lr * (gradW[k][j] / m + config.getL2() * w[k][j]);
            }
        }
    }

    private static double[] probabilities(ModelState state, double[] z) {
        return softmax(logits(state.getWeights(), state.getBias(), z));
    }

    private static double[] logits(double[][] w, double[] b, double[] z) {
        double[] out = new double[w.length];
        for (int k = 0; k < w.length; k++) {
            double acc = b[k];
            for (int j = 0; j < z.length; j++) {
                acc += w[k][j] * z[j];
            }
            out[k] = acc;
        }
        return out;
    }

    static double[] softmax(double[] logits) {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : logits) max = Math.max(max, v);
        double sum = 0.0;
        double[] out = new double[logits.length];
        for (int k = 0; k < logits.length; k++) {
            out[k] = Math.exp(logits[k] - max);
            sum += out[k];
        }
        for (int k = 0; k < out.length; k++) {
            out[k] /= sum;
        }
        return out;
    }

    private static void shuffle(int[] order, Random random) {
        for (int i = order.length - 1; i > 0; i--) {
            int j = random.nextInt(i + 1);
            int tmp = order[i];
            order[i] = order[j];
            order[j] = tmp;
        }
    }

    private static boolean allFinite(double[][] values) {
        for (double[] row : values) {
            if (!allFinite(row)) return false;
        }
        return true;
    }

    private static boolean allFinite(double[] values) {
        for (double v : values) {
            if (!Double.isFinite(v)) return false;
        }
        return true;
    }
}
