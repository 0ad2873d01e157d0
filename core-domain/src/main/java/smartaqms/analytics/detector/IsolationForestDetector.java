package smartaqms.analytics.detector;

import lombok.RequiredArgsConstructor;
import smartaqms.config.DetectorConfig;
import smartaqms.domain.alert.DetectionMethod;
import smartaqms.domain.exception.ModelFitException;

import java.util.Arrays;
import java.util.Random;

/**
 * Método de densidad: bosque de aislamiento ajustado sobre la propia ventana.
 * <p>
 * Las lecturas que se aíslan con caminos cortos son poco densas. El umbral se calibra con la
 * fracción de contaminación: se marca la fracción {@code contamination} de puntuaciones más
 * altas. La aleatoriedad (submuestreo, cortes) sale de una semilla fija.
 */
@RequiredArgsConstructor
public class IsolationForestDetector implements AnomalyDetector {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final DetectorConfig config;

    @Override
    public DetectionMethod method() {
        return DetectionMethod.DENSITY;
    }

    @Override
    public DetectorResult score(DetectionWindow window) throws ModelFitException {
        double[][] rows = window.features();
        if (rows.length < config.getMinSamples()) {
            throw new ModelFitException(String.format(
                    "Density method needs %d samples, window has %d", config.getMinSamples(), rows.length));
        }
        double contamination = config.getContamination();
        if (contamination <= 0.0 || contamination >= 0.5) {
            throw new ModelFitException("Contamination must be in (0, 0.5): " + contamination);
        }
        for (double[] row : rows) {
            for (double v : row) {
                if (!Double.isFinite(v)) {
                    throw new ModelFitException("Non-finite feature value in window");
                }
            }
        }

        double[] minRange = new double[rows[0].length];
        for (int j = 0; j < minRange.length; j++) {
            minRange[j] = window.resolution(j);
        }

        Random random = new Random(config.getSeed());
        int sampleSize = Math.min(config.getSubsampleSize(), rows.length);
        int heightLimit = (int) Math.ceil(log2(sampleSize));

        Node[] forest = new Node[config.getTreeCount()];
        for (int t = 0; t < forest.length; t++) {
            int[] sample = subsample(rows.length, sampleSize, random);
            forest[t] = build(rows, sample, 0, sample.length, 0, heightLimit, minRange, random);
        }

        double normalizer = averagePathLength(sampleSize);
        double[] raw = new double[rows.length];
        for (int i = 0; i < rows.length; i++) {
            double total = 0.0;
            for (Node tree : forest) {
                total += pathLength(rows[i], tree, 0);
            }
            double meanPath = total / forest.length;
            raw[i] = Math.pow(2.0, -meanPath / normalizer);
        }

        double threshold = percentile(raw, 1.0 - contamination);
        if (!(threshold > 0.0)) {
            throw new ModelFitException("Degenerate isolation threshold: " + threshold);
        }

        double[] normalized = new double[raw.length];
        int[] dominant = new int[raw.length];
        for (int i = 0; i < raw.length; i++) {
            normalized[i] = raw[i] / threshold;
            dominant[i] = -1;
        }
        return new DetectorResult(method(), normalized, dominant);
    }

    // --- construcción de árboles ---

    private static int[] subsample(int population, int size, Random random) {
        int[] all = new int[population];
        for (int i = 0; i < population; i++) all[i] = i;
        // Fisher-Yates parcial
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(population - i);
            int tmp = all[i];
            all[i] = all[j];
            all[j] = tmp;
        }
        return Arrays.copyOf(all, size);
    }

    /**
     * Solo se corta por características cuyo rango en el nodo supera su resolución.
     */
    private static Node build(double[][] rows, int[] idx, int from, int to, int depth, int heightLimit,
                              double[] minRange, Random random) {
        int size = to - from;
        if (depth >= heightLimit || size <= 1) {
            return Node.leaf(size);
        }

        int dimension = rows[idx[from]].length;
        double[] min = new double[dimension];
        double[] max = new double[dimension];
        Arrays.fill(min, Double.POSITIVE_INFINITY);
        Arrays.fill(max, Double.NEGATIVE_INFINITY);
        for (int k = from; k < to; k++) {
            double[] row = rows[idx[k]];
            for (int j = 0; j < dimension; j++) {
                if (row[j] < min[j]) min[j] = row[j];
                if (row[j] > max[j]) max[j] = row[j];
            }
        }

        int splittable = 0;
        for (int j = 0; j < dimension; j++) {
            if (max[j] - min[j] > minRange[j]) splittable++;
        }
        if (splittable == 0) {
            return Node.leaf(size);
        }

        int pick = random.nextInt(splittable);
        int feature = -1;
        for (int j = 0; j < dimension; j++) {
            if (max[j] - min[j] > minRange[j] && pick-- == 0) {
                feature = j;
                break;
            }
        }
        double split = min[feature] + random.nextDouble() * (max[feature] - min[feature]);

        int mid = from;
        for (int k = from; k < to; k++) {
            if (rows[idx[k]][feature] < split) {
                int tmp = idx[mid];
                idx[mid] = idx[k];
                idx[k] = tmp;
                mid++;
            }
        }

        Node left = build(rows, idx, from, mid, depth + 1, heightLimit, minRange, random);
        Node right = build(rows, idx, mid, to, depth + 1, heightLimit, minRange, random);
        return new Node(feature, split, left, right, size);
    }

    private static double pathLength(double[] x, Node node, int depth) {
        if (node.isLeaf()) {
            return depth + averagePathLength(node.size);
        }
        Node next = x[node.feature] < node.split ? node.left : node.right;
        return pathLength(x, next, depth + 1);
    }

    /**
     * Longitud media de una búsqueda fallida en un BST de n nodos, c(n).
     */
    static double averagePathLength(int n) {
        if (n > 2) {
            return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
        }
        return n == 2 ? 1.0 : 0.0;
    }

    static double percentile(double[] values, double q) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        double pos = q * (sorted.length - 1);
        int lower = (int) Math.floor(pos);
        int upper = (int) Math.ceil(pos);
        double fraction = pos - lower;
        return sorted[lower] + (sorted[upper] - sorted[lower]) * fraction;
    }

    private static double log2(double x) {
        return Math.log(x) / Math.log(2.0);
    }

    private static final class Node {
        final int feature;
        final double split;
        final Node left;
        final Node right;
        final int size;

        Node(int feature, double split, Node left, Node right, int size) {
            this.feature = feature;
            this.split = split;
            this.left = left;
            this.right = right;
            this.size = size;
        }

        static Node leaf(int size) {
            return new Node(-1, Double.NaN, null, null, size);
        }

        boolean isLeaf() {
            return left == null;
        }
    }
}
