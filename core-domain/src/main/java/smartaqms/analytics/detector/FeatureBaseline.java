package smartaqms.analytics.detector;

/**
 * Media y desviación típica por característica de una zona (línea base móvil).
 */
public record FeatureBaseline(double[] mean, double[] std, long sampleCount) {

    /**
     * Calcula la línea base con el algoritmo de Welford (una pasada, estable).
     */
    public static FeatureBaseline of(double[][] rows) {
        if (rows.length == 0) {
            return new FeatureBaseline(new double[0], new double[0], 0);
        }
        int d = rows[0].length;
        double[] mean = new double[d];
        double[] m2 = new double[d];
        long n = 0;
        for (double[] row : rows) {
            n++;
            for (int j = 0; j < d; j++) {
                double delta = row[j] - mean[j];
                mean[j] += delta / n;
                m2[j] += delta * (row[j] - mean[j]);
            }
        }
        double[] std = new double[d];
        for (int j = 0; j < d; j++) {
            std[j] = n > 1 ? Math.sqrt(m2[j] / (n - 1)) : 0.0;
        }
        return new FeatureBaseline(mean, std, n);
    }

    public int dimension() {
        return mean.length;
    }

    /**
     * z-score con la desviación acotada por abajo por {@code floor}. Una característica sin
     * dispersión ni suelo no aporta evidencia: devuelve 0.
     */
    public double zScore(int feature, double value, double floor) {
        double sigma = Math.max(std[feature], floor);
        if (sigma <= 0.0) {
            return 0.0;
        }
        return (value - mean[feature]) / sigma;
    }
}
