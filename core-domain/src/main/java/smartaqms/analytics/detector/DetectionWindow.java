package smartaqms.analytics.detector;

/**
 * Entrada de un ciclo de detección: vectores de características de la ventana (una fila por
 * lectura, en orden temporal), la línea base de la zona calculada sobre el histórico previo y
 * la resolución de cada característica (puede ser null: sin suelo de ruido).
 */
public record DetectionWindow(double[][] features, FeatureBaseline baseline, double[] resolution) {

    public DetectionWindow(double[][] features, FeatureBaseline baseline) {
        this(features, baseline, null);
    }

    public int size() {
        return features.length;
    }

    public boolean isEmpty() {
        return features.length == 0;
    }

    public double resolution(int feature) {
        return resolution == null ? 0.0 : resolution[feature];
    }
}
