package smartaqms.analytics.classifier;

import smartaqms.analytics.ReadingSample;
import smartaqms.domain.reading.Quantity;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Construye los vectores de entrada del clasificador: las magnitudes core más dos derivadas,
 * la tasa de cambio de PM2.5 por minuto respecto a la lectura anterior de la misma estación
 * y la desviación de PM2.5 respecto a la media de su zona dentro del lote.
 */
public final class ClassifierFeatures {

    public static final int RATE_OF_CHANGE = Quantity.core().size();
    public static final int ZONE_DEVIATION = RATE_OF_CHANGE + 1;
    public static final int FEATURE_COUNT = ZONE_DEVIATION + 1;

    private ClassifierFeatures() {
    }

    /**
     * @param batch            lecturas del lote en orden temporal
     * @param previousByStation última lectura ya procesada de cada estación, para la primera
     *                          tasa de cambio del lote (puede no contener la estación)
     */
    public static double[][] assemble(List<ReadingSample> batch, Map<String, ReadingSample> previousByStation) {
        Map<String, double[]> zoneSums = new HashMap<>();
        for (ReadingSample sample : batch) {
            double[] acc = zoneSums.computeIfAbsent(sample.zone(), z -> new double[2]);
            acc[0] += sample.pm25();
            acc[1] += 1.0;
        }

        Map<String, ReadingSample> last = new HashMap<>(previousByStation);
        double[][] features = new double[batch.size()][];
        for (int i = 0; i < batch.size(); i++) {
            ReadingSample sample = batch.get(i);
            double[] row = new double[FEATURE_COUNT];
            System.arraycopy(sample.core(), 0, row, 0, RATE_OF_CHANGE);

            row[RATE_OF_CHANGE] = ratePerMinute(last.get(sample.stationId()), sample);

            double[] acc = zoneSums.get(sample.zone());
            row[ZONE_DEVIATION] = sample.pm25() - acc[0] / acc[1];

            features[i] = row;
            last.put(sample.stationId(), sample);
        }
        return features;
    }

    private static double ratePerMinute(ReadingSample previous, ReadingSample current) {
        if (previous == null || !current.timestamp().isAfter(previous.timestamp())) {
            return 0.0;
        }
        double minutes = Math.max(Duration.between(previous.timestamp(), current.timestamp()).getSeconds() / 60.0, 1.0);
        return (current.pm25() - previous.pm25()) / minutes;
    }
}
