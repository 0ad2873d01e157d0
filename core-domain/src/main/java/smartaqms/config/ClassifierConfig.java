package smartaqms.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Parámetros de la actualización incremental del clasificador softmax.
 */
@Value
@Builder
@With
public class ClassifierConfig {

    @Builder.Default
    double learningRate = 0.05;

    /**
     * Penalización L2 sobre los pesos (no sobre el sesgo).
     */
    @Builder.Default
    double l2 = 1.0e-4;

    @Builder.Default
    int miniBatchSize = 32;

    /**
     * Pasadas sobre el lote por ciclo. Una pasada mantiene el coste acotado por el tamaño del lote.
     */
    @Builder.Default
    int epochs = 1;

    /**
     * Semilla base del barajado; cada ciclo la combina con la versión del modelo.
     */
    @Builder.Default
    long seed = 42L;

    public static ClassifierConfig defaults() {
        return ClassifierConfig.builder().build();
    }
}
