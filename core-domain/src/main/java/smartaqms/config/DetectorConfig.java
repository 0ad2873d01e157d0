package smartaqms.config;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Parámetros del ensemble de detección de anomalías.
 */
@Value
@Builder
@With
public class DetectorConfig {

    /**
     * Umbral |z| a partir del cual el método estadístico marca una lectura.
     */
    @Builder.Default
    double zThreshold = 3.0;

    /**
     * Proporción esperada de anomalías en la ventana (método de densidad).
     */
    @Builder.Default
    double contamination = 0.05;

    /**
     * Tamaño mínimo de ventana para ajustar el método de densidad.
     */
    @Builder.Default
    int minSamples = 20;

    @Builder.Default
    int treeCount = 100;

    @Builder.Default
    int subsampleSize = 256;

    /**
     * Semilla del bosque de aislamiento. Misma semilla y misma ventana, mismas puntuaciones.
     */
    @Builder.Default
    long seed = 42L;

    public static DetectorConfig defaults() {
        return DetectorConfig.builder().build();
    }
}
