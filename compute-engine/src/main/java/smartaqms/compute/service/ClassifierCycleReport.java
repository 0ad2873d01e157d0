package smartaqms.compute.service;

/**
 * Resumen de un ciclo del clasificador.
 *
 * @param accuracy    aciertos del modelo previo sobre el lote (prequential), NaN si no hubo entrenamiento
 * @param shuffleSeed semilla usada en la actualización, o null si no hubo actualización
 * @param committed   false si el almacén rechazó el commit y el estado en memoria no cambió
 */
public record ClassifierCycleReport(
        int readings,
        int predictionsWritten,
        long previousVersion,
        long modelVersion,
        double accuracy,
        Long shuffleSeed,
        boolean committed
) {
    public static ClassifierCycleReport idle(long version) {
        return new ClassifierCycleReport(0, 0, version, version, Double.NaN, null, true);
    }

    public boolean updated() {
        return modelVersion != previousVersion;
    }
}
