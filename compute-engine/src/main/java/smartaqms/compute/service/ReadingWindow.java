package smartaqms.compute.service;

import smartaqms.compute.entity.ReadingEntity;
import smartaqms.domain.window.WindowConsumer;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Vista derivada (no persistida) de las lecturas nuevas de una estación para un consumidor.
 *
 * @param afterTs  cursor de lectura: la ventana contiene lo estrictamente posterior a (afterTs, afterId)
 * @param readings ordenadas por (ts, id); nunca null, puede estar vacía
 */
public record ReadingWindow(
        WindowConsumer consumer,
        String stationId,
        String zone,
        LocalDateTime windowStart,
        LocalDateTime afterTs,
        long afterId,
        List<ReadingEntity> readings
) {
    public boolean isEmpty() {
        return readings.isEmpty();
    }

    public int size() {
        return readings.size();
    }

    /**
     * Última lectura de la ventana: la nueva marca de agua si el consumidor la confirma.
     */
    public ReadingEntity last() {
        return readings.isEmpty() ? null : readings.get(readings.size() - 1);
    }
}
