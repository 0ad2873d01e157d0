package smartaqms.compute.repository;

import java.time.LocalDateTime;

/**
 * Proyección de la clave natural de una lectura, para deduplicar sin cargar la fila completa.
 */
public interface ReadingKeyView {

    String getStationId();

    String getSensorId();

    LocalDateTime getTimestamp();
}
