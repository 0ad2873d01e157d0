package smartaqms.domain.dto.reading;

import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Builder;
import lombok.With;
import smartaqms.domain.reading.Quantity;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * Lectura candidata tal y como llega de un alimentador.
 * <p>
 * La clave natural (stationId, sensorId, timestamp) hace idempotentes los reenvíos.
 * {@code confidence} es la confianza reportada por el sensor, si la hay.
 */
@Builder
@With
public record ReadingSubmissionDTO(
        String stationId,
        String sensorId,
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss[.SSS]")
        LocalDateTime timestamp,
        Map<Quantity, Double> values,
        Double confidence
) {}
