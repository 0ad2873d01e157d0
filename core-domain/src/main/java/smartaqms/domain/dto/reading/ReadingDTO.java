package smartaqms.domain.dto.reading;

import lombok.Builder;
import smartaqms.domain.reading.Quantity;
import smartaqms.domain.reading.ReadingStatus;

import java.time.LocalDateTime;
import java.util.Map;

@Builder
public record ReadingDTO(
        Long id,
        String stationId,
        String sensorId,
        LocalDateTime timestamp,
        Map<Quantity, Double> values,
        double qualityScore,
        ReadingStatus status
) {}
