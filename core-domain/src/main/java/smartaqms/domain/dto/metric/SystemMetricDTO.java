package smartaqms.domain.dto.metric;

import java.time.LocalDateTime;

public record SystemMetricDTO(
        String name,
        double value,
        String unit,
        String stationId,
        LocalDateTime recordedAt) {
}
