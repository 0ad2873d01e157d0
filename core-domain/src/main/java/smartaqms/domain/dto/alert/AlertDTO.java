package smartaqms.domain.dto.alert;

import lombok.Builder;
import smartaqms.domain.alert.AlertSeverity;
import smartaqms.domain.alert.AlertStatus;
import smartaqms.domain.alert.DetectionMethod;

import java.time.LocalDateTime;

@Builder
public record AlertDTO(
        String id,
        Long readingId,
        String stationId,
        String zone,
        String alertType,
        AlertSeverity severity,
        AlertStatus status,
        DetectionMethod detectionMethod,
        double anomalyScore,
        String message,
        LocalDateTime createdAt,
        LocalDateTime acknowledgedAt,
        LocalDateTime resolvedAt) {
}
