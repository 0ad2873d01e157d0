package smartaqms.compute.service;

import lombok.Builder;
import smartaqms.domain.alert.AlertSeverity;
import smartaqms.domain.alert.DetectionMethod;

/**
 * Alerta propuesta por el detector, pendiente de la comprobación de cooldown.
 */
@Builder
public record AlertCandidate(
        long readingId,
        String stationId,
        String zone,
        String alertType,
        AlertSeverity severity,
        DetectionMethod method,
        double score,
        String message
) {}
