package smartaqms.compute.api;

import smartaqms.compute.entity.AlertEntity;
import smartaqms.compute.entity.PredictionEntity;
import smartaqms.compute.entity.ReadingEntity;
import smartaqms.compute.entity.StationEntity;
import smartaqms.compute.entity.SystemMetricEntity;
import smartaqms.domain.dto.PaginatedResponse;
import smartaqms.domain.dto.alert.AlertDTO;
import smartaqms.domain.dto.metric.SystemMetricDTO;
import smartaqms.domain.dto.prediction.PredictionDTO;
import smartaqms.domain.dto.reading.ReadingDTO;
import smartaqms.domain.dto.station.StationDTO;
import smartaqms.domain.prediction.AqiCategory;
import smartaqms.domain.reading.Quantity;

import org.springframework.data.domain.Page;

import java.util.EnumMap;
import java.util.Map;

/**
 * Conversión entidad -> DTO de la API pública.
 */
final class ApiMapper {

    private ApiMapper() {
    }

    static StationDTO toDto(StationEntity s) {
        return StationDTO.builder()
                .id(s.getId())
                .name(s.getName())
                .zone(s.getZone())
                .status(s.getStatus())
                .latitude(s.getLatitude())
                .longitude(s.getLongitude())
                .createdAt(s.getCreatedAt())
                .lastSeenAt(s.getLastSeenAt())
                .build();
    }

    static ReadingDTO toDto(ReadingEntity r) {
        Map<Quantity, Double> values = new EnumMap<>(Quantity.class);
        for (Quantity q : Quantity.values()) {
            Double v = r.valueOf(q);
            if (v != null) {
                values.put(q, v);
            }
        }
        return ReadingDTO.builder()
                .id(r.getId())
                .stationId(r.getStationId())
                .sensorId(r.getSensorId())
                .timestamp(r.getTimestamp())
                .values(values)
                .qualityScore(r.getQualityScore())
                .status(r.getStatus())
                .build();
    }

    static AlertDTO toDto(AlertEntity a) {
        return AlertDTO.builder()
                .id(a.getId())
                .readingId(a.getReadingId())
                .stationId(a.getStationId())
                .zone(a.getZone())
                .alertType(a.getAlertType())
                .severity(a.getSeverity())
                .status(a.getStatus())
                .detectionMethod(a.getDetectionMethod())
                .anomalyScore(a.getAnomalyScore())
                .message(a.getMessage())
                .createdAt(a.getCreatedAt())
                .acknowledgedAt(a.getAcknowledgedAt())
                .resolvedAt(a.getResolvedAt())
                .build();
    }

    static PredictionDTO toDto(PredictionEntity p) {
        Map<AqiCategory, Double> probabilities = new EnumMap<>(AqiCategory.class);
        double[] values = p.probabilities();
        for (int k = 0; k < values.length; k++) {
            probabilities.put(AqiCategory.ofIndex(k), values[k]);
        }
        return PredictionDTO.builder()
                .id(p.getId())
                .readingId(p.getReadingId())
                .stationId(p.getStationId())
                .category(p.getCategory())
                .confidence(p.getConfidence())
                .probabilities(probabilities)
                .modelVersion(p.getModelVersion())
                .createdAt(p.getCreatedAt())
                .build();
    }

    static SystemMetricDTO toDto(SystemMetricEntity m) {
        return new SystemMetricDTO(m.getMetricName(), m.getMetricValue(), m.getMetricUnit(), m.getStationId(),
                m.getRecordedAt());
    }

    static <T> PaginatedResponse<T> toPage(Page<T> page) {
        return new PaginatedResponse<>(
                page.getContent(),
                page.getNumber(),
                page.getSize(),
                page.getTotalElements(),
                page.getTotalPages(),
                page.isLast(),
                page.isFirst(),
                page.isEmpty());
    }
}
