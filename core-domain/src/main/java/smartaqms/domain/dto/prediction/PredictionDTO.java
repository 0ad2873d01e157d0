package smartaqms.domain.dto.prediction;

import lombok.Builder;
import smartaqms.domain.prediction.AqiCategory;

import java.time.LocalDateTime;
import java.util.Map;

@Builder
public record PredictionDTO(
        Long id,
        Long readingId,
        String stationId,
        AqiCategory category,
        double confidence,
        Map<AqiCategory, Double> probabilities,
        long modelVersion,
        LocalDateTime createdAt) {
}
