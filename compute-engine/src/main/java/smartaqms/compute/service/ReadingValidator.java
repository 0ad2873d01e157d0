package smartaqms.compute.service;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.compute.entity.StationEntity;
import smartaqms.domain.dto.reading.ReadingSubmissionDTO;
import smartaqms.domain.exception.ReadingValidationException;
import smartaqms.domain.reading.Quantity;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * Validación por lectura: identidad, plausibilidad temporal y rangos físicos.
 * También calcula la puntuación de calidad de los datos de las lecturas válidas.
 */
@Component
@RequiredArgsConstructor
public class ReadingValidator {

    private static final double BASE_QUALITY = 0.8;
    private static final double COMPLETENESS_WEIGHT = 0.2;

    private final AqmsProperties properties;
    private final Clock clock;

    /**
     * @param station estación resuelta para {@code stationId}, o null si no existe
     * @throws ReadingValidationException con el campo infractor
     */
    public void validate(ReadingSubmissionDTO reading, StationEntity station) {
        if (reading == null) {
            throw new ReadingValidationException("reading", "Reading is null");
        }
        if (isBlank(reading.stationId())) {
            throw new ReadingValidationException("stationId", "Station id is required");
        }
        if (isBlank(reading.sensorId())) {
            throw new ReadingValidationException("sensorId", "Sensor id is required");
        }
        if (station == null) {
            throw new ReadingValidationException("stationId", "Unknown station " + reading.stationId());
        }
        if (!station.getStatus().acceptsReadings()) {
            throw new ReadingValidationException("stationId",
                    "Station " + station.getId() + " is " + station.getStatus());
        }

        validateTimestamp(reading.timestamp());

        Map<Quantity, Double> values = reading.values();
        if (values == null) {
            throw new ReadingValidationException("values", "Measured values are required");
        }
        for (Quantity q : Quantity.core()) {
            if (values.get(q) == null) {
                throw new ReadingValidationException(q.getCode(), "Required quantity " + q.getCode() + " is missing");
            }
        }
        for (Map.Entry<Quantity, Double> entry : values.entrySet()) {
            Quantity q = entry.getKey();
            if (q == null) {
                throw new ReadingValidationException("values", "Unknown quantity");
            }
            Double value = entry.getValue();
            if (value != null && !q.isWithinRange(value)) {
                throw new ReadingValidationException(q.getCode(), String.format(
                        "%s = %s outside valid range [%s, %s] %s",
                        q.getCode(), value, q.getMinValid(), q.getMaxValid(), q.getUnit()));
            }
        }

        Double confidence = reading.confidence();
        if (confidence != null && (!Double.isFinite(confidence) || confidence < 0.0 || confidence > 1.0)) {
            throw new ReadingValidationException("confidence", "Sensor confidence must be in [0,1]: " + confidence);
        }
    }

    /**
     * confidence × (0.8 + 0.2 × opcionalesPresentes / opcionalesTotales), acotada a [0,1].
     * Sin confianza reportada se asume 1.0.
     */
    public double qualityScore(ReadingSubmissionDTO reading) {
        int optionalTotal = Quantity.optional().size();
        int optionalPresent = 0;
        for (Quantity q : Quantity.optional()) {
            if (reading.values().get(q) != null) {
                optionalPresent++;
            }
        }
        double confidence = reading.confidence() == null ? 1.0 : reading.confidence();
        double score = confidence * (BASE_QUALITY + COMPLETENESS_WEIGHT * optionalPresent / optionalTotal);
        return Math.max(0.0, Math.min(1.0, score));
    }

    private void validateTimestamp(LocalDateTime ts) {
        if (ts == null) {
            throw new ReadingValidationException("timestamp", "Timestamp is required");
        }
        LocalDateTime now = LocalDateTime.now(clock);
        AqmsProperties.Ingest ingest = properties.getIngest();
        if (ts.isAfter(now.plus(ingest.getMaxFutureSkew()))) {
            throw new ReadingValidationException("timestamp", "Timestamp " + ts + " is in the future");
        }
        if (ts.isBefore(now.minus(ingest.getMaxLateness()))) {
            throw new ReadingValidationException("timestamp", "Timestamp " + ts + " is older than "
                    + ingest.getMaxLateness());
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
