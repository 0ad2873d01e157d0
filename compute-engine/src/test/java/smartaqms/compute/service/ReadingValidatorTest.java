package smartaqms.compute.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.compute.entity.StationEntity;
import smartaqms.domain.dto.reading.ReadingSubmissionDTO;
import smartaqms.domain.exception.ReadingValidationException;
import smartaqms.domain.reading.Quantity;
import smartaqms.domain.station.StationStatus;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReadingValidatorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private ReadingValidator validator;
    private StationEntity station;

    @BeforeEach
    void setUp() {
        validator = new ReadingValidator(new AqmsProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        station = StationEntity.builder().id("ST001").zone("Downtown").status(StationStatus.ACTIVE).build();
    }

    private static Map<Quantity, Double> coreValues() {
        Map<Quantity, Double> values = new EnumMap<>(Quantity.class);
        values.put(Quantity.PM25, 12.0);
        values.put(Quantity.CO2, 420.0);
        values.put(Quantity.TEMPERATURE, 18.0);
        values.put(Quantity.HUMIDITY, 60.0);
        values.put(Quantity.WIND_SPEED, 2.0);
        return values;
    }

    private static ReadingSubmissionDTO submission(Map<Quantity, Double> values) {
        return ReadingSubmissionDTO.builder()
                .stationId("ST001")
                .sensorId("ST001-S1")
                .timestamp(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC).minusMinutes(1))
                .values(values)
                .build();
    }

    private static String rejectedField(Runnable call) {
        return assertThrows(ReadingValidationException.class, call::run).getField();
    }

    @Test
    @DisplayName("Humedad 150%: rechazada indicando el campo infractor")
    void humidityOutOfRange_isRejectedWithField() {
        Map<Quantity, Double> values = coreValues();
        values.put(Quantity.HUMIDITY, 150.0);

        assertEquals("HUMIDITY", rejectedField(() -> validator.validate(submission(values), station)));
    }

    @Test
    @DisplayName("Magnitud core ausente o estación desconocida/retirada: rechazo")
    void missingCoreOrUnknownStation_isRejected() {
        Map<Quantity, Double> values = coreValues();
        values.remove(Quantity.CO2);
        assertEquals("CO2", rejectedField(() -> validator.validate(submission(values), station)));

        assertEquals("stationId", rejectedField(() -> validator.validate(submission(coreValues()), null)));

        StationEntity retired = StationEntity.builder().id("ST001").zone("Downtown").status(StationStatus.RETIRED).build();
        assertEquals("stationId", rejectedField(() -> validator.validate(submission(coreValues()), retired)));
    }

    @Test
    @DisplayName("Plausibilidad temporal: ni más allá del desfase futuro ni más antigua que el retraso máximo")
    void implausibleTimestamps_areRejected() {
        LocalDateTime now = LocalDateTime.ofInstant(NOW, ZoneOffset.UTC);

        ReadingSubmissionDTO future = submission(coreValues()).withTimestamp(now.plusMinutes(10));
        ReadingSubmissionDTO ancient = submission(coreValues()).withTimestamp(now.minusDays(8));
        ReadingSubmissionDTO slightlyAhead = submission(coreValues()).withTimestamp(now.plusMinutes(2));

        assertEquals("timestamp", rejectedField(() -> validator.validate(future, station)));
        assertEquals("timestamp", rejectedField(() -> validator.validate(ancient, station)));
        assertDoesNotThrow(() -> validator.validate(slightlyAhead, station));
    }

    @Test
    @DisplayName("Estación en mantenimiento sigue aceptando lecturas")
    void maintenanceStation_isAccepted() {
        station.setStatus(StationStatus.MAINTENANCE);
        assertDoesNotThrow(() -> validator.validate(submission(coreValues()), station));
    }

    @Test
    @DisplayName("Calidad: confianza x completitud de magnitudes opcionales")
    void qualityScore_combinesConfidenceAndCompleteness() {
        assertEquals(0.8, validator.qualityScore(submission(coreValues())), 1e-9);

        Map<Quantity, Double> full = coreValues();
        Quantity.optional().forEach(q -> full.put(q, q.getMinValid()));
        assertEquals(1.0, validator.qualityScore(submission(full)), 1e-9);

        ReadingSubmissionDTO halfConfident = submission(full).withConfidence(0.5);
        assertEquals(0.5, validator.qualityScore(halfConfident), 1e-9);
    }
}
