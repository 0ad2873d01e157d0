package smartaqms.compute.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import smartaqms.analytics.classifier.ModelState;
import smartaqms.analytics.classifier.SoftmaxClassifier;
import smartaqms.compute.AbstractStoreIntegrationTest;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.compute.entity.ReadingEntity;
import smartaqms.compute.entity.WatermarkEntity;
import smartaqms.domain.dto.reading.IngestResultDTO;
import smartaqms.domain.dto.reading.ReadingSubmissionDTO;
import smartaqms.domain.reading.Quantity;
import smartaqms.domain.window.WindowConsumer;
import smartaqms.domain.exception.StateCorruptionException;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Cada test construye su propio servicio (equivalente a un arranque del proceso) para que el
 * estado en memoria no pase de un test a otro.
 */
class OnlineClassifierIntegrationTest extends AbstractStoreIntegrationTest {

    private static final double[] PM25_MIX = {6.0, 18.0, 42.0, 80.0, 9.0, 30.0};

    @Autowired
    private WindowReader windowReader;
    @Autowired
    private ModelStateStore stateStore;
    @Autowired
    private SoftmaxClassifier classifier;
    @Autowired
    private StoreRetryTemplate storeRetry;
    @Autowired
    private MetricsRecorder metrics;
    @Autowired
    private AqmsProperties properties;
    @Autowired
    private JdbcTemplate jdbcTemplate;
    @Autowired
    private ReadingIngestor ingestor;

    private int minuteOffset;

    @BeforeEach
    void setUp() {
        station("ST001", "Downtown");
        station("ST002", "Uptown");
        minuteOffset = 100;
    }

    private OnlineClassifierService startService() {
        return new OnlineClassifierService(stationRepository, readingRepository, predictionRepository, windowReader,
                stateStore, classifier, storeRetry, metrics, properties, clock);
    }

    /**
     * Lecturas nuevas en ambas estaciones, siempre posteriores a las anteriores.
     */
    private List<ReadingEntity> newReadings(int perStation, double quality) {
        List<ReadingEntity> out = new ArrayList<>();
        for (int i = 0; i < perStation; i++) {
            minuteOffset--;
            out.add(reading("ST001", now().minusMinutes(minuteOffset), PM25_MIX[i % PM25_MIX.length], quality));
            out.add(reading("ST002", now().minusMinutes(minuteOffset), PM25_MIX[(i + 3) % PM25_MIX.length], quality));
        }
        return out;
    }

    private static ReadingSubmissionDTO submission(LocalDateTime ts) {
        Map<Quantity, Double> values = new EnumMap<>(Quantity.class);
        values.put(Quantity.PM25, 20.0);
        values.put(Quantity.CO2, 450.0);
        values.put(Quantity.TEMPERATURE, 19.0);
        values.put(Quantity.HUMIDITY, 60.0);
        values.put(Quantity.WIND_SPEED, 2.0);
        return ReadingSubmissionDTO.builder()
                .stationId("ST001")
                .sensorId("ST001-MULTI")
                .timestamp(ts)
                .values(values)
                .build();
    }

    @Test
    @DisplayName("Sin lecturas nuevas: el modelo mantiene su versión y no se escriben predicciones")
    void noNewData_keepsVersion() {
        OnlineClassifierService service = startService();

        ClassifierCycleReport report = service.runCycle();

        assertEquals(0, report.modelVersion());
        assertEquals(0, report.predictionsWritten());
        assertEquals(0, predictionRepository.count());
        assertEquals(0, checkpointRepository.count());
    }

    @Test
    @DisplayName("Un ciclo: una predicción por lectura, versión + 1 y checkpoint; el siguiente ciclo sin datos no cambia nada")
    void cycle_writesOnePredictionPerReading() {
        List<ReadingEntity> readings = newReadings(15, 0.9);
        OnlineClassifierService service = startService();

        ClassifierCycleReport report = service.runCycle();

        assertTrue(report.committed());
        assertEquals(30, report.readings());
        assertEquals(30, report.predictionsWritten());
        assertEquals(0, report.previousVersion());
        assertEquals(1, report.modelVersion());
        assertNotNull(report.shuffleSeed());
        for (ReadingEntity r : readings) {
            assertEquals(1, predictionRepository.countByReadingId(r.getId()));
        }
        assertThat(predictionRepository.findAll()).allMatch(p -> p.getModelVersion() == 1L);
        assertEquals(1, checkpointRepository.count());

        ClassifierCycleReport idle = service.runCycle();
        assertEquals(1, idle.modelVersion());
        assertEquals(0, idle.predictionsWritten());
        assertEquals(30, predictionRepository.count());
    }

    @Test
    @DisplayName("Reinicio: el nuevo proceso reanuda desde el último checkpoint, con los mismos pesos")
    void restart_resumesFromCheckpoint() {
        newReadings(10, 0.9);
        OnlineClassifierService first = startService();
        first.runCycle();
        ModelState before = first.currentState();

        ModelState resumed = startService().currentState();

        assertEquals(before.getVersion(), resumed.getVersion());
        assertEquals(before.getSamplesSeen(), resumed.getSamplesSeen());
        assertArrayEquals(before.getWeights()[2], resumed.getWeights()[2]);
    }

    @Test
    @DisplayName("Checkpoint corrupto: se registra, se arranca desde un estado seguro y nunca se usan los pesos corruptos")
    void corruptedCheckpoint_fallsBackToSafeDefault() {
        newReadings(10, 0.9);
        startService().runCycle();
        jdbcTemplate.update("UPDATE model_checkpoints SET payload = ? WHERE version = ?", "{\"version\": 1, \"weights\":", 1L);
        double degradedBefore = metrics.degradedCycleCount();

        OnlineClassifierService restarted = startService();
        ModelState safe = restarted.currentState();

        assertEquals(1, safe.getVersion());
        assertEquals(0, safe.getSamplesSeen());
        assertThat(metrics.degradedCycleCount()).isGreaterThan(degradedBefore);

        newReadings(5, 0.9);
        ClassifierCycleReport report = restarted.runCycle();
        assertEquals(2, report.modelVersion());
        assertThrows(StateCorruptionException.class, () -> restarted.recoverTo(1));
    }

    @Test
    @DisplayName("Recuperación a un checkpoint anterior; las versiones siguientes no repiten números")
    void recoverTo_restoresEarlierCheckpoint() throws StateCorruptionException {
        OnlineClassifierService service = startService();
        newReadings(8, 0.9);
        service.runCycle();
        newReadings(8, 0.9);
        service.runCycle();
        assertEquals(2, service.currentState().getVersion());

        ModelState restored = service.recoverTo(1);
        assertEquals(1, restored.getVersion());
        assertEquals(1L, pointerRepository.findAll().get(0).getVersion());

        newReadings(8, 0.9);
        ClassifierCycleReport report = service.runCycle();
        assertEquals(3, report.modelVersion());
        assertEquals(3, checkpointRepository.count());
        assertThat(stateStore.recentVersions()).containsExactly(3L, 2L, 1L);

        assertThrows(StateCorruptionException.class, () -> service.recoverTo(42));
    }

    @Test
    @DisplayName("Lecturas de baja calidad reciben predicción pero no entrenan el modelo")
    void lowQualityReadings_arePredictedButNotTrained() {
        newReadings(6, 0.5);
        OnlineClassifierService service = startService();

        ClassifierCycleReport report = service.runCycle();

        assertEquals(12, report.predictionsWritten());
        assertEquals(0, report.modelVersion());
        assertNull(report.shuffleSeed());
        assertEquals(0, checkpointRepository.count());
    }

    @Test
    @DisplayName("Toda lectura aceptada acaba con predicción: la que llega por detrás de la marca se rechaza como tardía")
    void readingBehindClassifierWatermark_isRejectedNotLost() {
        OnlineClassifierService service = startService();
        assertEquals(1, ingestor.ingest(List.of(submission(now().minusMinutes(1)))).accepted());
        service.runCycle();

        IngestResultDTO late = ingestor.ingest(List.of(submission(now().minusMinutes(10))));
        service.runCycle();
        service.runCycle();

        assertEquals(0, late.accepted());
        assertEquals(ReadingIngestor.LATE_FIELD, late.rejections().get(0).field());
        assertEquals(readingRepository.count(), predictionRepository.count());
    }

    @Test
    @DisplayName("Ventana retenida por una lectura tardía: las ya predichas no se vuelven a predecir ni a entrenar")
    void reReadReadings_areNeitherPredictedNorTrainedTwice() {
        ReadingEntity first = reading("ST001", now().minusMinutes(3), 8.0);
        ReadingEntity third = reading("ST001", now().minusMinutes(1), 40.0);
        OnlineClassifierService service = startService();
        service.runCycle();
        long seenAfterFirstCycle = service.currentState().getSamplesSeen();

        // Marca retenida en la primera lectura y una lectura confirmada entre medias
        WatermarkEntity watermark = watermarkRepository
                .findById(new WatermarkEntity.Key(WindowConsumer.ONLINE_CLASSIFIER, "ST001")).orElseThrow();
        watermark.setLastTimestamp(first.getTimestamp());
        watermark.setLastReadingId(first.getId());
        watermarkRepository.save(watermark);
        ReadingEntity second = reading("ST001", now().minusMinutes(2), 20.0);

        ClassifierCycleReport report = service.runCycle();

        assertEquals(1, report.readings());
        assertEquals(1, report.predictionsWritten());
        assertEquals(seenAfterFirstCycle + 1, service.currentState().getSamplesSeen());
        for (ReadingEntity r : List.of(first, second, third)) {
            assertEquals(1, predictionRepository.countByReadingId(r.getId()));
        }
    }
}
