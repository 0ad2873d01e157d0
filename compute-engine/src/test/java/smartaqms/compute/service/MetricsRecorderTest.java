package smartaqms.compute.service;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.compute.entity.SystemMetricEntity;
import smartaqms.compute.repository.SystemMetricRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MetricsRecorderTest {

    @Mock
    private SystemMetricRepository metricRepository;

    private SimpleMeterRegistry registry;
    private AqmsProperties properties;
    private MetricsRecorder metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        properties = new AqmsProperties();
        metrics = new MetricsRecorder(registry, metricRepository, properties,
                Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC));
    }

    private static Map<String, Double> byName(List<SystemMetricEntity> rows) {
        return rows.stream().collect(Collectors.toMap(SystemMetricEntity::getMetricName, SystemMetricEntity::getMetricValue));
    }

    @Test
    @DisplayName("Contadores de Micrometer por resultado de ingesta, ciclo degradado y tick descartado")
    void producers_updateMeters() {
        metrics.recordIngest(10, 2, 1, Duration.ofMillis(40));
        metrics.recordIngestFailure();
        metrics.recordDegradedCycle("detector", "density skipped");
        metrics.recordSkippedTick("classifier");
        metrics.recordModelVersion(7);

        assertEquals(10.0, registry.get(MetricsRecorder.METER_INGEST_READINGS).tag("outcome", "accepted").counter().count());
        assertEquals(2.0, registry.get(MetricsRecorder.METER_INGEST_READINGS).tag("outcome", "rejected").counter().count());
        assertEquals(1.0, metrics.ingestFailureCount());
        assertEquals(1.0, metrics.degradedCycleCount());
        assertEquals(1.0, metrics.skippedTickCount());
        assertEquals(7, metrics.modelVersion());
    }

    @Test
    @DisplayName("Volcado: una fila por métrica del sistema con los nombres persistidos")
    void flush_writesSystemMetricRows() {
        metrics.recordIngest(5, 1, 0, Duration.ofMillis(12));
        metrics.recordDetectorCycle(Duration.ofMillis(250), 3);
        metrics.recordClassifierCycle(Duration.ofMillis(400), 0.75, 4);
        metrics.recordAlertSuppressed();

        List<SystemMetricEntity> rows = metrics.flush();

        Map<String, Double> values = byName(rows);
        assertThat(values).containsKeys(MetricsRecorder.INGEST_THROUGHPUT, MetricsRecorder.INGEST_LATENCY,
                MetricsRecorder.DETECTOR_CYCLE_DURATION, MetricsRecorder.CLASSIFIER_CYCLE_DURATION,
                MetricsRecorder.MODEL_ACCURACY, MetricsRecorder.MODEL_VERSION, MetricsRecorder.UPTIME);
        assertEquals(250.0, values.get(MetricsRecorder.DETECTOR_CYCLE_DURATION));
        assertEquals(0.75, values.get(MetricsRecorder.MODEL_ACCURACY));
        assertEquals(4.0, values.get(MetricsRecorder.MODEL_VERSION));
        assertEquals(1.0, values.get(MetricsRecorder.INGEST_REJECTED));
        verify(metricRepository).saveAll(rows);
    }

    @Test
    @DisplayName("Fallo del almacén al volcar: el tick se descarta sin propagar el error")
    void flush_storeFailure_isDropped() {
        when(metricRepository.saveAll(anyList())).thenThrow(new DataAccessResourceFailureException("down"));

        List<SystemMetricEntity> rows = assertDoesNotThrow(() -> metrics.flush());

        assertThat(rows).isEmpty();
    }

    @Test
    @DisplayName("Con la planificación desactivada el volcado programado no escribe")
    void scheduledFlush_respectsSchedulingSwitch() {
        properties.getScheduling().setEnabled(false);

        metrics.scheduledFlush();

        verify(metricRepository, never()).saveAll(anyList());
    }
}
