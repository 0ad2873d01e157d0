package smartaqms.compute.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import smartaqms.compute.AbstractStoreIntegrationTest;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.compute.entity.ReadingEntity;
import smartaqms.compute.entity.StationEntity;
import smartaqms.domain.exception.ResourceNotFoundException;
import smartaqms.domain.reading.ReadingStatus;
import smartaqms.domain.station.StationStatus;
import smartaqms.domain.window.WindowConsumer;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class WindowReaderIntegrationTest extends AbstractStoreIntegrationTest {

    private static final Duration HOUR = Duration.ofMinutes(60);

    @Autowired
    private WindowReader windowReader;
    @Autowired
    private AqmsProperties properties;
    @Autowired
    private MetricsRecorder metrics;

    @BeforeEach
    void setUp() {
        station("ST001", "Downtown");
    }

    @Test
    @DisplayName("Tras confirmar la marca de agua, las mismas lecturas no vuelven a entrar en la ventana")
    void committedReadings_areNotReprocessed() {
        LocalDateTime now = now();
        reading("ST001", now.minusMinutes(30), 10);
        reading("ST001", now.minusMinutes(20), 11);
        reading("ST001", now.minusMinutes(10), 12);

        ReadingWindow first = windowReader.read(WindowConsumer.OUTLIER_DETECTOR, "ST001", HOUR);
        assertEquals(3, first.size());
        assertTrue(windowReader.commit(first));

        assertTrue(windowReader.read(WindowConsumer.OUTLIER_DETECTOR, "ST001", HOUR).isEmpty());

        ReadingEntity late = reading("ST001", now.minusMinutes(5), 13);
        ReadingWindow second = windowReader.read(WindowConsumer.OUTLIER_DETECTOR, "ST001", HOUR);
        assertThat(second.readings()).extracting(ReadingEntity::getId).containsExactly(late.getId());
    }

    @Test
    @DisplayName("La marca de agua nunca retrocede")
    void watermark_isMonotonic() {
        LocalDateTime now = now();
        reading("ST001", now.minusMinutes(30), 10);
        ReadingWindow older = windowReader.read(WindowConsumer.OUTLIER_DETECTOR, "ST001", HOUR);
        reading("ST001", now.minusMinutes(10), 11);
        ReadingWindow newer = windowReader.read(WindowConsumer.OUTLIER_DETECTOR, "ST001", HOUR);

        assertTrue(windowReader.commit(newer));
        assertFalse(windowReader.commit(older));
        assertFalse(windowReader.commit(newer));
        assertEquals(now.minusMinutes(10), windowReader.watermarkOf(WindowConsumer.OUTLIER_DETECTOR, "ST001"));
    }

    @Test
    @DisplayName("Lectura confirmada tras leer la ventana y dentro de su rango: la marca se queda antes de ella")
    void readingCommittedBehindCursor_holdsWatermarkBeforeIt() {
        LocalDateTime now = now();
        ReadingEntity first = reading("ST001", now.minusMinutes(3), 10);
        ReadingEntity third = reading("ST001", now.minusMinutes(1), 12);
        ReadingWindow window = windowReader.read(WindowConsumer.ONLINE_CLASSIFIER, "ST001", HOUR);
        double lateBefore = metrics.lateReadingCount();

        // Otra transacción confirma una lectura anterior a la última ya leída
        ReadingEntity second = reading("ST001", now.minusMinutes(2), 11);

        assertTrue(windowReader.commit(window));
        assertEquals(first.getTimestamp(), windowReader.watermarkOf(WindowConsumer.ONLINE_CLASSIFIER, "ST001"));
        assertEquals(lateBefore + 1, metrics.lateReadingCount());

        ReadingWindow next = windowReader.read(WindowConsumer.ONLINE_CLASSIFIER, "ST001", HOUR);
        assertThat(next.readings()).extracting(ReadingEntity::getId)
                .containsExactly(second.getId(), third.getId());
        assertTrue(windowReader.commit(next));
        assertEquals(third.getTimestamp(), windowReader.watermarkOf(WindowConsumer.ONLINE_CLASSIFIER, "ST001"));
    }

    @Test
    @DisplayName("Lectura tardía anterior a toda la ventana: la marca no avanza y el siguiente ciclo la incluye")
    void readingCommittedBeforeWholeWindow_keepsWatermark() {
        LocalDateTime now = now();
        ReadingEntity newest = reading("ST001", now.minusMinutes(1), 12);
        ReadingWindow window = windowReader.read(WindowConsumer.OUTLIER_DETECTOR, "ST001", HOUR);
        ReadingEntity older = reading("ST001", now.minusMinutes(2), 11);

        assertFalse(windowReader.commit(window));
        assertNull(windowReader.watermarkOf(WindowConsumer.OUTLIER_DETECTOR, "ST001"));

        assertThat(windowReader.read(WindowConsumer.OUTLIER_DETECTOR, "ST001", HOUR).readings())
                .extracting(ReadingEntity::getId)
                .containsExactly(older.getId(), newest.getId());
    }

    @Test
    @DisplayName("Cada consumidor tiene su propia marca de agua")
    void consumers_areIndependent() {
        reading("ST001", now().minusMinutes(15), 10);
        windowReader.commit(windowReader.read(WindowConsumer.OUTLIER_DETECTOR, "ST001", HOUR));

        assertEquals(1, windowReader.read(WindowConsumer.ONLINE_CLASSIFIER, "ST001", HOUR).size());
        assertNull(windowReader.watermarkOf(WindowConsumer.ONLINE_CLASSIFIER, "ST001"));
    }

    @Test
    @DisplayName("Lecturas fuera de la duración móvil o con timestamp futuro no entran")
    void outOfWindowAndFutureReadings_areExcluded() {
        LocalDateTime now = now();
        reading("ST001", now.minusHours(2), 10);
        ReadingEntity inside = reading("ST001", now.minusMinutes(15), 11);
        reading("ST001", now.plusMinutes(3), 12);

        ReadingWindow window = windowReader.read(WindowConsumer.OUTLIER_DETECTOR, "ST001", HOUR);

        assertThat(window.readings()).extracting(ReadingEntity::getId).containsExactly(inside.getId());
    }

    @Test
    @DisplayName("Empates de timestamp: el cursor (ts, id) no pierde ni repite lecturas entre páginas")
    void sameTimestamp_pagesByIdWithoutLoss() {
        LocalDateTime ts = now().minusMinutes(5);
        for (int i = 0; i < 3; i++) {
            readingRepository.save(ReadingEntity.builder()
                    .stationId("ST001").sensorId("S" + i).timestamp(ts).partitionKey(ReadingEntity.partitionOf(ts))
                    .pm25(10.0).co2(420.0).temperature(20.0).humidity(50.0).windSpeed(2.0)
                    .qualityScore(0.9).status(ReadingStatus.NORMAL).build());
        }
        int previousMax = properties.getWindow().getMaxReadings();
        properties.getWindow().setMaxReadings(2);
        try {
            ReadingWindow page1 = windowReader.read(WindowConsumer.OUTLIER_DETECTOR, "ST001", HOUR);
            windowReader.commit(page1);
            ReadingWindow page2 = windowReader.read(WindowConsumer.OUTLIER_DETECTOR, "ST001", HOUR);
            windowReader.commit(page2);

            assertEquals(2, page1.size());
            assertEquals(1, page2.size());
            assertThat(page2.last().getId()).isGreaterThan(page1.last().getId());
            assertTrue(windowReader.read(WindowConsumer.OUTLIER_DETECTOR, "ST001", HOUR).isEmpty());
        } finally {
            properties.getWindow().setMaxReadings(previousMax);
        }
    }

    @Test
    @DisplayName("Ventana de zona omite estaciones retiradas; estación desconocida -> 404")
    void zoneWindows_skipRetiredStations() {
        station("ST002", "Downtown");
        StationEntity retired = stationRepository.findById("ST002").orElseThrow();
        retired.setStatus(StationStatus.RETIRED);
        stationRepository.save(retired);

        List<ReadingWindow> windows = windowReader.readZone(WindowConsumer.OUTLIER_DETECTOR, "Downtown", HOUR);

        assertThat(windows).extracting(ReadingWindow::stationId).containsExactly("ST001");
        assertThrows(ResourceNotFoundException.class,
                () -> windowReader.read(WindowConsumer.OUTLIER_DETECTOR, "ST999", HOUR));
    }

    @Test
    @DisplayName("Particiones mensuales que abarca un intervalo")
    void partitionsBetween_spansMonths() {
        assertThat(WindowReader.partitionsBetween(LocalDateTime.of(2023, 12, 31, 23, 0), LocalDateTime.of(2024, 2, 1, 0, 0)))
                .containsExactly("2023-12", "2024-01", "2024-02");
    }
}
