package smartaqms.compute.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.compute.entity.ReadingEntity;
import smartaqms.compute.entity.StationEntity;
import smartaqms.compute.entity.WatermarkEntity;
import smartaqms.compute.repository.ReadingRepository;
import smartaqms.compute.repository.StationRepository;
import smartaqms.compute.repository.WatermarkRepository;
import smartaqms.domain.dto.reading.IngestResultDTO;
import smartaqms.domain.dto.reading.ReadingSubmissionDTO;
import smartaqms.domain.exception.TransientStoreException;
import smartaqms.domain.reading.Quantity;
import smartaqms.domain.station.StationStatus;
import smartaqms.domain.window.WindowConsumer;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ReadingIngestorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    @Mock
    private StationRepository stationRepository;
    @Mock
    private ReadingRepository readingRepository;
    @Mock
    private WatermarkRepository watermarkRepository;
    @Mock
    private MetricsRecorder metrics;
    @Mock
    private PlatformTransactionManager transactionManager;

    private ReadingIngestor ingestor;
    private AqmsProperties properties;

    @BeforeEach
    void setUp() {
        properties = new AqmsProperties();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        StoreRetryTemplate retry = new StoreRetryTemplate(new TransactionTemplate(transactionManager),
                properties.getStore().getRetry(), d -> { });
        ingestor = new ReadingIngestor(new ReadingValidator(properties, clock), stationRepository, readingRepository,
                watermarkRepository, retry, metrics, properties);

        when(stationRepository.findAllById(any())).thenReturn(List.of(StationEntity.builder()
                .id("ST001").zone("Downtown").status(StationStatus.ACTIVE).build()));
    }

    private static ReadingSubmissionDTO submission(int minute, double humidity) {
        return ReadingSubmissionDTO.builder()
                .stationId("ST001")
                .sensorId("ST001-S1")
                .timestamp(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC).minusMinutes(minute))
                .values(Map.of(Quantity.PM25, 10.0, Quantity.CO2, 430.0, Quantity.TEMPERATURE, 20.0,
                        Quantity.HUMIDITY, humidity, Quantity.WIND_SPEED, 2.5))
                .confidence(0.95)
                .build();
    }

    @Test
    @DisplayName("Almacén caído durante los 3 intentos: TransientStoreException y métrica de fallo de ingesta")
    void storeDown_exhaustsRetriesAndCountsFailure() {
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        when(readingRepository.findByStationIdInAndTimestampBetween(anyCollection(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("Connection refused"));

        TransientStoreException e = assertThrows(TransientStoreException.class,
                () -> ingestor.ingest(List.of(submission(1, 50.0), submission(2, 50.0))));

        assertEquals(3, e.getAttempts());
        verify(transactionManager, times(3)).rollback(any());
        verify(transactionManager, never()).commit(any());
        verify(readingRepository, never()).saveAll(anyList());
        verify(metrics).recordIngestFailure();
    }

    @Test
    @DisplayName("Lote sin lecturas válidas: no se abre transacción")
    void allRejected_doesNotTouchStore() {
        IngestResultDTO result = ingestor.ingest(List.of(submission(1, 150.0)));

        assertEquals(0, result.accepted());
        assertEquals(1, result.rejected());
        assertEquals("HUMIDITY", result.rejections().get(0).field());
        verify(transactionManager, never()).getTransaction(any());
    }

    @Test
    @DisplayName("Lecturas por encima del tamaño de lote se rechazan con el campo 'batch'")
    void overflowBeyondBatchSize_isRejected() {
        properties.getIngest().setBatchSize(1);

        IngestResultDTO result = ingestor.ingest(List.of(submission(1, 150.0), submission(2, 50.0)));

        assertEquals(2, result.rejected());
        assertEquals("batch", result.rejections().get(1).field());
    }

    @Test
    @DisplayName("Lectura por detrás de la marca de agua de un consumidor: rechazada como tardía, el resto se escribe")
    void readingBehindWatermark_isRejectedAsLate() {
        when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        when(readingRepository.findByStationIdInAndTimestampBetween(anyCollection(), any(), any()))
                .thenReturn(List.of());
        when(watermarkRepository.findByKeyStationIdIn(anyCollection())).thenReturn(List.of(WatermarkEntity.builder()
                .key(new WatermarkEntity.Key(WindowConsumer.ONLINE_CLASSIFIER, "ST001"))
                .lastTimestamp(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC).minusMinutes(5))
                .lastReadingId(7L)
                .updatedAt(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC))
                .build()));

        IngestResultDTO result = ingestor.ingest(List.of(submission(1, 50.0), submission(10, 50.0)));

        assertEquals(1, result.accepted());
        assertEquals(1, result.rejected());
        assertEquals(1, result.rejections().get(0).index());
        assertEquals(ReadingIngestor.LATE_FIELD, result.rejections().get(0).field());
        verify(readingRepository).saveAll(argThat((List<ReadingEntity> list) -> list.size() == 1));
        verify(metrics).recordLateReadings("ingest", 1);
        verify(transactionManager).commit(any());
    }
}
