package smartaqms.compute.simulator;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Profile;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.compute.entity.StationEntity;
import smartaqms.compute.repository.StationRepository;
import smartaqms.compute.service.ReadingIngestor;
import smartaqms.domain.dto.reading.IngestResultDTO;
import smartaqms.domain.dto.reading.ReadingSubmissionDTO;
import smartaqms.domain.exception.TransientStoreException;
import smartaqms.domain.station.StationStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Alimentador sintético: produce lotes de {@code aqms.ingest.batch-size} lecturas al ritmo
 * {@code aqms.ingest.target-rate} (lecturas/minuto) y los envía por el {@link ReadingIngestor},
 * igual que haría un alimentador externo.
 */
@Slf4j
@Component
@Profile("simulator")
public class SyntheticReadingFeeder {

    private final ReadingIngestor ingestor;
    private final StationRepository stationRepository;
    private final TaskScheduler taskScheduler;
    private final AqmsProperties properties;
    private final Clock clock;
    private final SyntheticSensorModel model;

    private ScheduledFuture<?> schedule;

    public SyntheticReadingFeeder(ReadingIngestor ingestor, StationRepository stationRepository,
                                  TaskScheduler taskScheduler, AqmsProperties properties, Clock clock) {
        this.ingestor = ingestor;
        this.stationRepository = stationRepository;
        this.taskScheduler = taskScheduler;
        this.properties = properties;
        this.clock = clock;
        this.model = new SyntheticSensorModel(properties.getDetector().getSeed());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void start() {
        AqmsProperties.Ingest ingest = properties.getIngest();
        long periodMs = Math.max(1000L, 60_000L * ingest.getBatchSize() / Math.max(1, ingest.getTargetRate()));
        schedule = taskScheduler.scheduleAtFixedRate(this::feedBatch, Duration.ofMillis(periodMs));
        log.info("Synthetic feeder started: {} readings every {} ms (~{}/min)",
                ingest.getBatchSize(), periodMs, ingest.getTargetRate());
    }

    public IngestResultDTO feedBatch() {
        List<StationEntity> stations = stationRepository.findByStatusInOrderByIdAsc(
                List.of(StationStatus.ACTIVE, StationStatus.MAINTENANCE));
        if (stations.isEmpty()) {
            return IngestResultDTO.empty();
        }

        int batchSize = properties.getIngest().getBatchSize();
        int perStation = Math.max(1, batchSize / stations.size());
        LocalDateTime now = LocalDateTime.now(clock);
        long spacingMs = Math.max(1L, 60_000L * batchSize / Math.max(1, properties.getIngest().getTargetRate()) / perStation);

        List<ReadingSubmissionDTO> batch = new ArrayList<>(batchSize);
        for (StationEntity station : stations) {
            for (int i = perStation - 1; i >= 0 && batch.size() < batchSize; i--) {
                LocalDateTime ts = now.minusNanos(i * spacingMs * 1_000_000L);
                batch.add(ReadingSubmissionDTO.builder()
                        .stationId(station.getId())
                        .sensorId(station.getId() + "-MULTI")
                        .timestamp(ts)
                        .values(model.step(station.getId(), ts))
                        .confidence(model.confidence())
                        .build());
            }
        }

        try {
            IngestResultDTO result = ingestor.ingest(batch);
            log.debug("Synthetic batch: {} accepted, {} rejected, {} duplicates",
                    result.accepted(), result.rejected(), result.duplicates());
            return result;
        } catch (TransientStoreException e) {
            // El lote se regenera en el siguiente tick; las claves naturales hacen seguro el reenvío
            log.warn("Synthetic batch dropped, store unavailable: {}", e.getMessage());
            return IngestResultDTO.empty();
        }
    }

    @PreDestroy
    public void stop() {
        if (schedule != null) {
            schedule.cancel(false);
        }
    }
}
