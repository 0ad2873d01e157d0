package smartaqms.compute.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.compute.entity.ReadingEntity;
import smartaqms.compute.entity.StationEntity;
import smartaqms.compute.entity.WatermarkEntity;
import smartaqms.compute.repository.ReadingKeyView;
import smartaqms.compute.repository.ReadingRepository;
import smartaqms.compute.repository.StationRepository;
import smartaqms.compute.repository.WatermarkRepository;
import smartaqms.domain.dto.reading.IngestResultDTO;
import smartaqms.domain.dto.reading.ReadingSubmissionDTO;
import smartaqms.domain.dto.reading.RejectionDTO;
import smartaqms.domain.exception.ReadingValidationException;
import smartaqms.domain.exception.TransientStoreException;
import smartaqms.domain.reading.Quantity;
import smartaqms.domain.reading.ReadingStatus;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Valida y persiste lotes de lecturas.
 * <p>
 * Las lecturas inválidas se rechazan una a una sin abortar el lote. Las válidas se escriben
 * en una única transacción; los reenvíos (misma clave estación+sensor+timestamp) se cuentan
 * como duplicados y no se vuelven a escribir. Solo un fallo del almacén que persista tras los
 * reintentos llega al llamador, y en ese caso no queda nada del lote escrito.
 * <p>
 * Una lectura nueva cuyo timestamp queda por detrás de la marca de agua de algún consumidor
 * para su estación ya no entraría en ninguna ventana: se rechaza como tardía
 * (campo {@value #LATE_FIELD}) dentro de la misma transacción que la escritura.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReadingIngestor {

    public static final String LATE_FIELD = "late";

    private final ReadingValidator validator;
    private final StationRepository stationRepository;
    private final ReadingRepository readingRepository;
    private final WatermarkRepository watermarkRepository;
    private final StoreRetryTemplate storeRetry;
    private final MetricsRecorder metrics;
    private final AqmsProperties properties;

    public IngestResultDTO ingest(List<ReadingSubmissionDTO> batch) {
        if (batch == null || batch.isEmpty()) {
            return IngestResultDTO.empty();
        }
        long startNanos = System.nanoTime();

        Map<String, StationEntity> stations = stationRepository.findAllById(batch.stream()
                        .filter(Objects::nonNull)
                        .map(ReadingSubmissionDTO::stationId)
                        .filter(Objects::nonNull)
                        .collect(Collectors.toSet()))
                .stream()
                .collect(Collectors.toMap(StationEntity::getId, s -> s));

        int maxBatch = properties.getIngest().getBatchSize();
        List<RejectionDTO> rejections = new ArrayList<>();
        List<ReadingEntity> candidates = new ArrayList<>();
        List<Integer> candidateIndex = new ArrayList<>();
        Set<NaturalKey> seenInBatch = new HashSet<>();
        int duplicates = 0;

        for (int i = 0; i < batch.size(); i++) {
            ReadingSubmissionDTO submission = batch.get(i);
            String stationId = submission == null ? null : submission.stationId();
            if (i >= maxBatch) {
                rejections.add(new RejectionDTO(i, stationId, "batch", "Batch exceeds " + maxBatch + " readings"));
                continue;
            }
            try {
                validator.validate(submission, stations.get(stationId));
            } catch (ReadingValidationException e) {
                log.debug("Rejected reading #{} from {}: {}", i, stationId, e.getMessage());
                rejections.add(new RejectionDTO(i, stationId, e.getField(), e.getMessage()));
                continue;
            }
            ReadingEntity entity = toEntity(submission, validator.qualityScore(submission));
            if (!seenInBatch.add(NaturalKey.of(entity))) {
                duplicates++;
                continue;
            }
            candidates.add(entity);
            candidateIndex.add(i);
        }

        int stored = 0;
        if (!candidates.isEmpty()) {
            PersistOutcome outcome;
            try {
                outcome = storeRetry.execute("Ingest batch of " + candidates.size(),
                        e -> e instanceof DataIntegrityViolationException,
                        () -> persist(candidates));
            } catch (TransientStoreException e) {
                metrics.recordIngestFailure();
                throw e;
            }
            stored = outcome.stored();
            duplicates += outcome.duplicates();
            outcome.late().forEach((position, horizon) -> {
                ReadingEntity late = candidates.get(position);
                rejections.add(new RejectionDTO(candidateIndex.get(position), late.getStationId(), LATE_FIELD,
                        "Reading at " + late.getTimestamp() + " is behind the processed horizon " + horizon));
            });
            if (!outcome.late().isEmpty()) {
                metrics.recordLateReadings("ingest", outcome.late().size());
                rejections.sort(Comparator.comparingInt(RejectionDTO::index));
            }
        }

        Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
        metrics.recordIngest(stored, rejections.size(), duplicates, latency);
        if (!rejections.isEmpty()) {
            log.warn("Ingest batch: {} accepted, {} rejected, {} duplicates", stored, rejections.size(), duplicates);
        } else {
            log.debug("Ingest batch: {} accepted, {} duplicates in {} ms", stored, duplicates, latency.toMillis());
        }

        return IngestResultDTO.builder()
                .accepted(stored)
                .rejected(rejections.size())
                .duplicates(duplicates)
                .rejections(List.copyOf(rejections))
                .build();
    }

    /**
     * Una transacción: descarta las claves ya persistidas y las lecturas tardías, inserta el
     * resto y avanza el last-seen de cada estación. Se recalcula entera en cada reintento.
     */
    private PersistOutcome persist(List<ReadingEntity> candidates) {
        Set<NaturalKey> existing = existingKeys(candidates);
        Map<String, LocalDateTime> horizons = processedHorizons(candidates);
        List<ReadingEntity> fresh = new ArrayList<>(candidates.size());
        Map<Integer, LocalDateTime> late = new TreeMap<>();
        int alreadyStored = 0;
        for (int i = 0; i < candidates.size(); i++) {
            ReadingEntity c = candidates.get(i);
            if (existing.contains(NaturalKey.of(c))) {
                alreadyStored++;
                continue;
            }
            LocalDateTime horizon = horizons.get(c.getStationId());
            if (horizon != null && c.getTimestamp().isBefore(horizon)) {
                late.put(i, horizon);
                continue;
            }
            // Copia nueva por intento: un rollback deja los ids asignados en las instancias previas
            fresh.add(copyOf(c));
        }
        readingRepository.saveAll(fresh);
        readingRepository.flush();

        Map<String, LocalDateTime> lastSeen = new HashMap<>();
        for (ReadingEntity r : fresh) {
            lastSeen.merge(r.getStationId(), r.getTimestamp(), (a, b) -> a.isAfter(b) ? a : b);
        }
        lastSeen.forEach(stationRepository::advanceLastSeen);

        return new PersistOutcome(fresh.size(), alreadyStored, late);
    }

    /**
     * Marca de agua más avanzada por estación entre todos los consumidores. Una lectura con el
     * mismo timestamp sigue entrando (su id es mayor), una anterior ya no.
     */
    private Map<String, LocalDateTime> processedHorizons(List<ReadingEntity> candidates) {
        Set<String> stationIds = candidates.stream().map(ReadingEntity::getStationId).collect(Collectors.toSet());
        Map<String, LocalDateTime> horizons = new HashMap<>();
        for (WatermarkEntity w : watermarkRepository.findByKeyStationIdIn(stationIds)) {
            horizons.merge(w.getKey().getStationId(), w.getLastTimestamp(), (a, b) -> a.isAfter(b) ? a : b);
        }
        return horizons;
    }

    private Set<NaturalKey> existingKeys(List<ReadingEntity> candidates) {
        Set<String> stationIds = new HashSet<>();
        LocalDateTime from = null;
        LocalDateTime to = null;
        for (ReadingEntity c : candidates) {
            stationIds.add(c.getStationId());
            if (from == null || c.getTimestamp().isBefore(from)) from = c.getTimestamp();
            if (to == null || c.getTimestamp().isAfter(to)) to = c.getTimestamp();
        }
        Set<NaturalKey> keys = new HashSet<>();
        for (ReadingKeyView view : readingRepository.findByStationIdInAndTimestampBetween(stationIds, from, to)) {
            keys.add(new NaturalKey(view.getStationId(), view.getSensorId(), view.getTimestamp()));
        }
        return keys;
    }

    private static ReadingEntity toEntity(ReadingSubmissionDTO s, double quality) {
        Map<Quantity, Double> v = s.values();
        LocalDateTime ts = s.timestamp().truncatedTo(ChronoUnit.MICROS);
        double pm25 = v.get(Quantity.PM25);
        double co2 = v.get(Quantity.CO2);
        return ReadingEntity.builder()
                .stationId(s.stationId())
                .sensorId(s.sensorId())
                .timestamp(ts)
                .partitionKey(ReadingEntity.partitionOf(ts))
                .pm25(pm25)
                .co2(co2)
                .temperature(v.get(Quantity.TEMPERATURE))
                .humidity(v.get(Quantity.HUMIDITY))
                .windSpeed(v.get(Quantity.WIND_SPEED))
                .pm10(v.get(Quantity.PM10))
                .no2(v.get(Quantity.NO2))
                .o3(v.get(Quantity.O3))
                .windDirection(v.get(Quantity.WIND_DIRECTION))
                .pressure(v.get(Quantity.PRESSURE))
                .qualityScore(quality)
                .status(ReadingStatus.of(pm25, co2))
                .build();
    }

    private static ReadingEntity copyOf(ReadingEntity r) {
        return ReadingEntity.builder()
                .stationId(r.getStationId())
                .sensorId(r.getSensorId())
                .timestamp(r.getTimestamp())
                .partitionKey(r.getPartitionKey())
                .pm25(r.getPm25())
                .co2(r.getCo2())
                .temperature(r.getTemperature())
                .humidity(r.getHumidity())
                .windSpeed(r.getWindSpeed())
                .pm10(r.getPm10())
                .no2(r.getNo2())
                .o3(r.getO3())
                .windDirection(r.getWindDirection())
                .pressure(r.getPressure())
                .qualityScore(r.getQualityScore())
                .status(r.getStatus())
                .build();
    }

    private record PersistOutcome(int stored, int duplicates, Map<Integer, LocalDateTime> late) {
    }

    private record NaturalKey(String stationId, String sensorId, LocalDateTime timestamp) {
        static NaturalKey of(ReadingEntity r) {
            return new NaturalKey(r.getStationId(), r.getSensorId(), r.getTimestamp());
        }
    }
}
